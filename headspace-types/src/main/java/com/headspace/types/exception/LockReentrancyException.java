package com.headspace.types.exception;

import com.headspace.types.enums.ResponseCode;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 当前线程已持有同一实体锁时再次阻塞获取。
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class LockReentrancyException extends AppException {

    private static final long serialVersionUID = 2284519306719271125L;

    private final int namespace;
    private final int key;

    public LockReentrancyException(int namespace, int key) {
        super(ResponseCode.LOCK_REENTRANCY.getCode(),
                "Advisory lock already held by current thread. namespace=" + namespace + ", key=" + key);
        this.namespace = namespace;
        this.key = key;
    }
}
