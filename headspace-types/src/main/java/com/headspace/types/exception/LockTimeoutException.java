package com.headspace.types.exception;

import com.headspace.types.enums.ResponseCode;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 在超时时间内未能取得实体锁。
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class LockTimeoutException extends AppException {

    private static final long serialVersionUID = -4410236021793384507L;

    private final int namespace;
    private final int key;
    private final long timeoutMillis;

    public LockTimeoutException(int namespace, int key, long timeoutMillis) {
        super(ResponseCode.LOCK_TIMEOUT.getCode(),
                "Advisory lock timed out. namespace=" + namespace + ", key=" + key + ", timeoutMs=" + timeoutMillis);
        this.namespace = namespace;
        this.key = key;
        this.timeoutMillis = timeoutMillis;
    }
}
