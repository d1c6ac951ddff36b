package com.headspace.domain.lock.service;

import com.headspace.domain.lock.adapter.gateway.IAdvisoryLockBackend;
import com.headspace.domain.lock.adapter.gateway.IAdvisoryLockSession;
import com.headspace.domain.lock.model.valobj.LockHandle;
import com.headspace.domain.lock.model.valobj.LockKey;
import com.headspace.types.enums.LockNamespaceEnum;
import com.headspace.types.enums.ResponseCode;
import com.headspace.types.exception.AppException;
import com.headspace.types.exception.LockReentrancyException;
import com.headspace.types.exception.LockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 实体级跨进程互斥：基于专用会话上的 advisory lock，与调用方的事务边界无关。
 * <p>
 * 每次获取都占用一个独立会话，释放时无条件 unlock 并关闭会话。
 * 当前线程持有的锁记录在线程本地集合中，用于在接触后端之前识别重入。
 * </p>
 */
@Slf4j
@Service
public class AdvisoryLockManager {

    private final IAdvisoryLockBackend lockBackend;
    private final ThreadLocal<Set<LockKey>> heldLocks;

    public AdvisoryLockManager(IAdvisoryLockBackend lockBackend) {
        this.lockBackend = lockBackend;
        this.heldLocks = ThreadLocal.withInitial(ConcurrentHashMap::newKeySet);
    }

    public LockHandle acquireBlocking(LockNamespaceEnum namespace, long entityId, Duration timeout) {
        return acquireBlocking(LockKey.of(namespace, entityId), timeout);
    }

    /**
     * 阻塞获取实体锁。
     *
     * @throws LockReentrancyException 当前线程已持有该锁，立即抛出
     * @throws LockTimeoutException    超时未获取，会话已清理
     */
    public LockHandle acquireBlocking(LockKey key, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Lock timeout must be positive");
        }
        Set<LockKey> held = heldLocks.get();
        if (held.contains(key)) {
            throw new LockReentrancyException(key.namespace(), key.key());
        }
        IAdvisoryLockSession session;
        try {
            session = lockBackend.openSession();
        } catch (RuntimeException ex) {
            throw new AppException(ResponseCode.LOCK_BACKEND_ERROR.getCode(),
                    "Failed to open advisory lock session. key=" + key, ex);
        }
        boolean locked;
        try {
            locked = session.lock(key, timeout);
        } catch (RuntimeException ex) {
            cleanup(session, key);
            if (ex instanceof AppException) {
                throw ex;
            }
            throw new AppException(ResponseCode.LOCK_BACKEND_ERROR.getCode(),
                    "Advisory lock acquisition failed. key=" + key, ex);
        }
        if (!locked) {
            cleanup(session, key);
            log.warn("Advisory lock timed out. key={}, timeoutMs={}", key, timeout.toMillis());
            throw new LockTimeoutException(key.namespace(), key.key(), timeout.toMillis());
        }
        held.add(key);
        return new LockHandle(key, true, () -> release(held, key, session));
    }

    public LockHandle acquireNonBlocking(LockNamespaceEnum namespace, long entityId) {
        return acquireNonBlocking(LockKey.of(namespace, entityId));
    }

    /**
     * 非阻塞获取：锁被占用、当前线程重入或后端异常时返回未获取的句柄。
     */
    public LockHandle acquireNonBlocking(LockKey key) {
        Set<LockKey> held = heldLocks.get();
        if (held.contains(key)) {
            log.debug("Advisory lock already held by current thread, skip. key={}", key);
            return LockHandle.notAcquired(key);
        }
        IAdvisoryLockSession session;
        try {
            session = lockBackend.openSession();
        } catch (RuntimeException ex) {
            log.warn("Failed to open advisory lock session. key={}, error={}", key, ex.getMessage());
            return LockHandle.notAcquired(key);
        }
        boolean locked;
        try {
            locked = session.tryLock(key);
        } catch (RuntimeException ex) {
            log.warn("Advisory try-lock failed. key={}, error={}", key, ex.getMessage());
            cleanup(session, key);
            return LockHandle.notAcquired(key);
        }
        if (!locked) {
            cleanup(session, key);
            return LockHandle.notAcquired(key);
        }
        held.add(key);
        return new LockHandle(key, true, () -> release(held, key, session));
    }

    public boolean isHeldByCurrentThread(LockKey key) {
        return key != null && heldLocks.get().contains(key);
    }

    public Set<LockKey> heldByCurrentThread() {
        return Collections.unmodifiableSet(heldLocks.get());
    }

    private void release(Set<LockKey> held, LockKey key, IAdvisoryLockSession session) {
        held.remove(key);
        cleanup(session, key);
    }

    // unlock runs even when the grant was never observed
    private void cleanup(IAdvisoryLockSession session, LockKey key) {
        try {
            session.unlock(key);
        } catch (RuntimeException ex) {
            log.warn("Advisory unlock failed. key={}, error={}", key, ex.getMessage());
        }
        try {
            session.close();
        } catch (RuntimeException ex) {
            log.warn("Advisory lock session close failed. key={}, error={}", key, ex.getMessage());
        }
    }
}
