package com.headspace.domain.lock.adapter.gateway;

import com.headspace.domain.lock.model.valobj.LockKey;

import java.time.Duration;

/**
 * 专用锁会话。锁的持有范围是会话本身，关闭会话即释放其持有的所有锁。
 */
public interface IAdvisoryLockSession extends AutoCloseable {

    /**
     * 阻塞获取锁，等待上限仅作用于本次获取。
     *
     * @return false 表示等待超时
     */
    boolean lock(LockKey key, Duration timeout);

    boolean tryLock(LockKey key);

    /**
     * 释放锁；未持有时为空操作。
     */
    void unlock(LockKey key);

    @Override
    void close();
}
