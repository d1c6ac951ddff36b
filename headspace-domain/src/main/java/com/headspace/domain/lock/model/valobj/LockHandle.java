package com.headspace.domain.lock.model.valobj;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 锁句柄。close 即释放函数，可重复调用；未获取成功的句柄 close 为空操作。
 */
public final class LockHandle implements AutoCloseable {

    private final LockKey key;
    private final boolean acquired;
    private final Runnable releaseAction;
    private final AtomicBoolean released;

    public LockHandle(LockKey key, boolean acquired, Runnable releaseAction) {
        this.key = key;
        this.acquired = acquired;
        this.releaseAction = releaseAction;
        this.released = new AtomicBoolean(!acquired);
    }

    public static LockHandle notAcquired(LockKey key) {
        return new LockHandle(key, false, null);
    }

    public LockKey getKey() {
        return key;
    }

    public boolean isAcquired() {
        return acquired;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true) && releaseAction != null) {
            releaseAction.run();
        }
    }
}
