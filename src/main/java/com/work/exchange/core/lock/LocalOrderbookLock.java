package com.work.exchange.core.lock;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static com.work.exchange.core.support.ValidationUtils.requireNonEmpty;
import static com.work.exchange.core.support.ValidationUtils.requireNonNull;

/**
 * 单进程实现。同一线程可以重入（escrow handler 回调 facade 时会发生），
 * 重入后的状态变更由 orderbook 的 ReentrancyGuard 拒绝。
 */
public class LocalOrderbookLock implements OrderbookLock {

    private final ReentrantLock lock = new ReentrantLock(true);

    @Override
    public boolean tryLock(String lockOwner, Duration wait, Duration ttl) {
        requireNonEmpty(lockOwner, "lockOwner");
        requireNonNull(wait, "wait");
        try {
            return lock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void unlock(String lockOwner) {
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
        }
    }
}
