package com.work.exchange.core.escrow;

import com.work.exchange.core.exception.ReentrantCallException;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * orderbook 级别的“外部调用进行中”标记。
 * <p>escrow 调用期间标记置位，任何状态变更操作进入都会失败；标记在所有退出路径上清除。</p>
 */
public class ReentrancyGuard {

    private final AtomicBoolean entered = new AtomicBoolean(false);

    public void requireNotEntered() {
        if (entered.get()) {
            throw new ReentrantCallException();
        }
    }

    public boolean isEntered() {
        return entered.get();
    }

    public <T> T runGuarded(Supplier<T> work) {
        if (!entered.compareAndSet(false, true)) {
            throw new ReentrantCallException();
        }
        try {
            return work.get();
        } finally {
            entered.set(false);
        }
    }
}
