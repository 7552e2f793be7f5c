package com.work.exchange.core.exception;

/**
 * 在等待时间内未能拿到 orderbook 全局锁，调用方应当重试。
 */
public class LockNotAcquiredException extends ExchangeException {

    public LockNotAcquiredException(String message) {
        super(message);
    }

    public LockNotAcquiredException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
