package com.work.exchange.core.exception;

/**
 * escrow 调用尚未返回时，又有状态变更操作进入 orderbook。
 */
public class ReentrantCallException extends ExchangeException {

    public static final String REENTRANT_CALL = "reentrant call";

    public ReentrantCallException() {
        super(REENTRANT_CALL);
    }
}
