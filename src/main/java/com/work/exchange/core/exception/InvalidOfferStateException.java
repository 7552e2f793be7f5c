package com.work.exchange.core.exception;

/**
 * offer 当前状态不允许执行请求的状态迁移。
 */
public class InvalidOfferStateException extends ExchangeException {

    public static final String NEUTRAL_ONLY = "neutral state only";
    public static final String PENDING_ONLY = "pending state only";
    public static final String OUTDATED = "outdated offer";

    public InvalidOfferStateException(String message) {
        super(message);
    }
}
