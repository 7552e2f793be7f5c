package com.work.exchange.core.exception;

/**
 * 调用方不具备操作该 offer 的身份（不是 provider app 的 owner，或不是 consumer）。
 */
public class UnauthorizedException extends ExchangeException {

    public static final String REQUIRED_AUTHORITY = "should have required authority";

    public UnauthorizedException() {
        super(REQUIRED_AUTHORITY);
    }

    public UnauthorizedException(String message) {
        super(message);
    }
}
