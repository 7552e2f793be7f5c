package com.work.exchange.core.exception;

/**
 * 入参不合法：dataId 格式错误/重复、数量超限、escrow 地址未注册等。
 */
public class InvalidOfferArgumentException extends ExchangeException {

    public static final String INVALID_DATA_ID = "invalid dataId";
    public static final String DUPLICATE_DATA_ID = "duplicate dataId";
    public static final String INVALID_CONSUMER = "invalid consumer";
    public static final String NOT_CONTRACT_ADDRESS = "not contract address";
    public static final String INVALID_ESCROW_SELECTOR = "invalid escrow selector";
    public static final String INVALID_ESCROW_ARGS = "invalid escrow args";
    public static final String APP_NOT_FOUND = "offeror app does not exist";

    public InvalidOfferArgumentException(String message) {
        super(message);
    }

    public static InvalidOfferArgumentException dataIdsPerCallExceeded(int max) {
        return new InvalidOfferArgumentException("dataIds length exceeded (max " + max + ")");
    }

    public static InvalidOfferArgumentException bundleSizeExceeded(int max) {
        return new InvalidOfferArgumentException("bundle size exceeded (max " + max + ")");
    }
}
