package com.work.exchange.core.exception;

public class OfferNotFoundException extends ExchangeException {

    public static final String OFFER_NOT_FOUND = "offer does not exist";

    public OfferNotFoundException(String message) {
        super(message);
    }
}
