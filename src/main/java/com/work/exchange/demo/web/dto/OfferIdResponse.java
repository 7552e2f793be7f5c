package com.work.exchange.demo.web.dto;

public class OfferIdResponse {

    private String offerId;

    public String getOfferId() {
        return offerId;
    }

    public void setOfferId(String offerId) {
        this.offerId = offerId;
    }
}
