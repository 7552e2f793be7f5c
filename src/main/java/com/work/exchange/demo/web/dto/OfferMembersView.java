package com.work.exchange.demo.web.dto;

public class OfferMembersView {

    private String providerOwner;
    private String consumer;

    public String getProviderOwner() {
        return providerOwner;
    }

    public void setProviderOwner(String providerOwner) {
        this.providerOwner = providerOwner;
    }

    public String getConsumer() {
        return consumer;
    }

    public void setConsumer(String consumer) {
        this.consumer = consumer;
    }
}
