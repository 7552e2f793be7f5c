package com.work.exchange.core.model;

/**
 * offer 双方身份：provider app 的 owner 与 consumer。escrow handler 通过它确定转账双方。
 */
public final class OfferMembers {

    private final String providerOwner;
    private final String consumer;

    public OfferMembers(String providerOwner, String consumer) {
        this.providerOwner = providerOwner;
        this.consumer = consumer;
    }

    public String getProviderOwner() {
        return providerOwner;
    }

    public String getConsumer() {
        return consumer;
    }
}
