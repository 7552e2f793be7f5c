package com.work.exchange.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * prepare 入参：provider app 名称、consumer 身份、escrow 三元组与首批 dataIds。
 */
public final class PrepareOfferCommand {

    private final String provider;
    private final String consumer;
    private final Escrow escrow;
    private final List<String> dataIds;

    public PrepareOfferCommand(String provider, String consumer, Escrow escrow, List<String> dataIds) {
        this.provider = provider;
        this.consumer = consumer;
        this.escrow = escrow;
        this.dataIds = dataIds == null ? new ArrayList<>() : new ArrayList<>(dataIds);
    }

    public String getProvider() {
        return provider;
    }

    public String getConsumer() {
        return consumer;
    }

    public Escrow getEscrow() {
        return escrow;
    }

    public List<String> getDataIds() {
        return dataIds;
    }
}
