package com.work.exchange.demo.web.dto;

import java.util.List;

/**
 * offer 查询视图。
 */
public class OfferView {

    private String id;
    private String provider;
    private String consumer;
    private String escrowHandler;
    private String escrowSelector;
    private String escrowArgs;
    private List<String> dataIds;
    private long at;
    private long until;
    private String status;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getConsumer() {
        return consumer;
    }

    public void setConsumer(String consumer) {
        this.consumer = consumer;
    }

    public String getEscrowHandler() {
        return escrowHandler;
    }

    public void setEscrowHandler(String escrowHandler) {
        this.escrowHandler = escrowHandler;
    }

    public String getEscrowSelector() {
        return escrowSelector;
    }

    public void setEscrowSelector(String escrowSelector) {
        this.escrowSelector = escrowSelector;
    }

    public String getEscrowArgs() {
        return escrowArgs;
    }

    public void setEscrowArgs(String escrowArgs) {
        this.escrowArgs = escrowArgs;
    }

    public List<String> getDataIds() {
        return dataIds;
    }

    public void setDataIds(List<String> dataIds) {
        this.dataIds = dataIds;
    }

    public long getAt() {
        return at;
    }

    public void setAt(long at) {
        this.at = at;
    }

    public long getUntil() {
        return until;
    }

    public void setUntil(long until) {
        this.until = until;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }
}
