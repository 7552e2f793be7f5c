package com.work.exchange.core.event;

public enum OfferEventType {
    OFFER_PREPARED("OfferPrepared"),
    OFFER_PRESENTED("OfferPresented"),
    OFFER_CANCELED("OfferCanceled"),
    OFFER_SETTLED("OfferSettled"),
    OFFER_RECEIPT("OfferReceipt"),
    ESCROW_EXECUTION_FAILED("EscrowExecutionFailed"),
    OFFER_REJECTED("OfferRejected");

    private final String eventName;

    OfferEventType(String eventName) {
        this.eventName = eventName;
    }

    /**
     * 对外暴露的事件名（与链上合约事件同名）。
     */
    public String getEventName() {
        return eventName;
    }

    public static OfferEventType fromEventName(String eventName) {
        for (OfferEventType t : values()) {
            if (t.eventName.equals(eventName)) {
                return t;
            }
        }
        throw new IllegalArgumentException("未知事件类型: " + eventName);
    }
}
