package com.work.exchange.core.event;

/**
 * 生命周期事件。seq 由事件日志在追加时分配，追加前为 null。
 */
public final class OfferEvent {

    private final Long seq;
    private final OfferEventType type;
    private final String offerId;
    private final String by;
    private final long at;
    /**
     * OfferReceipt 为 receipt 十六进制串，EscrowExecutionFailed 为失败原因，其余为 null。
     */
    private final String data;

    public OfferEvent(Long seq, OfferEventType type, String offerId, String by, long at, String data) {
        this.seq = seq;
        this.type = type;
        this.offerId = offerId;
        this.by = by;
        this.at = at;
        this.data = data;
    }

    public static OfferEvent of(OfferEventType type, String offerId, String by, long at) {
        return new OfferEvent(null, type, offerId, by, at, null);
    }

    public static OfferEvent of(OfferEventType type, String offerId, String by, long at, String data) {
        return new OfferEvent(null, type, offerId, by, at, data);
    }

    public OfferEvent withSeq(long seq) {
        return new OfferEvent(seq, type, offerId, by, at, data);
    }

    public Long getSeq() {
        return seq;
    }

    public OfferEventType getType() {
        return type;
    }

    public String getOfferId() {
        return offerId;
    }

    public String getBy() {
        return by;
    }

    public long getAt() {
        return at;
    }

    public String getData() {
        return data;
    }

    @Override
    public String toString() {
        return type.getEventName() + "{offerId=" + offerId + ", by=" + by + ", at=" + at
                + (data == null ? "" : ", data=" + data) + "}";
    }
}
