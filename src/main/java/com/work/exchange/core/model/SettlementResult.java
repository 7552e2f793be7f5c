package com.work.exchange.core.model;

/**
 * settle 的返回值。escrow 失败不是异常，而是 settled=false + failureReason，offer 保持 PENDING 可重试。
 */
public final class SettlementResult {

    private final String offerId;
    private final boolean settled;
    private final String receipt;
    private final String failureReason;

    private SettlementResult(String offerId, boolean settled, String receipt, String failureReason) {
        this.offerId = offerId;
        this.settled = settled;
        this.receipt = receipt;
        this.failureReason = failureReason;
    }

    public static SettlementResult settled(String offerId, String receipt) {
        return new SettlementResult(offerId, true, receipt, null);
    }

    public static SettlementResult failed(String offerId, String reason) {
        return new SettlementResult(offerId, false, null, reason);
    }

    public String getOfferId() {
        return offerId;
    }

    public boolean isSettled() {
        return settled;
    }

    /**
     * handler 返回的原始 payload（0x 十六进制），失败时为 null。
     */
    public String getReceipt() {
        return receipt;
    }

    public String getFailureReason() {
        return failureReason;
    }
}
