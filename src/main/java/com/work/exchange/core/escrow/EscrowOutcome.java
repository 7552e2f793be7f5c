package com.work.exchange.core.escrow;

/**
 * handler 执行结果，用于指导 orderbook 是推进到 SETTLED 还是保持 PENDING。
 */
public final class EscrowOutcome {

    private final boolean success;
    private final String receipt;
    private final String reason;

    private EscrowOutcome(boolean success, String receipt, String reason) {
        this.success = success;
        this.receipt = receipt;
        this.reason = reason;
    }

    /**
     * @param receipt handler 返回的原始 payload（0x 十六进制），会原样回给 settle 调用方
     */
    public static EscrowOutcome success(String receipt) {
        return new EscrowOutcome(true, receipt == null ? "0x" : receipt, null);
    }

    public static EscrowOutcome failure(String reason) {
        return new EscrowOutcome(false, null, reason == null ? "" : reason);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getReceipt() {
        return receipt;
    }

    public String getReason() {
        return reason;
    }
}
