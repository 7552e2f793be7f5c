package com.work.exchange.core.escrow;

/**
 * 传递给 escrow handler 的调用上下文：prepare 时约定的 selector / args，外加 offerId 供 handler 关联 offer。
 */
public final class EscrowCall {

    private final String offerId;
    private final String selector;
    private final String args;

    public EscrowCall(String offerId, String selector, String args) {
        this.offerId = offerId;
        this.selector = selector;
        this.args = args;
    }

    public String getOfferId() {
        return offerId;
    }

    public String getSelector() {
        return selector;
    }

    public String getArgs() {
        return args;
    }

    @Override
    public String toString() {
        return "EscrowCall{" +
                "offerId='" + offerId + '\'' +
                ", selector='" + selector + '\'' +
                '}';
    }
}
