package com.work.exchange.demo.web.dto;

/**
 * settle 的结果：escrow 失败不是错误，settled=false 且 reason 给出原因。
 */
public class SettlementView {

    private String offerId;
    private boolean settled;
    private String receipt;
    private String reason;

    public String getOfferId() {
        return offerId;
    }

    public void setOfferId(String offerId) {
        this.offerId = offerId;
    }

    public boolean isSettled() {
        return settled;
    }

    public void setSettled(boolean settled) {
        this.settled = settled;
    }

    public String getReceipt() {
        return receipt;
    }

    public void setReceipt(String receipt) {
        this.receipt = receipt;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
