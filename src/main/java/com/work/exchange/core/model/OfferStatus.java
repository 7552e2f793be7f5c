package com.work.exchange.core.model;

/**
 * offer 生命周期状态：NEUTRAL → PENDING → {SETTLED | CANCELED | REJECTED}。
 * <p>状态只能沿该有向图单调前进，离开 NEUTRAL / PENDING 后不会再回到这两个状态。</p>
 */
public enum OfferStatus {
    /**
     * prepare 之后的草稿态，provider 仍可追加 dataIds。
     */
    NEUTRAL,
    /**
     * order 之后的挂单态，开始计时，等待 consumer settle / reject 或 provider cancel。
     */
    PENDING,
    /**
     * escrow 执行成功，终态。
     */
    SETTLED,
    /**
     * provider 撤单，终态。
     */
    CANCELED,
    /**
     * consumer 拒绝，终态。
     */
    REJECTED;

    public boolean isTerminal() {
        return this == SETTLED || this == CANCELED || this == REJECTED;
    }

    /**
     * 状态机允许的单步迁移。
     */
    public boolean canTransitionTo(OfferStatus next) {
        switch (this) {
            case NEUTRAL:
                return next == PENDING;
            case PENDING:
                return next.isTerminal();
            default:
                return false;
        }
    }
}
