package com.work.exchange.core.clock;

/**
 * 单调递增的逻辑时钟（语义上等同区块高度），offer 的 at / until 与事件时间戳都取自这里。
 */
public interface LedgerClock {

    /**
     * 当前高度，只读。
     */
    long now();

    /**
     * 一次状态变更操作开始时调用，返回该操作统一使用的高度。
     * 默认直接返回 {@link #now()}；自动出块的实现可以在这里推进一格。
     */
    default long beginOperation() {
        return now();
    }
}
