package com.work.exchange.core.clock;

import java.util.concurrent.atomic.AtomicLong;

import static com.work.exchange.core.support.ValidationUtils.requireNonNegative;

/**
 * 进程内的序号时钟。
 * <p>autoAdvance=true 时每个状态变更操作独占一个新高度（类似开发链的自动出块）；
 * 为 false 时只能通过 {@link #advance(long)} 手动推进，便于测试过期逻辑。</p>
 */
public class SequenceLedgerClock implements LedgerClock {

    private final AtomicLong height;
    private final boolean autoAdvance;

    public SequenceLedgerClock(long initialHeight, boolean autoAdvance) {
        this.height = new AtomicLong(requireNonNegative(initialHeight, "initialHeight"));
        this.autoAdvance = autoAdvance;
    }

    public static SequenceLedgerClock manual(long initialHeight) {
        return new SequenceLedgerClock(initialHeight, false);
    }

    @Override
    public long now() {
        return height.get();
    }

    @Override
    public long beginOperation() {
        return autoAdvance ? height.incrementAndGet() : height.get();
    }

    public long advance(long blocks) {
        requireNonNegative(blocks, "blocks");
        return height.addAndGet(blocks);
    }
}
