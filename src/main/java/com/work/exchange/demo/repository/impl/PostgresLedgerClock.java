package com.work.exchange.demo.repository.impl;

import com.work.exchange.core.clock.LedgerClock;
import com.work.exchange.core.exception.ExchangeException;
import com.work.exchange.demo.repository.mapper.LedgerHeightMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.work.exchange.core.support.ValidationUtils.requireNonNegative;
import static com.work.exchange.core.support.ValidationUtils.requireNonNull;

/**
 * 持久化的序号时钟，postgres 存储且未接链时使用。
 * <p>高度保存在数据库里，重启和多节点共享同一计数，offer 的 at / until 与事件高度不会回退。
 * beginOperation 的自增与 orderbook 操作处于同一事务，操作失败回滚时高度一并回滚。</p>
 */
public class PostgresLedgerClock implements LedgerClock {

    private static final Logger log = LoggerFactory.getLogger(PostgresLedgerClock.class);

    private final LedgerHeightMapper mapper;
    private final long initialHeight;
    private final boolean autoAdvance;
    private volatile boolean seeded;

    public PostgresLedgerClock(LedgerHeightMapper mapper, long initialHeight, boolean autoAdvance) {
        this.mapper = requireNonNull(mapper, "mapper");
        this.initialHeight = requireNonNegative(initialHeight, "initialHeight");
        this.autoAdvance = autoAdvance;
    }

    @Override
    public long now() {
        ensureSeeded();
        Long height = mapper.currentHeight();
        if (height == null) {
            reseed();
            height = mapper.currentHeight();
        }
        return requireHeight(height);
    }

    @Override
    public long beginOperation() {
        if (!autoAdvance) {
            return now();
        }
        ensureSeeded();
        Long height = mapper.advance();
        if (height == null) {
            reseed();
            height = mapper.advance();
        }
        return requireHeight(height);
    }

    /**
     * 首次使用时写入初始高度；已有记录时保持库里的值不变。
     */
    private void ensureSeeded() {
        if (seeded) {
            return;
        }
        if (mapper.insertIfAbsent(initialHeight) > 0) {
            log.info("ledger height initialised height={}", initialHeight);
        }
        seeded = true;
    }

    /**
     * 首次写入所在的事务回滚后记录会消失，需要重新写入。
     */
    private void reseed() {
        seeded = false;
        ensureSeeded();
    }

    private static long requireHeight(Long height) {
        if (height == null) {
            throw new ExchangeException("ledger height row missing");
        }
        return height;
    }
}
