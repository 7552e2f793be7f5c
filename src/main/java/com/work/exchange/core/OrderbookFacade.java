package com.work.exchange.core;

import com.work.exchange.core.event.OfferEvent;
import com.work.exchange.core.event.OfferEventPublisher;
import com.work.exchange.core.exception.ExchangeException;
import com.work.exchange.core.exception.LockNotAcquiredException;
import com.work.exchange.core.exception.ReentrantCallException;
import com.work.exchange.core.lock.OrderbookLock;
import com.work.exchange.core.model.Offer;
import com.work.exchange.core.model.OfferMembers;
import com.work.exchange.core.model.PrepareOfferCommand;
import com.work.exchange.core.model.SettlementResult;
import com.work.exchange.core.support.NodeIdProvider;
import com.work.exchange.core.support.metrics.ExchangeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

import static com.work.exchange.core.support.ValidationUtils.requireNonNull;
import static com.work.exchange.core.support.ValidationUtils.requirePositive;

/**
 * 门面层，负责向业务侧提供 orderbook 的唯一入口。
 * <p>每个状态变更操作都在 {@link OrderbookLock} 内、（如有数据源）在一个数据库事务内执行，
 * 从而保证所有操作构成单一全序，且一个操作要么完整生效要么完全不生效。</p>
 * <p>读操作不加锁，escrow handler 在结算期间可以回调 {@link #getOfferMembers(String)}。</p>
 */
public class OrderbookFacade {

    private static final Logger log = LoggerFactory.getLogger(OrderbookFacade.class);

    private final Orderbook orderbook;
    private final OfferEventPublisher events;
    private final OrderbookLock lock;
    private final Duration lockWait;
    private final Duration lockTtl;
    private final NodeIdProvider nodeIdProvider;
    private final ExchangeMetrics metrics;
    private final TransactionTemplate txTemplate;

    /**
     * @param txTemplate 可为 null（纯内存模式没有数据源）
     * @throws IllegalArgumentException escrow 超时不小于锁 TTL 或事务超时
     */
    public OrderbookFacade(Orderbook orderbook,
                           OfferEventPublisher events,
                           OrderbookLock lock,
                           Duration lockWait,
                           Duration lockTtl,
                           NodeIdProvider nodeIdProvider,
                           ExchangeMetrics metrics,
                           TransactionTemplate txTemplate) {
        this.orderbook = requireNonNull(orderbook, "orderbook");
        this.events = requireNonNull(events, "events");
        this.lock = requireNonNull(lock, "lock");
        this.lockWait = requireNonNull(lockWait, "lockWait");
        this.lockTtl = requirePositive(lockTtl, "lockTtl");
        this.nodeIdProvider = requireNonNull(nodeIdProvider, "nodeIdProvider");
        this.metrics = requireNonNull(metrics, "metrics");
        this.txTemplate = txTemplate;
        Duration escrowTimeout = orderbook.getEscrowTimeout();
        if (escrowTimeout.compareTo(lockTtl) >= 0) {
            throw new IllegalArgumentException("escrowTimeout 必须小于 lockTtl");
        }
        if (txTemplate != null && txTemplate.getTimeout() > 0
                && escrowTimeout.compareTo(Duration.ofSeconds(txTemplate.getTimeout())) >= 0) {
            throw new IllegalArgumentException("escrowTimeout 必须小于事务超时");
        }
    }

    public String prepare(String caller, PrepareOfferCommand cmd) {
        return mutate("prepare", () -> orderbook.prepare(caller, cmd));
    }

    public void addDataIds(String caller, String offerId, List<String> dataIds) {
        mutate("addDataIds", () -> {
            orderbook.addDataIds(caller, offerId, dataIds);
            return null;
        });
    }

    public void order(String caller, String offerId) {
        mutate("order", () -> {
            orderbook.order(caller, offerId);
            return null;
        });
    }

    public void cancel(String caller, String offerId) {
        mutate("cancel", () -> {
            orderbook.cancel(caller, offerId);
            return null;
        });
    }

    public SettlementResult settle(String caller, String offerId) {
        SettlementResult result = mutate("settle", () -> orderbook.settle(caller, offerId));
        metrics.settlement(result.isSettled() ? "settled" : "failed");
        return result;
    }

    public void reject(String caller, String offerId) {
        mutate("reject", () -> {
            orderbook.reject(caller, offerId);
            return null;
        });
    }

    public boolean offerExists(String offerId) {
        return orderbook.offerExists(offerId);
    }

    public Offer getOffer(String offerId) {
        return orderbook.getOffer(offerId);
    }

    public OfferMembers getOfferMembers(String offerId) {
        return orderbook.getOfferMembers(offerId);
    }

    public List<OfferEvent> listEvents(Long afterSeq, int limit) {
        int l = Math.max(1, Math.min(limit <= 0 ? 50 : limit, 200));
        return events.listAfterSeq(afterSeq, l);
    }

    private <T> T mutate(String op, Supplier<T> work) {
        if (orderbook.isEscrowCallback()) {
            // handler 线程回调：外层 settle 仍持有锁，直接拒绝，不去等锁
            throw new ReentrantCallException();
        }
        String lockOwner = nodeIdProvider.getNodeId() + ":" + Thread.currentThread().getId();
        if (!lock.tryLock(lockOwner, lockWait, lockTtl)) {
            metrics.lockTimeout();
            throw new LockNotAcquiredException("orderbook busy, retry later");
        }
        try {
            T result = txTemplate == null ? work.get() : txTemplate.execute(status -> work.get());
            metrics.operation(op, "ok");
            return result;
        } catch (ExchangeException e) {
            metrics.operation(op, "rejected");
            log.debug("orderbook op rejected op={} reason={}", op, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.operation(op, "error");
            log.error("orderbook op failed op={}", op, e);
            throw e;
        } finally {
            lock.unlock(lockOwner);
        }
    }
}
