package com.work.exchange.core;

import com.work.exchange.core.clock.SequenceLedgerClock;
import com.work.exchange.core.config.OrderbookConfig;
import com.work.exchange.core.escrow.EscrowHandlerRegistry;
import com.work.exchange.core.escrow.EscrowOutcome;
import com.work.exchange.core.exception.InvalidOfferStateException;
import com.work.exchange.core.exception.LockNotAcquiredException;
import com.work.exchange.core.id.OfferIdGenerator;
import com.work.exchange.core.lock.OrderbookLock;
import com.work.exchange.core.model.Escrow;
import com.work.exchange.core.model.OfferStatus;
import com.work.exchange.core.model.PrepareOfferCommand;
import com.work.exchange.core.model.SettlementResult;
import com.work.exchange.core.support.InMemoryAppRegistry;
import com.work.exchange.core.support.InMemoryOfferEventLog;
import com.work.exchange.core.support.InMemoryOfferRepository;
import com.work.exchange.core.support.NodeIdProvider;
import com.work.exchange.core.support.metrics.ExchangeMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class OrderbookFacadeTest {

    private static final String OWNER = OrderbookTest.OWNER;
    private static final String CONSUMER = OrderbookTest.CONSUMER;
    private static final String HANDLER = OrderbookTest.HANDLER;

    private EscrowHandlerRegistry handlers;
    private InMemoryOfferEventLog events;
    private Orderbook orderbook;
    private OrderbookLock lock;
    private ExchangeMetrics metrics;
    private NodeIdProvider nodeIdProvider;

    @BeforeEach
    public void setUp() {
        InMemoryAppRegistry apps = new InMemoryAppRegistry();
        apps.register(OrderbookTest.APP, OWNER);
        handlers = new EscrowHandlerRegistry();
        handlers.register(HANDLER, call -> EscrowOutcome.success("0x01"));
        events = new InMemoryOfferEventLog();
        orderbook = new Orderbook(OrderbookConfig.defaultConfig(), new InMemoryOfferRepository(), apps, handlers,
                events, new SequenceLedgerClock(1L, true), new OfferIdGenerator());

        // 非重入锁（与 Redis 锁语义一致）：持有期间再次 tryLock 会失败
        lock = mock(OrderbookLock.class);
        when(lock.tryLock(anyString(), any(Duration.class), any(Duration.class))).thenReturn(true);
        metrics = mock(ExchangeMetrics.class);
        nodeIdProvider = mock(NodeIdProvider.class);
        when(nodeIdProvider.getNodeId()).thenReturn("nodeA");
    }

    private OrderbookFacade facade(TransactionTemplate txTemplate) {
        return new OrderbookFacade(orderbook, events, lock, Duration.ofSeconds(1), Duration.ofSeconds(30),
                nodeIdProvider, metrics, txTemplate);
    }

    private PrepareOfferCommand command() {
        return new PrepareOfferCommand(OrderbookTest.APP, CONSUMER,
                new Escrow(HANDLER, OrderbookTest.SELECTOR, "0x"), OrderbookTest.dataIds(0, 3));
    }

    @Test
    public void every_mutation_runs_inside_the_lock() {
        OrderbookFacade facade = facade(null);

        String offerId = facade.prepare(OWNER, command());
        facade.order(OWNER, offerId);
        SettlementResult result = facade.settle(CONSUMER, offerId);

        assertTrue(result.isSettled());
        String owner = "nodeA:" + Thread.currentThread().getId();
        verify(lock, times(3)).tryLock(eq(owner), eq(Duration.ofSeconds(1)), eq(Duration.ofSeconds(30)));
        verify(lock, times(3)).unlock(eq(owner));
        verify(metrics, times(1)).operation("prepare", "ok");
        verify(metrics, times(1)).settlement("settled");
    }

    @Test
    public void reads_do_not_take_the_lock() {
        OrderbookFacade facade = facade(null);
        String offerId = facade.prepare(OWNER, command());
        clearInvocations(lock);

        assertTrue(facade.offerExists(offerId));
        assertEquals(OfferStatus.NEUTRAL, facade.getOffer(offerId).getStatus());
        assertEquals(OWNER, facade.getOfferMembers(offerId).getProviderOwner());
        assertEquals(1, facade.listEvents(null, 10).size());

        verifyNoInteractions(lock);
    }

    @Test
    public void lock_timeout_fails_without_touching_the_orderbook() {
        when(lock.tryLock(anyString(), any(Duration.class), any(Duration.class))).thenReturn(false);
        OrderbookFacade facade = facade(null);

        LockNotAcquiredException e = assertThrows(LockNotAcquiredException.class, () -> facade.prepare(OWNER, command()));

        assertTrue(e.isRetryable());
        assertTrue(events.all().isEmpty());
        verify(metrics, times(1)).lockTimeout();
        verify(lock, never()).unlock(anyString());
    }

    @Test
    public void rejected_operation_still_releases_the_lock() {
        OrderbookFacade facade = facade(null);
        String offerId = facade.prepare(OWNER, command());

        assertThrows(InvalidOfferStateException.class, () -> facade.cancel(OWNER, offerId));

        verify(lock, times(2)).unlock(anyString());
        verify(metrics, times(1)).operation("cancel", "rejected");
    }

    @Test
    public void handler_calling_back_into_facade_gets_reentrant_failure_not_lock_timeout() {
        AtomicReference<OrderbookFacade> ref = new AtomicReference<>();
        AtomicReference<String> other = new AtomicReference<>();
        handlers.register(HANDLER, call -> {
            ref.get().cancel(OWNER, other.get());
            return EscrowOutcome.success("0x");
        });
        OrderbookFacade facade = facade(null);
        ref.set(facade);
        String offerId = facade.prepare(OWNER, command());
        facade.order(OWNER, offerId);
        other.set(facade.prepare(OWNER, command()));
        facade.order(OWNER, other.get());
        clearInvocations(lock);

        SettlementResult result = facade.settle(CONSUMER, offerId);

        assertFalse(result.isSettled());
        assertEquals("reentrant call", result.getFailureReason());
        assertEquals(OfferStatus.PENDING, facade.getOffer(other.get()).getStatus());
        verify(lock, times(1)).tryLock(anyString(), any(Duration.class), any(Duration.class));
        verify(metrics, times(1)).settlement("failed");
    }

    @Test
    public void slow_handler_fails_settlement_before_the_transaction_deadline() {
        InMemoryAppRegistry apps = new InMemoryAppRegistry();
        apps.register(OrderbookTest.APP, OWNER);
        handlers.register(HANDLER, call -> {
            Thread.sleep(10_000L);
            return EscrowOutcome.success("0x01");
        });
        orderbook = new Orderbook(new OrderbookConfig(5760L, 128, 4096, true, Duration.ofMillis(200)),
                new InMemoryOfferRepository(), apps, handlers, events, new SequenceLedgerClock(1L, true),
                new OfferIdGenerator());
        PlatformTransactionManager tm = mock(PlatformTransactionManager.class);
        TransactionStatus status = mock(TransactionStatus.class);
        when(tm.getTransaction(any())).thenReturn(status);
        TransactionTemplate txTemplate = new TransactionTemplate(tm);
        txTemplate.setTimeout(5);
        OrderbookFacade facade = facade(txTemplate);
        String offerId = facade.prepare(OWNER, command());
        facade.order(OWNER, offerId);
        clearInvocations(lock, tm);

        SettlementResult result = assertTimeout(Duration.ofSeconds(3), () -> facade.settle(CONSUMER, offerId));

        assertFalse(result.isSettled());
        assertEquals("escrow timeout", result.getFailureReason());
        assertEquals(OfferStatus.PENDING, facade.getOffer(offerId).getStatus());
        assertFalse(orderbook.isSettling());
        verify(tm, times(1)).commit(status);
        verify(lock, times(1)).unlock(anyString());
        verify(metrics, times(1)).settlement("failed");
    }

    @Test
    public void escrow_timeout_must_fit_inside_lock_ttl_and_transaction_timeout() {
        assertThrows(IllegalArgumentException.class, () -> new OrderbookFacade(orderbook, events, lock,
                Duration.ofSeconds(1), Duration.ofSeconds(3), nodeIdProvider, metrics, null));

        TransactionTemplate shortTx = new TransactionTemplate(mock(PlatformTransactionManager.class));
        shortTx.setTimeout(2);
        assertThrows(IllegalArgumentException.class, () -> facade(shortTx));

        TransactionTemplate okTx = new TransactionTemplate(mock(PlatformTransactionManager.class));
        okTx.setTimeout(5);
        assertNotNull(facade(okTx));
    }

    @Test
    public void mutations_commit_in_a_transaction_when_a_manager_is_present() {
        PlatformTransactionManager tm = mock(PlatformTransactionManager.class);
        TransactionStatus status = mock(TransactionStatus.class);
        when(tm.getTransaction(any())).thenReturn(status);
        OrderbookFacade facade = facade(new TransactionTemplate(tm));

        facade.prepare(OWNER, command());
        assertThrows(InvalidOfferStateException.class,
                () -> facade.cancel(OWNER, facade.listEvents(null, 1).get(0).getOfferId()));

        verify(tm, times(1)).commit(status);
        verify(tm, times(1)).rollback(status);
    }

    @Test
    public void event_feed_limit_is_clamped() {
        OrderbookFacade facade = facade(null);
        for (int i = 0; i < 3; i++) {
            facade.prepare(OWNER, command());
        }

        assertEquals(3, facade.listEvents(null, 0).size());
        assertEquals(1, facade.listEvents(null, 1).size());
        assertEquals(2, facade.listEvents(1L, 500).size());
    }
}
