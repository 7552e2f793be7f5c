package com.work.exchange.core;

import com.work.exchange.core.auth.AuthorizationGate;
import com.work.exchange.core.clock.LedgerClock;
import com.work.exchange.core.config.OrderbookConfig;
import com.work.exchange.core.escrow.EscrowHandlerRegistry;
import com.work.exchange.core.escrow.EscrowInvoker;
import com.work.exchange.core.escrow.EscrowOutcome;
import com.work.exchange.core.escrow.ReentrancyGuard;
import com.work.exchange.core.event.OfferEvent;
import com.work.exchange.core.event.OfferEventPublisher;
import com.work.exchange.core.event.OfferEventType;
import com.work.exchange.core.exception.InvalidOfferArgumentException;
import com.work.exchange.core.exception.InvalidOfferStateException;
import com.work.exchange.core.exception.OfferNotFoundException;
import com.work.exchange.core.id.OfferIdGenerator;
import com.work.exchange.core.model.Escrow;
import com.work.exchange.core.model.Offer;
import com.work.exchange.core.model.OfferMembers;
import com.work.exchange.core.model.OfferStatus;
import com.work.exchange.core.model.PrepareOfferCommand;
import com.work.exchange.core.model.SettlementResult;
import com.work.exchange.core.registry.AppRegistry;
import com.work.exchange.core.repository.OfferRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.work.exchange.core.support.ValidationUtils.isAddress;
import static com.work.exchange.core.support.ValidationUtils.isHex;
import static com.work.exchange.core.support.ValidationUtils.isHexOfLength;
import static com.work.exchange.core.support.ValidationUtils.normalizeAddress;
import static com.work.exchange.core.support.ValidationUtils.requireNonEmpty;
import static com.work.exchange.core.support.ValidationUtils.requireNonNull;

/**
 * offer 生命周期引擎：prepare → order → settle | cancel | reject。
 *
 * 每个状态变更操作遵循同一顺序：
 * 1. 拒绝 escrow 调用期间的重入
 * 2. 取本次操作的时钟高度
 * 3. 授权校验先于状态校验（非 consumer 调 settle 永远得到授权错误）
 * 4. 在副本上完成全部校验与修改，最后一次性写回仓储并发布事件
 * 任何一步失败都抛出异常，仓储与事件日志保持原样。
 *
 * 该类本身不加锁，串行化由 {@link OrderbookFacade} 负责。
 */
public class Orderbook {

    private static final Logger log = LoggerFactory.getLogger(Orderbook.class);

    private static final int DATA_ID_LENGTH = 20;
    private static final int SELECTOR_LENGTH = 4;

    private final OrderbookConfig config;
    private final OfferRepository offers;
    private final AppRegistry apps;
    private final EscrowHandlerRegistry escrowHandlers;
    private final OfferEventPublisher events;
    private final LedgerClock clock;
    private final OfferIdGenerator idGenerator;
    private final AuthorizationGate gate;
    private final ReentrancyGuard guard;
    private final EscrowInvoker escrowInvoker;

    public Orderbook(OrderbookConfig config,
                     OfferRepository offers,
                     AppRegistry apps,
                     EscrowHandlerRegistry escrowHandlers,
                     OfferEventPublisher events,
                     LedgerClock clock,
                     OfferIdGenerator idGenerator) {
        this.config = requireNonNull(config, "config");
        this.offers = requireNonNull(offers, "offers");
        this.apps = requireNonNull(apps, "apps");
        this.escrowHandlers = requireNonNull(escrowHandlers, "escrowHandlers");
        this.events = requireNonNull(events, "events");
        this.clock = requireNonNull(clock, "clock");
        this.idGenerator = requireNonNull(idGenerator, "idGenerator");
        this.gate = new AuthorizationGate(apps);
        this.guard = new ReentrancyGuard();
        this.escrowInvoker = new EscrowInvoker(escrowHandlers, guard, config.getEscrowTimeout());
    }

    /**
     * 创建 NEUTRAL offer，返回新句柄。
     */
    public String prepare(String caller, PrepareOfferCommand cmd) {
        guard.requireNotEntered();
        String by = identity(caller);
        requireNonNull(cmd, "cmd");

        String provider = requireNonEmpty(cmd.getProvider(), "provider");
        if (!apps.exists(provider)) {
            throw new InvalidOfferArgumentException(InvalidOfferArgumentException.APP_NOT_FOUND);
        }
        gate.requireProviderControl(by, provider);

        if (!isAddress(cmd.getConsumer())) {
            throw new InvalidOfferArgumentException(InvalidOfferArgumentException.INVALID_CONSUMER);
        }
        String consumer = cmd.getConsumer().toLowerCase(Locale.ROOT);
        Escrow escrow = validateEscrow(cmd.getEscrow());
        List<String> dataIds = validateDataIds(null, cmd.getDataIds());

        long now = clock.beginOperation();
        String offerId = freshOfferId(by, now);
        Offer offer = Offer.prepared(offerId, provider, consumer, escrow, dataIds);

        offers.insert(offer);
        events.publish(Collections.singletonList(OfferEvent.of(OfferEventType.OFFER_PREPARED, offerId, by, now)));
        log.info("offer prepared offerId={} provider={} consumer={} dataIds={} at={}",
                offerId, provider, consumer, dataIds.size(), now);
        return offerId;
    }

    /**
     * NEUTRAL 状态下向 bundle 追加 dataIds。
     */
    public void addDataIds(String caller, String offerId, List<String> dataIds) {
        guard.requireNotEntered();
        String by = identity(caller);
        Offer offer = load(offerId);
        gate.requireProviderControl(by, offer);
        requireStatus(offer, OfferStatus.NEUTRAL, InvalidOfferStateException.NEUTRAL_ONLY);

        List<String> added = validateDataIds(offer, dataIds);
        offer.appendDataIds(added);
        offers.update(offer);
        log.info("offer dataIds added offerId={} added={} total={}", offerId, added.size(), offer.dataIdCount());
    }

    /**
     * NEUTRAL → PENDING，开始计时。
     */
    public void order(String caller, String offerId) {
        guard.requireNotEntered();
        String by = identity(caller);
        long now = clock.beginOperation();
        Offer offer = load(offerId);
        gate.requireProviderControl(by, offer);
        requireStatus(offer, OfferStatus.NEUTRAL, InvalidOfferStateException.NEUTRAL_ONLY);

        offer.present(now, config.getOfferTimeout());
        offers.update(offer);
        events.publish(Collections.singletonList(OfferEvent.of(OfferEventType.OFFER_PRESENTED, offerId, by, now)));
        log.info("offer presented offerId={} at={} until={}", offerId, offer.getAt(), offer.getUntil());
    }

    /**
     * provider 撤单：PENDING → CANCELED。
     */
    public void cancel(String caller, String offerId) {
        guard.requireNotEntered();
        String by = identity(caller);
        long now = clock.beginOperation();
        Offer offer = load(offerId);
        gate.requireProviderControl(by, offer);
        requireStatus(offer, OfferStatus.PENDING, InvalidOfferStateException.PENDING_ONLY);

        offer.transitionTo(OfferStatus.CANCELED);
        offers.update(offer);
        events.publish(Collections.singletonList(OfferEvent.of(OfferEventType.OFFER_CANCELED, offerId, by, now)));
        log.info("offer canceled offerId={} at={}", offerId, now);
    }

    /**
     * consumer 结算：调用一次 escrow handler。
     * <p>成功 → SETTLED，并发布 OfferSettled + OfferReceipt；
     * 失败 → 保持 PENDING，发布 EscrowExecutionFailed，不抛异常，consumer 可以再次 settle 或 reject。</p>
     */
    public SettlementResult settle(String caller, String offerId) {
        guard.requireNotEntered();
        String by = identity(caller);
        long now = clock.beginOperation();
        Offer offer = load(offerId);
        gate.requireConsumer(by, offer);
        requireStatus(offer, OfferStatus.PENDING, InvalidOfferStateException.PENDING_ONLY);
        requireNotExpired(offer, now);

        EscrowOutcome outcome = escrowInvoker.invoke(offer.copy());
        if (!outcome.isSuccess()) {
            events.publish(Collections.singletonList(
                    OfferEvent.of(OfferEventType.ESCROW_EXECUTION_FAILED, offerId, by, now, outcome.getReason())));
            log.warn("offer settlement failed offerId={} at={} reason={}", offerId, now, outcome.getReason());
            return SettlementResult.failed(offerId, outcome.getReason());
        }

        offer.transitionTo(OfferStatus.SETTLED);
        offers.update(offer);
        events.publish(Arrays.asList(
                OfferEvent.of(OfferEventType.OFFER_SETTLED, offerId, by, now),
                OfferEvent.of(OfferEventType.OFFER_RECEIPT, offerId, by, now, outcome.getReceipt())));
        log.info("offer settled offerId={} at={}", offerId, now);
        return SettlementResult.settled(offerId, outcome.getReceipt());
    }

    /**
     * consumer 拒绝：PENDING → REJECTED。
     */
    public void reject(String caller, String offerId) {
        guard.requireNotEntered();
        String by = identity(caller);
        long now = clock.beginOperation();
        Offer offer = load(offerId);
        gate.requireConsumer(by, offer);
        requireStatus(offer, OfferStatus.PENDING, InvalidOfferStateException.PENDING_ONLY);
        requireNotExpired(offer, now);

        offer.transitionTo(OfferStatus.REJECTED);
        offers.update(offer);
        events.publish(Collections.singletonList(OfferEvent.of(OfferEventType.OFFER_REJECTED, offerId, by, now)));
        log.info("offer rejected offerId={} at={}", offerId, now);
    }

    /**
     * 与 {@link #getOffer(String)} 一样按小写句柄查找。
     */
    public boolean offerExists(String offerId) {
        return offerId != null && offers.exists(offerId.toLowerCase(Locale.ROOT));
    }

    /**
     * 返回副本，修改它不会影响仓储。
     */
    public Offer getOffer(String offerId) {
        return load(offerId);
    }

    public OfferMembers getOfferMembers(String offerId) {
        Offer offer = load(offerId);
        return new OfferMembers(apps.get(offer.getProvider()).getOwner(), offer.getConsumer());
    }

    /**
     * escrow 调用是否正在进行（仅用于观测）。
     */
    public boolean isSettling() {
        return guard.isEntered();
    }

    /**
     * 当前线程是否是 escrow handler 的执行线程（handler 回调 orderbook 时为 true）。
     */
    public boolean isEscrowCallback() {
        return escrowInvoker.isHandlerThread();
    }

    public Duration getEscrowTimeout() {
        return escrowInvoker.getTimeout();
    }

    private String freshOfferId(String creator, long now) {
        long distinguishing = 0L;
        String offerId = idGenerator.generate(creator, now, distinguishing);
        while (offers.exists(offerId)) {
            distinguishing++;
            offerId = idGenerator.generate(creator, now, distinguishing);
        }
        return offerId;
    }

    private Offer load(String offerId) {
        if (offerId == null) {
            throw new OfferNotFoundException(OfferNotFoundException.OFFER_NOT_FOUND);
        }
        return offers.find(offerId.toLowerCase(Locale.ROOT))
                .orElseThrow(() -> new OfferNotFoundException(OfferNotFoundException.OFFER_NOT_FOUND));
    }

    private static String identity(String caller) {
        return normalizeAddress(caller, "caller");
    }

    private static void requireStatus(Offer offer, OfferStatus expected, String reason) {
        if (offer.getStatus() != expected) {
            throw new InvalidOfferStateException(reason);
        }
    }

    private void requireNotExpired(Offer offer, long now) {
        if (config.isEnforceExpiry() && offer.isExpiredAt(now)) {
            throw new InvalidOfferStateException(InvalidOfferStateException.OUTDATED);
        }
    }

    private Escrow validateEscrow(Escrow escrow) {
        if (escrow == null || !escrowHandlers.contains(escrow.getHandler())) {
            throw new InvalidOfferArgumentException(InvalidOfferArgumentException.NOT_CONTRACT_ADDRESS);
        }
        if (!isHexOfLength(escrow.getSelector(), SELECTOR_LENGTH)) {
            throw new InvalidOfferArgumentException(InvalidOfferArgumentException.INVALID_ESCROW_SELECTOR);
        }
        String args = escrow.getArgs() == null ? "0x" : escrow.getArgs();
        if (!isHex(args)) {
            throw new InvalidOfferArgumentException(InvalidOfferArgumentException.INVALID_ESCROW_ARGS);
        }
        return new Escrow(escrow.getHandler().toLowerCase(Locale.ROOT),
                escrow.getSelector().toLowerCase(Locale.ROOT),
                args.toLowerCase(Locale.ROOT));
    }

    /**
     * 校验并规范化（小写）一批 dataIds；existing 为 null 表示 prepare 时的首批。
     */
    private List<String> validateDataIds(Offer existing, List<String> dataIds) {
        requireNonNull(dataIds, "dataIds");
        if (dataIds.size() > config.getMaxDataIdsPerCall()) {
            throw InvalidOfferArgumentException.dataIdsPerCallExceeded(config.getMaxDataIdsPerCall());
        }
        Set<String> batch = new LinkedHashSet<>();
        for (String dataId : dataIds) {
            if (!isHexOfLength(dataId, DATA_ID_LENGTH)) {
                throw new InvalidOfferArgumentException(InvalidOfferArgumentException.INVALID_DATA_ID);
            }
            String normalized = dataId.toLowerCase(Locale.ROOT);
            if (!batch.add(normalized) || (existing != null && existing.containsDataId(normalized))) {
                throw new InvalidOfferArgumentException(InvalidOfferArgumentException.DUPLICATE_DATA_ID);
            }
        }
        int current = existing == null ? 0 : existing.dataIdCount();
        if (current + batch.size() > config.getMaxBundleSize()) {
            throw InvalidOfferArgumentException.bundleSizeExceeded(config.getMaxBundleSize());
        }
        return new ArrayList<>(batch);
    }
}
