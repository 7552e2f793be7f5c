package com.work.exchange.core.support;

import com.work.exchange.core.exception.ExchangeException;
import com.work.exchange.core.exception.OfferNotFoundException;
import com.work.exchange.core.model.Offer;
import com.work.exchange.core.repository.OfferRepository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.exchange.core.support.ValidationUtils.requireNonNull;

/**
 * 纯内存实现，方便在没有 Postgres 的环境下演示组件行为。
 * 注意：该实现不具备跨进程一致性；写入和读取都做拷贝，外部拿不到存储内对象的引用。
 */
public class InMemoryOfferRepository implements OfferRepository {

    private final Map<String, Offer> offers = new ConcurrentHashMap<>();

    @Override
    public boolean exists(String offerId) {
        return offerId != null && offers.containsKey(offerId);
    }

    @Override
    public Optional<Offer> find(String offerId) {
        if (offerId == null) {
            return Optional.empty();
        }
        Offer offer = offers.get(offerId);
        return offer == null ? Optional.empty() : Optional.of(offer.copy());
    }

    @Override
    public void insert(Offer offer) {
        requireNonNull(offer, "offer");
        Offer existing = offers.putIfAbsent(offer.getId(), offer.copy());
        if (existing != null) {
            throw new ExchangeException("offer 已存在: " + offer.getId());
        }
    }

    @Override
    public void update(Offer offer) {
        requireNonNull(offer, "offer");
        Offer replaced = offers.computeIfPresent(offer.getId(), (id, old) -> offer.copy());
        if (replaced == null) {
            throw new OfferNotFoundException(OfferNotFoundException.OFFER_NOT_FOUND);
        }
    }
}
