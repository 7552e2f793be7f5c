package com.work.exchange.demo.repository.impl;

import com.work.exchange.core.exception.ExchangeException;
import com.work.exchange.core.exception.OfferNotFoundException;
import com.work.exchange.core.model.Escrow;
import com.work.exchange.core.model.Offer;
import com.work.exchange.core.model.OfferStatus;
import com.work.exchange.core.repository.OfferRepository;
import com.work.exchange.demo.repository.entity.OfferEntity;
import com.work.exchange.demo.repository.mapper.OfferDataIdMapper;
import com.work.exchange.demo.repository.mapper.OfferMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.work.exchange.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的 OfferRepository 实现
 *
 * 注意：
 * 1. 所有方法都必须在事务中调用，事务边界由 OrderbookFacade 统一管理
 * 2. dataIds 只追加：update 时仅写入子表中尚不存在的尾部元素
 */
@Repository
@ConditionalOnProperty(prefix = "exchange.storage", name = "mode", havingValue = "postgres")
public class PostgresOfferRepository implements OfferRepository {

    private final OfferMapper offerMapper;
    private final OfferDataIdMapper dataIdMapper;

    public PostgresOfferRepository(OfferMapper offerMapper, OfferDataIdMapper dataIdMapper) {
        this.offerMapper = offerMapper;
        this.dataIdMapper = dataIdMapper;
    }

    @Override
    public boolean exists(String offerId) {
        return offerId != null && offerMapper.existsById(offerId);
    }

    @Override
    public Optional<Offer> find(String offerId) {
        if (offerId == null) {
            return Optional.empty();
        }
        OfferEntity entity = offerMapper.selectById(offerId);
        if (entity == null) {
            return Optional.empty();
        }
        List<String> dataIds = dataIdMapper.listDataIds(offerId);
        return Optional.of(convertToOffer(entity, dataIds));
    }

    @Override
    public void insert(Offer offer) {
        requireNonNull(offer, "offer");
        Instant now = Instant.now();
        OfferEntity entity = new OfferEntity();
        entity.setId(offer.getId());
        entity.setProvider(offer.getProvider());
        entity.setConsumer(offer.getConsumer());
        entity.setEscrowHandler(offer.getEscrow().getHandler());
        entity.setEscrowSelector(offer.getEscrow().getSelector());
        entity.setEscrowArgs(offer.getEscrow().getArgs());
        entity.setPresentedAt(offer.getAt());
        entity.setValidUntil(offer.getUntil());
        entity.setStatus(offer.getStatus().name());
        entity.setUpdatedAt(now);
        entity.setCreatedAt(now);

        if (offerMapper.insertIfAbsent(entity) == 0) {
            throw new ExchangeException("offer 已存在: " + offer.getId());
        }
        appendDataIds(offer.getId(), offer.getDataIds(), 0);
    }

    @Override
    public void update(Offer offer) {
        requireNonNull(offer, "offer");
        int updated = offerMapper.updateMutable(offer.getId(), offer.getAt(), offer.getUntil(),
                offer.getStatus().name(), Instant.now());
        if (updated == 0) {
            throw new OfferNotFoundException(OfferNotFoundException.OFFER_NOT_FOUND);
        }
        int stored = dataIdMapper.countByOffer(offer.getId());
        List<String> dataIds = offer.getDataIds();
        if (dataIds.size() > stored) {
            appendDataIds(offer.getId(), dataIds.subList(stored, dataIds.size()), stored);
        }
    }

    private void appendDataIds(String offerId, List<String> dataIds, int startPosition) {
        int position = startPosition;
        for (String dataId : dataIds) {
            dataIdMapper.insertDataId(offerId, position++, dataId);
        }
    }

    private Offer convertToOffer(OfferEntity entity, List<String> dataIds) {
        return new Offer(
                entity.getId(),
                entity.getProvider(),
                entity.getConsumer(),
                new Escrow(entity.getEscrowHandler(), entity.getEscrowSelector(), entity.getEscrowArgs()),
                dataIds,
                entity.getPresentedAt() == null ? 0L : entity.getPresentedAt(),
                entity.getValidUntil() == null ? 0L : entity.getValidUntil(),
                OfferStatus.valueOf(entity.getStatus())
        );
    }
}
