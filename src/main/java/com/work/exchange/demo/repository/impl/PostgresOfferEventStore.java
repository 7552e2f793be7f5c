package com.work.exchange.demo.repository.impl;

import com.work.exchange.core.event.OfferEvent;
import com.work.exchange.core.event.OfferEventPublisher;
import com.work.exchange.core.event.OfferEventType;
import com.work.exchange.demo.repository.entity.OfferEventEntity;
import com.work.exchange.demo.repository.mapper.OfferEventMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 事件流水写入 offer_event 表，与 offer 状态变更处于同一事务，
 * 外部通过 seq 游标 poll（poll-only completion feed）。
 */
@Repository
@ConditionalOnProperty(prefix = "exchange.storage", name = "mode", havingValue = "postgres")
public class PostgresOfferEventStore implements OfferEventPublisher {

    private final OfferEventMapper eventMapper;

    public PostgresOfferEventStore(OfferEventMapper eventMapper) {
        this.eventMapper = eventMapper;
    }

    @Override
    public void publish(List<OfferEvent> events) {
        Instant now = Instant.now();
        for (OfferEvent event : events) {
            OfferEventEntity entity = new OfferEventEntity();
            entity.setType(event.getType().getEventName());
            entity.setOfferId(event.getOfferId());
            entity.setByIdentity(event.getBy());
            entity.setAtHeight(event.getAt());
            entity.setData(event.getData());
            entity.setCreatedAt(now);
            eventMapper.insert(entity);
        }
    }

    @Override
    public List<OfferEvent> listAfterSeq(Long afterSeq, int limit) {
        List<OfferEventEntity> rows = eventMapper.listAfterSeq(afterSeq, limit);
        List<OfferEvent> out = new ArrayList<>(rows.size());
        for (OfferEventEntity r : rows) {
            out.add(new OfferEvent(r.getSeq(), OfferEventType.fromEventName(r.getType()), r.getOfferId(),
                    r.getByIdentity(), r.getAtHeight() == null ? 0L : r.getAtHeight(), r.getData()));
        }
        return out;
    }
}
