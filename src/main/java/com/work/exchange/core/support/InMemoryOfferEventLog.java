package com.work.exchange.core.support;

import com.work.exchange.core.event.OfferEvent;
import com.work.exchange.core.event.OfferEventPublisher;
import com.work.exchange.core.event.OfferEventType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 纯内存事件日志，只追加；seq 从 1 开始连续分配。
 */
public class InMemoryOfferEventLog implements OfferEventPublisher {

    private final List<OfferEvent> events = new ArrayList<>();

    @Override
    public synchronized void publish(List<OfferEvent> batch) {
        for (OfferEvent e : batch) {
            events.add(e.withSeq(events.size() + 1L));
        }
    }

    @Override
    public synchronized List<OfferEvent> listAfterSeq(Long afterSeq, int limit) {
        long from = afterSeq == null ? 0L : afterSeq;
        return events.stream()
                .filter(e -> e.getSeq() > from)
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    public synchronized List<OfferEvent> all() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public synchronized List<OfferEvent> ofType(OfferEventType type) {
        return events.stream().filter(e -> e.getType() == type).collect(Collectors.toList());
    }
}
