package com.work.exchange.core.event;

import java.util.List;

/**
 * 只追加的事件日志端口。orderbook 在一次操作提交时按顺序写入该操作产生的全部事件。
 */
public interface OfferEventPublisher {

    void publish(List<OfferEvent> events);

    /**
     * poll-only 读取：返回 seq 大于 afterSeq 的事件（afterSeq 为 null 时从头读），按 seq 升序。
     */
    List<OfferEvent> listAfterSeq(Long afterSeq, int limit);
}
