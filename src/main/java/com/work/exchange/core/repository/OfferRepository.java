package com.work.exchange.core.repository;

import com.work.exchange.core.model.Offer;

import java.util.Optional;

/**
 * offer 仓储：offer 的唯一持有者。实现必须只返回副本，且 offer 永不删除。
 */
public interface OfferRepository {

    boolean exists(String offerId);

    Optional<Offer> find(String offerId);

    /**
     * 新建 offer。offerId 已存在时必须失败，不能覆盖。
     */
    void insert(Offer offer);

    /**
     * 持久化状态迁移后的 offer（dataIds、at、until、status）。
     */
    void update(Offer offer);
}
