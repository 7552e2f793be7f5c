package com.work.exchange.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

import static com.work.exchange.core.support.ValidationUtils.requireNonEmpty;
import static com.work.exchange.core.support.ValidationUtils.requireNonNull;

/**
 * 一笔 offer 记录。
 *
 * 注意：
 * 1. id、provider、consumer、escrow 是不可变字段，prepare 之后不能修改
 * 2. dataIds、at、until、status 是可变字段，只能由 Orderbook 在状态迁移时更新
 * 3. 仓储对外只返回 {@link #copy()}，调用方拿到的对象修改后不会影响存储中的记录
 */
public class Offer {

    private final String id;
    private final String provider;
    private final String consumer;
    private final Escrow escrow;
    private final LinkedHashSet<String> dataIds;
    private long at;
    private long until;
    private OfferStatus status;

    public Offer(String id,
                 String provider,
                 String consumer,
                 Escrow escrow,
                 List<String> dataIds,
                 long at,
                 long until,
                 OfferStatus status) {
        this.id = requireNonEmpty(id, "id");
        this.provider = requireNonEmpty(provider, "provider");
        this.consumer = requireNonEmpty(consumer, "consumer");
        this.escrow = requireNonNull(escrow, "escrow");
        this.dataIds = new LinkedHashSet<>(requireNonNull(dataIds, "dataIds"));
        this.at = at;
        this.until = until;
        this.status = requireNonNull(status, "status");
    }

    public static Offer prepared(String id, String provider, String consumer, Escrow escrow, List<String> dataIds) {
        return new Offer(id, provider, consumer, escrow, dataIds, 0L, 0L, OfferStatus.NEUTRAL);
    }

    public Offer copy() {
        return new Offer(id, provider, consumer, escrow, new ArrayList<>(dataIds), at, until, status);
    }

    public String getId() {
        return id;
    }

    public String getProvider() {
        return provider;
    }

    public String getConsumer() {
        return consumer;
    }

    public Escrow getEscrow() {
        return escrow;
    }

    /**
     * 按加入顺序返回的只读视图。
     */
    public List<String> getDataIds() {
        return Collections.unmodifiableList(new ArrayList<>(dataIds));
    }

    public boolean containsDataId(String dataId) {
        return dataIds.contains(dataId);
    }

    public int dataIdCount() {
        return dataIds.size();
    }

    public long getAt() {
        return at;
    }

    public long getUntil() {
        return until;
    }

    public OfferStatus getStatus() {
        return status;
    }

    /**
     * 仅在 NEUTRAL 下追加 dataIds，状态校验由调用方完成。
     */
    public void appendDataIds(List<String> more) {
        if (status != OfferStatus.NEUTRAL) {
            throw new IllegalStateException("dataIds 只能在 NEUTRAL 状态追加: " + id);
        }
        dataIds.addAll(more);
    }

    /**
     * NEUTRAL → PENDING，记录挂单高度与过期高度。
     */
    public void present(long now, long timeout) {
        transitionTo(OfferStatus.PENDING);
        this.at = now;
        this.until = now + timeout;
    }

    public void transitionTo(OfferStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("非法状态迁移: " + status + " -> " + next + ", offer=" + id);
        }
        this.status = next;
    }

    public boolean isExpiredAt(long now) {
        return status == OfferStatus.PENDING && now > until;
    }

    @Override
    public String toString() {
        return "Offer{" +
                "id='" + id + '\'' +
                ", provider='" + provider + '\'' +
                ", consumer='" + consumer + '\'' +
                ", dataIds=" + dataIds.size() +
                ", at=" + at +
                ", until=" + until +
                ", status=" + status +
                '}';
    }
}
