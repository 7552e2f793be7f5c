package com.work.exchange.demo.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

/**
 * offer 事件流水表（append-only，seq 为 bigserial）。
 */
@TableName("offer_event")
public class OfferEventEntity {

    @TableId(type = IdType.AUTO)
    private Long seq;

    /** 事件名，如 OfferSettled。 */
    private String type;

    private String offerId;

    /** 触发操作的调用方身份。 */
    private String byIdentity;

    /** 操作时的账本高度。 */
    private Long atHeight;

    /** OfferReceipt 的 receipt，或 EscrowExecutionFailed 的原因。 */
    private String data;

    private Instant createdAt;

    public Long getSeq() {
        return seq;
    }

    public void setSeq(Long seq) {
        this.seq = seq;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getOfferId() {
        return offerId;
    }

    public void setOfferId(String offerId) {
        this.offerId = offerId;
    }

    public String getByIdentity() {
        return byIdentity;
    }

    public void setByIdentity(String byIdentity) {
        this.byIdentity = byIdentity;
    }

    public Long getAtHeight() {
        return atHeight;
    }

    public void setAtHeight(Long atHeight) {
        this.atHeight = atHeight;
    }

    public String getData() {
        return data;
    }

    public void setData(String data) {
        this.data = data;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
