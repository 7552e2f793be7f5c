package com.work.exchange.demo.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

/**
 * offer 主表实体类（dataIds 存在 offer_data_id 子表）
 */
@TableName("offer")
public class OfferEntity {

    /** 8 字节 offer 句柄，作为主键。 */
    @TableId(type = IdType.INPUT)
    private String id;

    /** provider app 名称。 */
    private String provider;

    /** consumer 身份（小写地址）。 */
    private String consumer;

    private String escrowHandler;
    private String escrowSelector;
    private String escrowArgs;

    /** 挂单高度，NEUTRAL 时为 0。 */
    private Long presentedAt;

    /** 过期高度，NEUTRAL 时为 0。 */
    private Long validUntil;

    private String status;

    private Instant updatedAt;

    private Instant createdAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getConsumer() {
        return consumer;
    }

    public void setConsumer(String consumer) {
        this.consumer = consumer;
    }

    public String getEscrowHandler() {
        return escrowHandler;
    }

    public void setEscrowHandler(String escrowHandler) {
        this.escrowHandler = escrowHandler;
    }

    public String getEscrowSelector() {
        return escrowSelector;
    }

    public void setEscrowSelector(String escrowSelector) {
        this.escrowSelector = escrowSelector;
    }

    public String getEscrowArgs() {
        return escrowArgs;
    }

    public void setEscrowArgs(String escrowArgs) {
        this.escrowArgs = escrowArgs;
    }

    public Long getPresentedAt() {
        return presentedAt;
    }

    public void setPresentedAt(Long presentedAt) {
        this.presentedAt = presentedAt;
    }

    public Long getValidUntil() {
        return validUntil;
    }

    public void setValidUntil(Long validUntil) {
        this.validUntil = validUntil;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
