package com.work.exchange.demo.repository.entity;

import com.baomidou.mybatisplus.annotation.TableName;

/**
 * offer 的 dataId 子表，position 保留加入顺序；(offer_id, data_id) 唯一。
 */
@TableName("offer_data_id")
public class OfferDataIdEntity {

    private String offerId;
    private Integer position;
    private String dataId;

    public OfferDataIdEntity() {
    }

    public OfferDataIdEntity(String offerId, Integer position, String dataId) {
        this.offerId = offerId;
        this.position = position;
        this.dataId = dataId;
    }

    public String getOfferId() {
        return offerId;
    }

    public void setOfferId(String offerId) {
        this.offerId = offerId;
    }

    public Integer getPosition() {
        return position;
    }

    public void setPosition(Integer position) {
        this.position = position;
    }

    public String getDataId() {
        return dataId;
    }

    public void setDataId(String dataId) {
        this.dataId = dataId;
    }
}
