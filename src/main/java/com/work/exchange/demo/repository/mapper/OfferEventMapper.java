package com.work.exchange.demo.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.exchange.demo.repository.entity.OfferEventEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * offer 事件流水 Mapper（写入走 BaseMapper.insert，seq 由数据库生成）
 */
public interface OfferEventMapper extends BaseMapper<OfferEventEntity> {

    @Select("SELECT seq, type, offer_id, by_identity, at_height, data, created_at FROM offer_event " +
            "WHERE seq > COALESCE(#{afterSeq}, 0) ORDER BY seq ASC LIMIT #{limit}")
    List<OfferEventEntity> listAfterSeq(@Param("afterSeq") Long afterSeq, @Param("limit") int limit);
}
