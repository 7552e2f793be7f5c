package com.work.exchange.demo.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.exchange.demo.repository.entity.OfferEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;

/**
 * offer 主表 Mapper
 */
public interface OfferMapper extends BaseMapper<OfferEntity> {

    @Select("SELECT EXISTS(SELECT 1 FROM offer WHERE id = #{id})")
    boolean existsById(@Param("id") String id);

    /**
     * 插入新 offer；id 已存在时返回 0（不覆盖）
     */
    @Insert("INSERT INTO offer(id, provider, consumer, escrow_handler, escrow_selector, escrow_args, " +
            "presented_at, valid_until, status, updated_at, created_at) " +
            "VALUES(#{e.id}, #{e.provider}, #{e.consumer}, #{e.escrowHandler}, #{e.escrowSelector}, #{e.escrowArgs}, " +
            "#{e.presentedAt}, #{e.validUntil}, #{e.status}, #{e.updatedAt}, #{e.createdAt}) " +
            "ON CONFLICT(id) DO NOTHING")
    int insertIfAbsent(@Param("e") OfferEntity entity);

    /**
     * 只更新可变字段；不可变字段（provider/consumer/escrow）永不改写
     */
    @Update("UPDATE offer SET presented_at = #{presentedAt}, valid_until = #{validUntil}, status = #{status}, " +
            "updated_at = #{now} WHERE id = #{id}")
    int updateMutable(@Param("id") String id,
                      @Param("presentedAt") Long presentedAt,
                      @Param("validUntil") Long validUntil,
                      @Param("status") String status,
                      @Param("now") Instant now);
}
