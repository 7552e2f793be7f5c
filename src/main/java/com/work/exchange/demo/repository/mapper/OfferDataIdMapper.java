package com.work.exchange.demo.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.exchange.demo.repository.entity.OfferDataIdEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * offer dataId 子表 Mapper
 */
public interface OfferDataIdMapper extends BaseMapper<OfferDataIdEntity> {

    @Select("SELECT data_id FROM offer_data_id WHERE offer_id = #{offerId} ORDER BY position ASC")
    List<String> listDataIds(@Param("offerId") String offerId);

    @Select("SELECT COUNT(1) FROM offer_data_id WHERE offer_id = #{offerId}")
    int countByOffer(@Param("offerId") String offerId);

    @Insert("INSERT INTO offer_data_id(offer_id, position, data_id) VALUES(#{offerId}, #{position}, #{dataId})")
    int insertDataId(@Param("offerId") String offerId,
                     @Param("position") int position,
                     @Param("dataId") String dataId);
}
