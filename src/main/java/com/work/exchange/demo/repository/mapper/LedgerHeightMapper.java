package com.work.exchange.demo.repository.mapper;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * 全局账本高度（单行表 ledger_height，id 固定为 1）。
 */
public interface LedgerHeightMapper {

    @Insert("INSERT INTO ledger_height(id, height) VALUES(1, #{height}) ON CONFLICT (id) DO NOTHING")
    int insertIfAbsent(@Param("height") long height);

    @Select("SELECT height FROM ledger_height WHERE id = 1")
    Long currentHeight();

    /**
     * 自增并返回新高度；UPDATE ... RETURNING 走 select 通道，需要每次刷新一级缓存。
     */
    @Select("UPDATE ledger_height SET height = height + 1 WHERE id = 1 RETURNING height")
    @Options(flushCache = Options.FlushCachePolicy.TRUE)
    Long advance();
}
