package com.work.exchange.demo.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.exchange.demo.repository.entity.AccountEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;

/**
 * 账户表 Mapper
 */
public interface AccountMapper extends BaseMapper<AccountEntity> {

    @Select("SELECT EXISTS(SELECT 1 FROM account WHERE account_id = #{accountId})")
    boolean existsById(@Param("accountId") String accountId);

    @Select("SELECT account_id FROM account WHERE owner = #{owner}")
    String selectIdByOwner(@Param("owner") String owner);

    @Select("SELECT account_id FROM account WHERE identity_hash = #{identityHash}")
    String selectIdByIdentityHash(@Param("identityHash") String identityHash);

    /**
     * 任一唯一约束（account_id / owner / identity_hash）冲突时返回 0
     */
    @Insert("INSERT INTO account(account_id, owner, identity_hash, controller, temporary, updated_at, created_at) " +
            "VALUES(#{e.accountId}, #{e.owner}, #{e.identityHash}, #{e.controller}, #{e.temporary}, " +
            "#{e.updatedAt}, #{e.createdAt}) ON CONFLICT DO NOTHING")
    int insertIfAbsent(@Param("e") AccountEntity entity);

    /**
     * 只认领仍处于临时状态的账户；owner 唯一约束兜底并发认领
     */
    @Update("UPDATE account SET owner = #{owner}, temporary = FALSE, updated_at = #{now} " +
            "WHERE account_id = #{accountId} AND temporary = TRUE")
    int unlockTemporary(@Param("accountId") String accountId,
                        @Param("owner") String owner,
                        @Param("now") Instant now);
}
