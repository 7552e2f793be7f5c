package com.work.exchange.demo.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.exchange.demo.repository.entity.AppEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;

/**
 * app 注册表 Mapper
 */
public interface AppMapper extends BaseMapper<AppEntity> {

    @Select("SELECT name, owner, hashed_name, created_at FROM app WHERE name = #{name}")
    AppEntity selectByName(@Param("name") String name);

    /**
     * @return 1 表示注册成功；0 表示名称已被占用
     */
    @Insert("INSERT INTO app(name, owner, hashed_name, created_at) VALUES(#{name}, #{owner}, #{hashedName}, #{createdAt}) " +
            "ON CONFLICT(name) DO NOTHING")
    int insertIfNotExists(@Param("name") String name,
                          @Param("owner") String owner,
                          @Param("hashedName") String hashedName,
                          @Param("createdAt") Instant createdAt);
}
