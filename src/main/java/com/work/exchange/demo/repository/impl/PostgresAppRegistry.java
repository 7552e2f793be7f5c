package com.work.exchange.demo.repository.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.work.exchange.core.exception.RegistryException;
import com.work.exchange.core.model.AppInfo;
import com.work.exchange.core.registry.AppNames;
import com.work.exchange.core.registry.AppRegistry;
import com.work.exchange.demo.config.ExchangeProperties;
import com.work.exchange.demo.repository.entity.AppEntity;
import com.work.exchange.demo.repository.mapper.AppMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;

import static com.work.exchange.core.support.ValidationUtils.normalizeAddress;
import static com.work.exchange.core.support.ValidationUtils.requireValidAppName;

/**
 * 基于 PostgreSQL 的 app 注册表。
 * app 注册后不可变更，因此读路径可以放心走 Caffeine 缓存；只缓存命中的记录，不缓存"不存在"。
 */
@Repository
@ConditionalOnProperty(prefix = "exchange.storage", name = "mode", havingValue = "postgres")
public class PostgresAppRegistry implements AppRegistry {

    private final AppMapper appMapper;
    private final Cache<String, AppInfo> cache;

    public PostgresAppRegistry(AppMapper appMapper, ExchangeProperties properties) {
        this.appMapper = appMapper;
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.getAppCache().getSize())
                .expireAfterWrite(properties.getAppCache().getTtl())
                .build();
    }

    @Override
    public AppInfo register(String name, String owner) {
        requireValidAppName(name);
        String normalizedOwner = normalizeAddress(owner, "owner");
        String hashedName = AppNames.hash(name);
        int inserted = appMapper.insertIfNotExists(name, normalizedOwner, hashedName, Instant.now());
        if (inserted == 0) {
            throw new RegistryException(RegistryException.APP_ALREADY_EXISTS);
        }
        AppInfo app = new AppInfo(name, normalizedOwner, hashedName);
        cache.put(name, app);
        return app;
    }

    @Override
    public boolean exists(String name) {
        return load(name) != null;
    }

    @Override
    public AppInfo get(String name) {
        AppInfo app = load(name);
        if (app == null) {
            throw new RegistryException(RegistryException.APP_NOT_FOUND);
        }
        return app;
    }

    @Override
    public boolean isOwner(String name, String identity) {
        AppInfo app = load(name);
        return app != null && identity != null && app.getOwner().equalsIgnoreCase(identity);
    }

    private AppInfo load(String name) {
        if (name == null) {
            return null;
        }
        AppInfo cached = cache.getIfPresent(name);
        if (cached != null) {
            return cached;
        }
        AppEntity entity = appMapper.selectByName(name);
        if (entity == null) {
            return null;
        }
        AppInfo app = new AppInfo(entity.getName(), entity.getOwner(), entity.getHashedName());
        cache.put(name, app);
        return app;
    }
}
