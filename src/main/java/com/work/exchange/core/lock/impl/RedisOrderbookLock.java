package com.work.exchange.core.lock.impl;

import com.work.exchange.core.exception.LockNotAcquiredException;
import com.work.exchange.core.lock.OrderbookLock;
import com.work.exchange.core.support.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;

import static com.work.exchange.core.support.ValidationUtils.requireNonEmpty;
import static com.work.exchange.core.support.ValidationUtils.requireNonNull;
import static com.work.exchange.core.support.ValidationUtils.requirePositive;

/**
 * 基于 Redis 的 orderbook 全局锁，多节点部署时保证所有操作仍是单一全序。
 *
 * 特性：
 * 1. SET NX PX 原子加锁，锁带超时自动释放，避免节点宕机导致死锁
 * 2. 释放锁时用 Lua 脚本比对 owner，防止误释放其他实例的锁
 * 3. 等待期内按指数退避轮询
 */
@Component
@ConditionalOnProperty(prefix = "exchange.lock", name = "mode", havingValue = "redis")
public class RedisOrderbookLock implements OrderbookLock {

    static final String LOCK_KEY = "exchange:orderbook:lock";
    private static final Logger LOGGER = LoggerFactory.getLogger(RedisOrderbookLock.class);
    private static final long MAX_BACKOFF_MS = 50L;

    // 只有 owner 匹配时才删除
    private static final String UNLOCK_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "    return redis.call('del', KEYS[1]) " +
            "else " +
            "    return 0 " +
            "end";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> unlockScript;

    public RedisOrderbookLock(StringRedisTemplate redisTemplate) {
        this.redisTemplate = ValidationUtils.requireNonNull(redisTemplate, "redisTemplate");
        this.unlockScript = new DefaultRedisScript<>();
        this.unlockScript.setScriptText(UNLOCK_SCRIPT);
        this.unlockScript.setResultType(Long.class);
    }

    /**
     * @throws LockNotAcquiredException Redis 操作异常
     */
    @Override
    public boolean tryLock(String lockOwner, Duration wait, Duration ttl) {
        requireNonEmpty(lockOwner, "lockOwner");
        requireNonNull(wait, "wait");
        requirePositive(ttl, "ttl");

        long deadline = System.nanoTime() + wait.toNanos();
        long backoffMs = 2L;
        while (true) {
            if (attempt(lockOwner, ttl)) {
                return true;
            }
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(backoffMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
        }
    }

    private boolean attempt(String lockOwner, Duration ttl) {
        try {
            Boolean result = redisTemplate.opsForValue().setIfAbsent(LOCK_KEY, lockOwner, ttl);
            return Boolean.TRUE.equals(result);
        } catch (Exception e) {
            throw new LockNotAcquiredException("Redis 加锁异常: " + LOCK_KEY, e);
        }
    }

    @Override
    public void unlock(String lockOwner) {
        requireNonEmpty(lockOwner, "lockOwner");
        try {
            Long result = redisTemplate.execute(unlockScript, Collections.singletonList(LOCK_KEY), lockOwner);
            if (result == null || result == 0) {
                // 锁已过期或已被其他实例持有，保持幂等
                LOGGER.debug("[orderbook] unlock noop, key may be expired or owned by others, owner={}", lockOwner);
            }
        } catch (Exception e) {
            LOGGER.warn("[orderbook] Redis 释放锁异常: owner={}", lockOwner, e);
        }
    }
}
