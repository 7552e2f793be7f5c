package com.work.exchange.core.lock.impl;

import com.work.exchange.core.exception.LockNotAcquiredException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class RedisOrderbookLockTest {

    @Mock
    private StringRedisTemplate redis;
    @Mock
    private ValueOperations<String, String> ops;
    private RedisOrderbookLock lock;
    private AutoCloseable mocks;

    @BeforeEach
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(redis.opsForValue()).thenReturn(ops);
        lock = new RedisOrderbookLock(redis);
    }

    @AfterEach
    public void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    public void acquires_with_set_nx_and_ttl() {
        when(ops.setIfAbsent(eq(RedisOrderbookLock.LOCK_KEY), eq("nodeA:1"), eq(Duration.ofSeconds(30)))).thenReturn(true);

        assertTrue(lock.tryLock("nodeA:1", Duration.ofSeconds(1), Duration.ofSeconds(30)));
        verify(ops, times(1)).setIfAbsent(RedisOrderbookLock.LOCK_KEY, "nodeA:1", Duration.ofSeconds(30));
    }

    @Test
    public void retries_until_the_holder_releases() {
        when(ops.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false, false, true);

        assertTrue(lock.tryLock("nodeA:1", Duration.ofSeconds(5), Duration.ofSeconds(30)));
        verify(ops, times(3)).setIfAbsent(anyString(), anyString(), any(Duration.class));
    }

    @Test
    public void gives_up_after_wait_elapses() {
        when(ops.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

        assertFalse(lock.tryLock("nodeA:1", Duration.ZERO, Duration.ofSeconds(30)));
    }

    @Test
    public void redis_failure_surfaces_as_lock_not_acquired() {
        when(ops.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new RedisConnectionFailureException("down"));

        LockNotAcquiredException e = assertThrows(LockNotAcquiredException.class,
                () -> lock.tryLock("nodeA:1", Duration.ofSeconds(1), Duration.ofSeconds(30)));
        assertTrue(e.isRetryable());
    }

    @Test
    public void unlock_compares_owner_before_delete() {
        when(redis.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), any())).thenReturn(0L);

        lock.unlock("nodeA:1");

        verify(redis, times(1)).execute(ArgumentMatchers.<RedisScript<Long>>any(),
                eq(Collections.singletonList(RedisOrderbookLock.LOCK_KEY)), eq("nodeA:1"));
    }

    @Test
    public void unlock_never_throws_on_redis_errors() {
        when(redis.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), any()))
                .thenThrow(new RedisConnectionFailureException("down"));

        assertDoesNotThrow(() -> lock.unlock("nodeA:1"));
    }
}
