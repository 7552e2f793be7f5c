package com.work.exchange.core.config;

import java.time.Duration;

import static com.work.exchange.core.support.ValidationUtils.requirePositive;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可，确保 core 包保持与业务、框架解耦。
 */
public class OrderbookConfig {

    public static final long DEFAULT_OFFER_TIMEOUT = 5760L;
    public static final int DEFAULT_MAX_DATA_IDS_PER_CALL = 128;
    public static final int DEFAULT_MAX_BUNDLE_SIZE = 4096;
    public static final Duration DEFAULT_ESCROW_TIMEOUT = Duration.ofSeconds(3);

    /**
     * order 之后允许 settle / reject 的区块数，until = at + offerTimeout。
     */
    private final long offerTimeout;
    private final int maxDataIdsPerCall;
    private final int maxBundleSize;
    /**
     * 为 true 时 settle / reject 在 now > until 时失败（outdated offer）。
     */
    private final boolean enforceExpiry;
    /**
     * 单次 escrow handler 调用的上限，必须小于事务超时与锁 TTL。
     */
    private final Duration escrowTimeout;

    public OrderbookConfig(long offerTimeout, int maxDataIdsPerCall, int maxBundleSize, boolean enforceExpiry) {
        this(offerTimeout, maxDataIdsPerCall, maxBundleSize, enforceExpiry, DEFAULT_ESCROW_TIMEOUT);
    }

    public OrderbookConfig(long offerTimeout, int maxDataIdsPerCall, int maxBundleSize, boolean enforceExpiry,
                           Duration escrowTimeout) {
        this.offerTimeout = requirePositive(offerTimeout, "offerTimeout");
        this.maxDataIdsPerCall = (int) requirePositive(maxDataIdsPerCall, "maxDataIdsPerCall");
        this.maxBundleSize = (int) requirePositive(maxBundleSize, "maxBundleSize");
        if (maxBundleSize < maxDataIdsPerCall) {
            throw new IllegalArgumentException("maxBundleSize 不能小于 maxDataIdsPerCall");
        }
        this.enforceExpiry = enforceExpiry;
        this.escrowTimeout = requirePositive(escrowTimeout, "escrowTimeout");
    }

    public static OrderbookConfig defaultConfig() {
        return new OrderbookConfig(DEFAULT_OFFER_TIMEOUT, DEFAULT_MAX_DATA_IDS_PER_CALL, DEFAULT_MAX_BUNDLE_SIZE, true);
    }

    public long getOfferTimeout() {
        return offerTimeout;
    }

    public int getMaxDataIdsPerCall() {
        return maxDataIdsPerCall;
    }

    public int getMaxBundleSize() {
        return maxBundleSize;
    }

    public boolean isEnforceExpiry() {
        return enforceExpiry;
    }

    public Duration getEscrowTimeout() {
        return escrowTimeout;
    }
}
