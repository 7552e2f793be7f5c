package com.work.exchange.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 仅存在于 demo/宿主包，用于从 application.yml 读取配置。
 * 再由配置类转换为 core 包所需的 {@link com.work.exchange.core.config.OrderbookConfig}。
 */
@ConfigurationProperties(prefix = "exchange")
public class ExchangeProperties {

    /**
     * 报价被 order 之后的有效期（单位：账本高度）
     */
    private long offerTimeout = 5760L;

    private int maxDataIdsPerCall = 128;

    private int maxBundleSize = 4096;

    /**
     * settle/reject 是否校验 until，关闭后过期报价仍可结算
     */
    private boolean enforceExpiry = true;

    /**
     * 单次 escrow handler 调用上限，须小于事务超时（5s）与 lock.ttl
     */
    private Duration escrowTimeout = Duration.ofSeconds(3);

    private final Storage storage = new Storage();
    private final Lock lock = new Lock();
    private final Clock clock = new Clock();
    private final AppCache appCache = new AppCache();
    private final DemoEscrow demoEscrow = new DemoEscrow();

    public long getOfferTimeout() {
        return offerTimeout;
    }

    public void setOfferTimeout(long offerTimeout) {
        this.offerTimeout = offerTimeout;
    }

    public int getMaxDataIdsPerCall() {
        return maxDataIdsPerCall;
    }

    public void setMaxDataIdsPerCall(int maxDataIdsPerCall) {
        this.maxDataIdsPerCall = maxDataIdsPerCall;
    }

    public int getMaxBundleSize() {
        return maxBundleSize;
    }

    public void setMaxBundleSize(int maxBundleSize) {
        this.maxBundleSize = maxBundleSize;
    }

    public boolean isEnforceExpiry() {
        return enforceExpiry;
    }

    public void setEnforceExpiry(boolean enforceExpiry) {
        this.enforceExpiry = enforceExpiry;
    }

    public Duration getEscrowTimeout() {
        return escrowTimeout;
    }

    public void setEscrowTimeout(Duration escrowTimeout) {
        this.escrowTimeout = escrowTimeout;
    }

    public Storage getStorage() {
        return storage;
    }

    public Lock getLock() {
        return lock;
    }

    public Clock getClock() {
        return clock;
    }

    public AppCache getAppCache() {
        return appCache;
    }

    public DemoEscrow getDemoEscrow() {
        return demoEscrow;
    }

    public static class Storage {
        /**
         * memory 或 postgres
         */
        private String mode = "memory";

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }

    public static class Lock {
        /**
         * local 或 redis
         */
        private String mode = "local";
        private Duration ttl = Duration.ofSeconds(30);
        private Duration wait = Duration.ofSeconds(5);
        /**
         * 锁 owner 前缀，为空时自动生成
         */
        private String nodeId;

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getWait() {
            return wait;
        }

        public void setWait(Duration wait) {
            this.wait = wait;
        }

        public String getNodeId() {
            return nodeId;
        }

        public void setNodeId(String nodeId) {
            this.nodeId = nodeId;
        }
    }

    public static class Clock {
        private long initialHeight = 1L;

        /**
         * 每个状态变更操作前自动推进一个高度（chain.mode=mock 时生效）
         */
        private boolean autoAdvance = true;

        public long getInitialHeight() {
            return initialHeight;
        }

        public void setInitialHeight(long initialHeight) {
            this.initialHeight = initialHeight;
        }

        public boolean isAutoAdvance() {
            return autoAdvance;
        }

        public void setAutoAdvance(boolean autoAdvance) {
            this.autoAdvance = autoAdvance;
        }
    }

    public static class AppCache {
        private long size = 10_000L;
        private Duration ttl = Duration.ofMinutes(10);

        public long getSize() {
            return size;
        }

        public void setSize(long size) {
            this.size = size;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    /**
     * 内置 token 转账 escrow 的注册地址
     */
    public static class DemoEscrow {
        private boolean enabled = true;
        private String address = "0x00000000000000000000000000000000000e5c70";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getAddress() {
            return address;
        }

        public void setAddress(String address) {
            this.address = address;
        }
    }
}
