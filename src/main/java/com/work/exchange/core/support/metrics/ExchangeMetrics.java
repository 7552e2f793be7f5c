package com.work.exchange.core.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 设计目标：
 * - 核心路径只调用接口，不绑定具体 metrics 实现
 * - 业务/平台可通过自定义 Bean 接入 Micrometer 等实现
 */
public interface ExchangeMetrics {

    /**
     * @param op     prepare / addDataIds / order / cancel / settle / reject
     * @param result ok / rejected / error
     */
    default void operation(String op, String result) {
    }

    /**
     * @param result settled / failed
     */
    default void settlement(String result) {
    }

    default void lockTimeout() {
    }
}
