package com.work.exchange.core.support.metrics;

/**
 * 默认 no-op 实现：保证工程在不引入任何 metrics 依赖时仍可运行。
 *
 * 若业务侧提供了自定义 ExchangeMetrics Bean，会通过 @ConditionalOnMissingBean 覆盖它。
 */
public class NoopExchangeMetrics implements ExchangeMetrics {
}
