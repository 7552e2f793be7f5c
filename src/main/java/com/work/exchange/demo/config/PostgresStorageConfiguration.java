package com.work.exchange.demo.config;

import com.work.exchange.core.clock.LedgerClock;
import com.work.exchange.demo.repository.impl.PostgresLedgerClock;
import com.work.exchange.demo.repository.mapper.LedgerHeightMapper;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * exchange.storage.mode=postgres 时才扫描 Mapper；纯内存模式下不需要数据源。
 * PostgresOfferRepository / PostgresAppRegistry / PostgresAccountStore / PostgresOfferEventStore 通过 @Repository 自动扫描。
 */
@Configuration
@ConditionalOnProperty(prefix = "exchange.storage", name = "mode", havingValue = "postgres")
@MapperScan("com.work.exchange.demo.repository.mapper")
public class PostgresStorageConfiguration {

    /**
     * 未接链（chain.mode=mock）时账本高度落库，避免重启或多节点下高度回退。
     */
    @Bean
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public LedgerClock postgresLedgerClock(LedgerHeightMapper ledgerHeightMapper, ExchangeProperties properties) {
        return new PostgresLedgerClock(ledgerHeightMapper,
                properties.getClock().getInitialHeight(), properties.getClock().isAutoAdvance());
    }
}
