package com.work.exchange.demo.config;

import com.work.exchange.core.clock.LedgerClock;
import com.work.exchange.demo.chain.Web3jLedgerClock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * Web3j 装配：
 * 当 chain.mode=web3j 时启用，账本时钟取链上最新区块号。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(ChainProperties properties) {
        return Web3j.build(new HttpService(properties.getRpcUrl()));
    }

    @Bean
    public LedgerClock web3jLedgerClock(Web3j web3j) {
        return new Web3jLedgerClock(web3j);
    }
}
