package com.work.exchange.demo.config;

import com.work.exchange.core.Orderbook;
import com.work.exchange.core.OrderbookFacade;
import com.work.exchange.core.account.AccountRegistry;
import com.work.exchange.core.clock.LedgerClock;
import com.work.exchange.core.clock.SequenceLedgerClock;
import com.work.exchange.core.config.OrderbookConfig;
import com.work.exchange.core.escrow.EscrowHandlerRegistry;
import com.work.exchange.core.event.OfferEventPublisher;
import com.work.exchange.core.id.OfferIdGenerator;
import com.work.exchange.core.lock.LocalOrderbookLock;
import com.work.exchange.core.lock.OrderbookLock;
import com.work.exchange.core.registry.AppRegistry;
import com.work.exchange.core.repository.AccountStore;
import com.work.exchange.core.repository.OfferRepository;
import com.work.exchange.core.support.InMemoryAccountStore;
import com.work.exchange.core.support.InMemoryAppRegistry;
import com.work.exchange.core.support.InMemoryOfferEventLog;
import com.work.exchange.core.support.InMemoryOfferRepository;
import com.work.exchange.core.support.NodeIdProvider;
import com.work.exchange.core.support.SimpleNodeIdProvider;
import com.work.exchange.core.support.metrics.ExchangeMetrics;
import com.work.exchange.core.support.metrics.NoopExchangeMetrics;
import com.work.exchange.demo.escrow.TokenLedger;
import com.work.exchange.demo.escrow.TokenTransferEscrowHandler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 将核心组件装配为 Spring Bean，方便通过依赖注入复用。
 * 默认纯内存 + 本地锁；exchange.storage.mode=postgres / exchange.lock.mode=redis 时由对应实现接管。
 */
@Configuration
@EnableConfigurationProperties({ExchangeProperties.class, ChainProperties.class})
public class ExchangeComponentConfiguration {

    /**
     * 单个 orderbook 操作的事务超时（秒）。锁内只做少量读写，超时应远小于锁 TTL。
     */
    private static final int TX_TIMEOUT_SECONDS = 5;

    @Bean
    public NodeIdProvider nodeIdProvider(ExchangeProperties properties) {
        return new SimpleNodeIdProvider(properties.getLock().getNodeId());
    }

    @Bean
    public OrderbookConfig orderbookConfig(ExchangeProperties properties) {
        return new OrderbookConfig(
                properties.getOfferTimeout(),
                properties.getMaxDataIdsPerCall(),
                properties.getMaxBundleSize(),
                properties.isEnforceExpiry(),
                properties.getEscrowTimeout()
        );
    }

    /**
     * 进程内时钟只用于纯内存存储；postgres 存储由 PostgresStorageConfiguration 提供落库的时钟。
     */
    @Bean
    @ConditionalOnExpression("'${chain.mode:mock}' == 'mock' && '${exchange.storage.mode:memory}' == 'memory'")
    public LedgerClock sequenceLedgerClock(ExchangeProperties properties) {
        return new SequenceLedgerClock(properties.getClock().getInitialHeight(), properties.getClock().isAutoAdvance());
    }

    @Bean
    public OfferIdGenerator offerIdGenerator() {
        return new OfferIdGenerator();
    }

    @Bean
    public TokenLedger tokenLedger() {
        return new TokenLedger();
    }

    /**
     * handler 通过 ObjectProvider 延迟拿到 Orderbook，避免 registry ↔ orderbook 的构造环。
     */
    @Bean
    public EscrowHandlerRegistry escrowHandlerRegistry(ExchangeProperties properties,
                                                       TokenLedger tokenLedger,
                                                       ObjectProvider<Orderbook> orderbook) {
        EscrowHandlerRegistry registry = new EscrowHandlerRegistry();
        if (properties.getDemoEscrow().isEnabled()) {
            TokenTransferEscrowHandler handler = new TokenTransferEscrowHandler(
                    properties.getDemoEscrow().getAddress(),
                    tokenLedger,
                    offerId -> orderbook.getObject().getOfferMembers(offerId));
            registry.register(handler.getAddress(), handler);
        }
        return registry;
    }

    @Bean
    @ConditionalOnProperty(prefix = "exchange.storage", name = "mode", havingValue = "memory", matchIfMissing = true)
    public OfferRepository inMemoryOfferRepository() {
        return new InMemoryOfferRepository();
    }

    @Bean
    @ConditionalOnProperty(prefix = "exchange.storage", name = "mode", havingValue = "memory", matchIfMissing = true)
    public AppRegistry inMemoryAppRegistry() {
        return new InMemoryAppRegistry();
    }

    @Bean
    @ConditionalOnProperty(prefix = "exchange.storage", name = "mode", havingValue = "memory", matchIfMissing = true)
    public AccountStore inMemoryAccountStore() {
        return new InMemoryAccountStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "exchange.storage", name = "mode", havingValue = "memory", matchIfMissing = true)
    public OfferEventPublisher inMemoryOfferEventLog() {
        return new InMemoryOfferEventLog();
    }

    // RedisOrderbookLock 通过 @Component 自动扫描（exchange.lock.mode=redis）
    @Bean
    @ConditionalOnProperty(prefix = "exchange.lock", name = "mode", havingValue = "local", matchIfMissing = true)
    public OrderbookLock localOrderbookLock() {
        return new LocalOrderbookLock();
    }

    @Bean
    @ConditionalOnMissingBean(ExchangeMetrics.class)
    public ExchangeMetrics exchangeMetrics() {
        return new NoopExchangeMetrics();
    }

    @Bean
    public Orderbook orderbook(OrderbookConfig config,
                               OfferRepository offers,
                               AppRegistry apps,
                               EscrowHandlerRegistry escrowHandlers,
                               OfferEventPublisher events,
                               LedgerClock clock,
                               OfferIdGenerator idGenerator) {
        return new Orderbook(config, offers, apps, escrowHandlers, events, clock, idGenerator);
    }

    @Bean
    public AccountRegistry accountRegistry(OfferIdGenerator idGenerator, LedgerClock clock, AccountStore accountStore) {
        return new AccountRegistry(idGenerator, clock, accountStore);
    }

    @Bean
    public OrderbookFacade orderbookFacade(Orderbook orderbook,
                                           OfferEventPublisher events,
                                           OrderbookLock lock,
                                           ExchangeProperties properties,
                                           NodeIdProvider nodeIdProvider,
                                           ExchangeMetrics metrics,
                                           ObjectProvider<PlatformTransactionManager> txManager) {
        PlatformTransactionManager tm = txManager.getIfAvailable();
        TransactionTemplate txTemplate = null;
        if (tm != null) {
            txTemplate = new TransactionTemplate(tm);
            txTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
            txTemplate.setTimeout(TX_TIMEOUT_SECONDS);
        }
        return new OrderbookFacade(orderbook, events, lock,
                properties.getLock().getWait(), properties.getLock().getTtl(),
                nodeIdProvider, metrics, txTemplate);
    }
}
