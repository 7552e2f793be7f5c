package com.work.exchange.demo.chain;

import com.work.exchange.core.clock.LedgerClock;
import com.work.exchange.core.exception.ExchangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthBlockNumber;

import java.io.IOException;

/**
 * 以链上最新区块号作为账本时钟：eth_blockNumber。
 *
 * 说明：区块号由链推进，beginOperation 不做自增。
 */
public class Web3jLedgerClock implements LedgerClock {

    private static final Logger log = LoggerFactory.getLogger(Web3jLedgerClock.class);

    private final Web3j web3j;

    public Web3jLedgerClock(Web3j web3j) {
        this.web3j = web3j;
    }

    @Override
    public long now() {
        try {
            EthBlockNumber resp = web3j.ethBlockNumber().send();
            if (resp.hasError()) {
                throw new ExchangeException("eth_blockNumber 失败: " + resp.getError().getMessage());
            }
            return resp.getBlockNumber().longValue();
        } catch (IOException e) {
            log.warn("Web3j eth_blockNumber failed. err={}", e.getMessage());
            throw new ExchangeException("查询最新区块号失败", e);
        }
    }
}
