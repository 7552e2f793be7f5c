package com.work.exchange.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 账本时钟来源配置（demo/宿主侧）。
 *
 * mode=mock: 使用进程内 SequenceLedgerClock
 * mode=web3j: 使用链上最新区块号
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }
}
