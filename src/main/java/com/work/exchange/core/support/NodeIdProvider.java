package com.work.exchange.core.support;

/**
 * 提供节点稳定标识，用于 orderbook 锁的 owner 与日志标记。
 */
public interface NodeIdProvider {
    String getNodeId();
}
