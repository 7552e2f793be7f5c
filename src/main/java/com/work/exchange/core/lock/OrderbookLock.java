package com.work.exchange.core.lock;

import java.time.Duration;

/**
 * orderbook 的全局串行锁：任意时刻只有一个状态变更操作在执行。
 * 默认实现为进程内锁，多节点部署时替换为 Redis 实现。
 */
public interface OrderbookLock {

    /**
     * 在 wait 时间内尝试加锁。
     *
     * @param lockOwner 当前线程/节点的标识，释放时用于校验
     * @param wait      最长等待时间
     * @param ttl       锁超时时间（仅分布式实现使用，防止节点宕机后死锁）
     * @return true 表示加锁成功
     */
    boolean tryLock(String lockOwner, Duration wait, Duration ttl);

    void unlock(String lockOwner);
}
