package com.work.exchange.core.escrow;

/**
 * 外部结算逻辑（例如 token 转账）。orderbook 每次 settle 只调用一次。
 * <p>抛出的任何异常都等同于 revert：orderbook 会把异常信息作为失败原因上报，offer 保持 PENDING。</p>
 * <p>handler 在独立线程上执行，超时后会被中断。实现需要响应中断，或以 offerId 保证副作用幂等，
 * 因为超时的 settle 之后可以再次 settle。</p>
 */
@FunctionalInterface
public interface EscrowHandler {

    EscrowOutcome attempt(EscrowCall call) throws Exception;
}
