package com.work.exchange.core.exception;

/**
 * 组件内部的统一异常类型，便于业务侧捕获或转换为 HTTP/RPC 错误码。
 * <p>message 即对外稳定的 reason 字符串，调用方（以及测试）可以直接据此断言失败原因。</p>
 */
public class ExchangeException extends RuntimeException {

    public ExchangeException(String message) {
        super(message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过重试解决（例如分布式锁竞争）。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
