package com.work.exchange.core.model;

import java.util.Objects;

/**
 * escrow 调用描述：handler 地址 + 4 字节方法选择器 + 预编码参数。prepare 之后不可变。
 */
public final class Escrow {

    private final String handler;
    private final String selector;
    private final String args;

    public Escrow(String handler, String selector, String args) {
        this.handler = handler;
        this.selector = selector;
        this.args = args;
    }

    public String getHandler() {
        return handler;
    }

    public String getSelector() {
        return selector;
    }

    public String getArgs() {
        return args;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Escrow)) return false;
        Escrow escrow = (Escrow) o;
        return handler.equals(escrow.handler)
                && selector.equals(escrow.selector)
                && args.equals(escrow.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(handler, selector, args);
    }

    @Override
    public String toString() {
        return "Escrow{handler='" + handler + "', selector='" + selector + "'}";
    }
}
