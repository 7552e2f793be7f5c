package com.work.exchange.core.escrow;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.exchange.core.support.ValidationUtils.normalizeAddress;
import static com.work.exchange.core.support.ValidationUtils.requireNonNull;

/**
 * escrow handler 地址簿：只有登记过的地址才能作为 offer 的 escrow（对应链上的“必须是合约地址”）。
 */
public class EscrowHandlerRegistry {

    private final Map<String, EscrowHandler> handlers = new ConcurrentHashMap<>();

    public void register(String address, EscrowHandler handler) {
        requireNonNull(handler, "handler");
        handlers.put(normalizeAddress(address, "address"), handler);
    }

    public boolean contains(String address) {
        return find(address).isPresent();
    }

    public Optional<EscrowHandler> find(String address) {
        if (address == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(address.toLowerCase(Locale.ROOT)));
    }
}
