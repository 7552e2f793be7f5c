package com.work.exchange.demo.escrow;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

import static com.work.exchange.core.support.ValidationUtils.normalizeAddress;
import static com.work.exchange.core.support.ValidationUtils.requireNonNull;

/**
 * 进程内的 ERC20 风格余额账本，供 demo escrow 使用。
 * <p>key 均为小写地址：token → (holder → balance)，token → (owner → (spender → allowance))。</p>
 */
public class TokenLedger {

    private final Map<String, Map<String, BigInteger>> balances = new HashMap<>();
    private final Map<String, Map<String, Map<String, BigInteger>>> allowances = new HashMap<>();

    public synchronized void mint(String token, String to, BigInteger amount) {
        String t = normalizeAddress(token, "token");
        String holder = normalizeAddress(to, "to");
        requireNonNegative(amount);
        Map<String, BigInteger> book = balances.computeIfAbsent(t, k -> new HashMap<>());
        book.merge(holder, amount, BigInteger::add);
    }

    public synchronized void approve(String token, String owner, String spender, BigInteger amount) {
        String t = normalizeAddress(token, "token");
        String o = normalizeAddress(owner, "owner");
        String s = normalizeAddress(spender, "spender");
        requireNonNegative(amount);
        allowances.computeIfAbsent(t, k -> new HashMap<>())
                .computeIfAbsent(o, k -> new HashMap<>())
                .put(s, amount);
    }

    public synchronized BigInteger balanceOf(String token, String holder) {
        Map<String, BigInteger> book = balances.get(normalizeAddress(token, "token"));
        if (book == null) {
            return BigInteger.ZERO;
        }
        return book.getOrDefault(normalizeAddress(holder, "holder"), BigInteger.ZERO);
    }

    public synchronized BigInteger allowance(String token, String owner, String spender) {
        Map<String, Map<String, BigInteger>> byOwner = allowances.get(normalizeAddress(token, "token"));
        if (byOwner == null) {
            return BigInteger.ZERO;
        }
        Map<String, BigInteger> bySpender = byOwner.get(normalizeAddress(owner, "owner"));
        if (bySpender == null) {
            return BigInteger.ZERO;
        }
        return bySpender.getOrDefault(normalizeAddress(spender, "spender"), BigInteger.ZERO);
    }

    /**
     * spender 代 from 转账，余额或额度不足时抛 IllegalStateException 且不做任何变更。
     */
    public synchronized void transferFrom(String token, String spender, String from, String to, BigInteger amount) {
        String t = normalizeAddress(token, "token");
        String s = normalizeAddress(spender, "spender");
        String f = normalizeAddress(from, "from");
        String r = normalizeAddress(to, "to");
        requireNonNegative(amount);

        BigInteger allowed = allowance(t, f, s);
        if (allowed.compareTo(amount) < 0) {
            throw new IllegalStateException("insufficient allowance");
        }
        BigInteger fromBalance = balanceOf(t, f);
        if (fromBalance.compareTo(amount) < 0) {
            throw new IllegalStateException("insufficient balance");
        }
        Map<String, BigInteger> book = balances.computeIfAbsent(t, k -> new HashMap<>());
        book.put(f, fromBalance.subtract(amount));
        book.merge(r, amount, BigInteger::add);
        allowances.computeIfAbsent(t, k -> new HashMap<>())
                .computeIfAbsent(f, k -> new HashMap<>())
                .put(s, allowed.subtract(amount));
    }

    private static void requireNonNegative(BigInteger amount) {
        requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount 不能为负数");
        }
    }
}
