package com.work.exchange.core.registry;

import org.web3j.crypto.Hash;

/**
 * app 名称的链上表示：keccak256(utf8(name))。
 */
public final class AppNames {

    private AppNames() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static String hash(String name) {
        return Hash.sha3String(name);
    }
}
