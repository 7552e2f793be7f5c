package com.work.exchange.core.repository;

import com.work.exchange.core.model.Account;

import java.util.Optional;

/**
 * 账户仓储。owner 与 identityHash 各自全局唯一，唯一性由实现保证（跨节点时靠数据库约束）。
 */
public interface AccountStore {

    boolean exists(String accountId);

    Optional<Account> find(String accountId);

    Optional<String> findIdByOwner(String owner);

    Optional<String> findIdByIdentityHash(String identityHash);

    /**
     * @return false 表示 accountId、owner 或 identityHash 已被占用，未写入
     */
    boolean insert(Account account);

    /**
     * 把临时账户绑定到 owner 并转为普通账户。
     *
     * @return false 表示账户已不是临时账户，或 owner 已有账户
     */
    boolean unlock(String accountId, String owner);
}
