package com.work.exchange.core.support;

import com.work.exchange.core.model.Account;
import com.work.exchange.core.repository.AccountStore;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.work.exchange.core.support.ValidationUtils.requireNonNull;

/**
 * 纯内存实现，不具备跨进程一致性。读取返回副本。
 */
public class InMemoryAccountStore implements AccountStore {

    private final Map<String, Account> accounts = new HashMap<>();
    private final Map<String, String> accountIdByOwner = new HashMap<>();
    private final Map<String, String> accountIdByIdentityHash = new HashMap<>();

    @Override
    public synchronized boolean exists(String accountId) {
        return accountId != null && accounts.containsKey(accountId);
    }

    @Override
    public synchronized Optional<Account> find(String accountId) {
        Account account = accountId == null ? null : accounts.get(accountId);
        if (account == null) {
            return Optional.empty();
        }
        return Optional.of(new Account(account.getAccountId(), account.getOwner(), account.getIdentityHash(),
                account.getController(), account.isTemporary()));
    }

    @Override
    public synchronized Optional<String> findIdByOwner(String owner) {
        return Optional.ofNullable(accountIdByOwner.get(owner));
    }

    @Override
    public synchronized Optional<String> findIdByIdentityHash(String identityHash) {
        return Optional.ofNullable(accountIdByIdentityHash.get(identityHash));
    }

    @Override
    public synchronized boolean insert(Account account) {
        requireNonNull(account, "account");
        if (accounts.containsKey(account.getAccountId())
                || (account.getOwner() != null && accountIdByOwner.containsKey(account.getOwner()))
                || (account.getIdentityHash() != null && accountIdByIdentityHash.containsKey(account.getIdentityHash()))) {
            return false;
        }
        accounts.put(account.getAccountId(), new Account(account.getAccountId(), account.getOwner(),
                account.getIdentityHash(), account.getController(), account.isTemporary()));
        if (account.getOwner() != null) {
            accountIdByOwner.put(account.getOwner(), account.getAccountId());
        }
        if (account.getIdentityHash() != null) {
            accountIdByIdentityHash.put(account.getIdentityHash(), account.getAccountId());
        }
        return true;
    }

    @Override
    public synchronized boolean unlock(String accountId, String owner) {
        Account account = accounts.get(accountId);
        if (account == null || !account.isTemporary() || accountIdByOwner.containsKey(owner)) {
            return false;
        }
        account.unlock(owner);
        accountIdByOwner.put(owner, accountId);
        return true;
    }
}
