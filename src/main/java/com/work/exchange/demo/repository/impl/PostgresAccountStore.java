package com.work.exchange.demo.repository.impl;

import com.work.exchange.core.model.Account;
import com.work.exchange.core.repository.AccountStore;
import com.work.exchange.demo.repository.entity.AccountEntity;
import com.work.exchange.demo.repository.mapper.AccountMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static com.work.exchange.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL 的账户仓储。owner、identity_hash 的唯一性由表约束保证，多节点并发开户/认领时只有一方成功。
 */
@Repository
@ConditionalOnProperty(prefix = "exchange.storage", name = "mode", havingValue = "postgres")
public class PostgresAccountStore implements AccountStore {

    private static final Logger log = LoggerFactory.getLogger(PostgresAccountStore.class);

    private final AccountMapper accountMapper;

    public PostgresAccountStore(AccountMapper accountMapper) {
        this.accountMapper = accountMapper;
    }

    @Override
    public boolean exists(String accountId) {
        return accountId != null && accountMapper.existsById(accountId);
    }

    @Override
    public Optional<Account> find(String accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        AccountEntity entity = accountMapper.selectById(accountId);
        if (entity == null) {
            return Optional.empty();
        }
        return Optional.of(new Account(entity.getAccountId(), entity.getOwner(), entity.getIdentityHash(),
                entity.getController(), Boolean.TRUE.equals(entity.getTemporary())));
    }

    @Override
    public Optional<String> findIdByOwner(String owner) {
        return Optional.ofNullable(accountMapper.selectIdByOwner(owner));
    }

    @Override
    public Optional<String> findIdByIdentityHash(String identityHash) {
        return Optional.ofNullable(accountMapper.selectIdByIdentityHash(identityHash));
    }

    @Override
    public boolean insert(Account account) {
        requireNonNull(account, "account");
        Instant now = Instant.now();
        AccountEntity entity = new AccountEntity();
        entity.setAccountId(account.getAccountId());
        entity.setOwner(account.getOwner());
        entity.setIdentityHash(account.getIdentityHash());
        entity.setController(account.getController());
        entity.setTemporary(account.isTemporary());
        entity.setUpdatedAt(now);
        entity.setCreatedAt(now);
        return accountMapper.insertIfAbsent(entity) > 0;
    }

    @Override
    public boolean unlock(String accountId, String owner) {
        try {
            return accountMapper.unlockTemporary(accountId, owner, Instant.now()) > 0;
        } catch (DuplicateKeyException e) {
            log.warn("owner already bound to another account accountId={} owner={}", accountId, owner);
            return false;
        }
    }
}
