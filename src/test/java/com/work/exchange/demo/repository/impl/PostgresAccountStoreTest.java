package com.work.exchange.demo.repository.impl;

import com.work.exchange.core.model.Account;
import com.work.exchange.demo.repository.entity.AccountEntity;
import com.work.exchange.demo.repository.mapper.AccountMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class PostgresAccountStoreTest {

    private static final String ACCOUNT_ID = "0x00000000000000aa";
    private static final String OWNER = "0x1111111111111111111111111111111111111111";
    private static final String CONTROLLER = "0x5555555555555555555555555555555555555555";

    private AccountMapper accountMapper;
    private PostgresAccountStore store;

    @BeforeEach
    public void setUp() {
        accountMapper = mock(AccountMapper.class);
        store = new PostgresAccountStore(accountMapper);
    }

    @Test
    public void insert_maps_every_column_and_reports_conflicts() {
        when(accountMapper.insertIfAbsent(any(AccountEntity.class))).thenReturn(1, 0);
        Account temporary = Account.temporary(ACCOUNT_ID, "0xabc", CONTROLLER);

        assertTrue(store.insert(temporary));
        assertFalse(store.insert(temporary));

        ArgumentCaptor<AccountEntity> captor = ArgumentCaptor.forClass(AccountEntity.class);
        verify(accountMapper, times(2)).insertIfAbsent(captor.capture());
        AccountEntity written = captor.getAllValues().get(0);
        assertEquals(ACCOUNT_ID, written.getAccountId());
        assertNull(written.getOwner());
        assertEquals("0xabc", written.getIdentityHash());
        assertEquals(CONTROLLER, written.getController());
        assertTrue(written.getTemporary());
        assertNotNull(written.getCreatedAt());
    }

    @Test
    public void find_converts_the_row() {
        AccountEntity entity = new AccountEntity();
        entity.setAccountId(ACCOUNT_ID);
        entity.setOwner(OWNER);
        entity.setTemporary(false);
        when(accountMapper.selectById(ACCOUNT_ID)).thenReturn(entity);
        when(accountMapper.selectIdByOwner(OWNER)).thenReturn(ACCOUNT_ID);

        Account account = store.find(ACCOUNT_ID).orElseThrow(IllegalStateException::new);

        assertEquals(OWNER, account.getOwner());
        assertFalse(account.isTemporary());
        assertEquals(ACCOUNT_ID, store.findIdByOwner(OWNER).orElse(null));
        assertFalse(store.findIdByIdentityHash("0xabc").isPresent());
        assertFalse(store.find("0x00000000000000bb").isPresent());
        assertFalse(store.find(null).isPresent());
        assertFalse(store.exists(null));
    }

    @Test
    public void unlock_fails_when_already_claimed_or_owner_taken() {
        when(accountMapper.unlockTemporary(eq(ACCOUNT_ID), eq(OWNER), any(Instant.class)))
                .thenReturn(1, 0)
                .thenThrow(new DuplicateKeyException("account_owner_key"));

        assertTrue(store.unlock(ACCOUNT_ID, OWNER));
        assertFalse(store.unlock(ACCOUNT_ID, OWNER));
        assertFalse(store.unlock(ACCOUNT_ID, OWNER));
    }
}
