package com.work.exchange.core.model;

/**
 * 账户记录。临时账户由 controller 代为创建，owner 为空，直到通过 unlockTemporary 绑定真实 owner。
 */
public class Account {

    private final String accountId;
    private String owner;
    private final String identityHash;
    private final String controller;
    private boolean temporary;

    public Account(String accountId, String owner, String identityHash, String controller, boolean temporary) {
        this.accountId = accountId;
        this.owner = owner;
        this.identityHash = identityHash;
        this.controller = controller;
        this.temporary = temporary;
    }

    public static Account permanent(String accountId, String owner) {
        return new Account(accountId, owner, null, null, false);
    }

    public static Account temporary(String accountId, String identityHash, String controller) {
        return new Account(accountId, null, identityHash, controller, true);
    }

    public String getAccountId() {
        return accountId;
    }

    public String getOwner() {
        return owner;
    }

    public String getIdentityHash() {
        return identityHash;
    }

    public String getController() {
        return controller;
    }

    public boolean isTemporary() {
        return temporary;
    }

    public void unlock(String newOwner) {
        this.owner = newOwner;
        this.temporary = false;
    }
}
