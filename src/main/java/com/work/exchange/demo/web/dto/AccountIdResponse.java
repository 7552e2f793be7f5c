package com.work.exchange.demo.web.dto;

public class AccountIdResponse {

    private String accountId;

    public String getAccountId() {
        return accountId;
    }

    public void setAccountId(String accountId) {
        this.accountId = accountId;
    }
}
