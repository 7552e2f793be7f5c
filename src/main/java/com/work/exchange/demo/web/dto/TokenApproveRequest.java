package com.work.exchange.demo.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * owner 取自 X-Caller。
 */
public class TokenApproveRequest {

    @NotBlank(message = "token 不能为空")
    private String token;

    @NotBlank(message = "spender 不能为空")
    private String spender;

    @NotNull(message = "amount 不能为null")
    private BigInteger amount;

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getSpender() {
        return spender;
    }

    public void setSpender(String spender) {
        this.spender = spender;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }
}
