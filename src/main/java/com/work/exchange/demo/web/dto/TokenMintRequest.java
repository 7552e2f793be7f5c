package com.work.exchange.demo.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * demo token 铸币请求体。
 */
public class TokenMintRequest {

    @NotBlank(message = "token 不能为空")
    private String token;

    @NotBlank(message = "to 不能为空")
    private String to;

    @NotNull(message = "amount 不能为null")
    private BigInteger amount;

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }
}
