package com.work.exchange.demo.web.dto;

import javax.validation.constraints.NotBlank;

public class TemporaryAccountRequest {

    /** 身份原文的 keccak256。 */
    @NotBlank(message = "identityHash 不能为空")
    private String identityHash;

    public String getIdentityHash() {
        return identityHash;
    }

    public void setIdentityHash(String identityHash) {
        this.identityHash = identityHash;
    }
}
