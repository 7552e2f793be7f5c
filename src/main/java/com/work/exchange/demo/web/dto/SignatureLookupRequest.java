package com.work.exchange.demo.web.dto;

import javax.validation.constraints.NotBlank;

public class SignatureLookupRequest {

    @NotBlank(message = "messageHash 不能为空")
    private String messageHash;

    @NotBlank(message = "signature 不能为空")
    private String signature;

    public String getMessageHash() {
        return messageHash;
    }

    public void setMessageHash(String messageHash) {
        this.messageHash = messageHash;
    }

    public String getSignature() {
        return signature;
    }

    public void setSignature(String signature) {
        this.signature = signature;
    }
}
