package com.work.exchange.demo.web.dto;

import javax.validation.constraints.NotBlank;

/**
 * 认领临时账户的请求体，调用方必须是开户时的 controller。
 */
public class UnlockAccountRequest {

    @NotBlank(message = "identityPreimage 不能为空")
    private String identityPreimage;

    @NotBlank(message = "newOwner 不能为空")
    private String newOwner;

    /** newOwner 对 keccak256(identityPreimage ‖ newOwner) 的签名。 */
    @NotBlank(message = "passwordSignature 不能为空")
    private String passwordSignature;

    public String getIdentityPreimage() {
        return identityPreimage;
    }

    public void setIdentityPreimage(String identityPreimage) {
        this.identityPreimage = identityPreimage;
    }

    public String getNewOwner() {
        return newOwner;
    }

    public void setNewOwner(String newOwner) {
        this.newOwner = newOwner;
    }

    public String getPasswordSignature() {
        return passwordSignature;
    }

    public void setPasswordSignature(String passwordSignature) {
        this.passwordSignature = passwordSignature;
    }
}
