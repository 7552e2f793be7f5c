package com.work.exchange.demo.web.dto;

import javax.validation.constraints.NotBlank;

/**
 * 注册 app 的请求体，owner 取自 X-Caller。
 */
public class RegisterAppRequest {

    @NotBlank(message = "name 不能为空")
    private String name;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
