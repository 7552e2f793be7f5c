package com.work.exchange.demo.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

import java.util.List;

/**
 * prepare 请求体：escrow 三元组在创建后不可修改。
 */
public class PrepareOfferRequest {

    /** provider app 名称。 */
    @NotBlank(message = "provider 不能为空")
    private String provider;

    @NotBlank(message = "consumer 不能为空")
    private String consumer;

    /** 已注册的 escrow handler 地址。 */
    @NotBlank(message = "escrowHandler 不能为空")
    private String escrowHandler;

    /** 4 字节 selector，0x 开头。 */
    @NotBlank(message = "escrowSelector 不能为空")
    private String escrowSelector;

    /** 预编码参数，缺省为 0x。 */
    private String escrowArgs;

    @NotNull(message = "dataIds 不能为null")
    private List<String> dataIds;

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getConsumer() {
        return consumer;
    }

    public void setConsumer(String consumer) {
        this.consumer = consumer;
    }

    public String getEscrowHandler() {
        return escrowHandler;
    }

    public void setEscrowHandler(String escrowHandler) {
        this.escrowHandler = escrowHandler;
    }

    public String getEscrowSelector() {
        return escrowSelector;
    }

    public void setEscrowSelector(String escrowSelector) {
        this.escrowSelector = escrowSelector;
    }

    public String getEscrowArgs() {
        return escrowArgs;
    }

    public void setEscrowArgs(String escrowArgs) {
        this.escrowArgs = escrowArgs;
    }

    public List<String> getDataIds() {
        return dataIds;
    }

    public void setDataIds(List<String> dataIds) {
        this.dataIds = dataIds;
    }
}
