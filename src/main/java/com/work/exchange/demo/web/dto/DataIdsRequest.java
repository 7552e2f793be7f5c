package com.work.exchange.demo.web.dto;

import javax.validation.constraints.NotEmpty;

import java.util.List;

public class DataIdsRequest {

    @NotEmpty(message = "dataIds 不能为空")
    private List<String> dataIds;

    public List<String> getDataIds() {
        return dataIds;
    }

    public void setDataIds(List<String> dataIds) {
        this.dataIds = dataIds;
    }
}
