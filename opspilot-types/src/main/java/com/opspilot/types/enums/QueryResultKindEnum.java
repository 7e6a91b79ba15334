package com.opspilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 计划执行结果的形态。
 */
public enum QueryResultKindEnum {

    /**
     * 单值结果（group_by = none 的聚合指标）。
     */
    SCALAR("scalar"),

    /**
     * 分组结果。
     */
    GROUPED("grouped"),

    /**
     * 明细行结果。
     */
    ROWS("rows");

    private final String code;

    QueryResultKindEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
