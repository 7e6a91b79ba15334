package com.opspilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 计划过滤条件的比较运算符。
 */
public enum PlanFilterOperatorEnum {

    EQ("eq"),
    CONTAINS("contains"),
    LT("lt"),
    LTE("lte"),
    GT("gt"),
    GTE("gte");

    private final String code;

    PlanFilterOperatorEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static PlanFilterOperatorEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (PlanFilterOperatorEnum value : PlanFilterOperatorEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown filter operator: " + text);
    }
}
