package com.opspilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 库存分析计划的分组维度。
 */
public enum PlanGroupByEnum {

    NONE("none"),
    CATEGORY("category"),
    VENDOR("vendor"),
    STATUS("status"),
    UNIT("unit"),
    ITEM("item");

    private final String code;

    PlanGroupByEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isGrouped() {
        return this != NONE;
    }

    public static PlanGroupByEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (PlanGroupByEnum value : PlanGroupByEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown plan group_by: " + text);
    }
}
