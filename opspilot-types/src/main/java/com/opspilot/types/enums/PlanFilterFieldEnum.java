package com.opspilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 计划过滤条件可用的字段。
 * <p>
 * 每个字段绑定一种取值类型与允许的运算符集合，执行层按此做穷举匹配。
 * </p>
 */
public enum PlanFilterFieldEnum {

    NAME("name", ValueType.TEXT),
    VENDOR("vendor", ValueType.TEXT),
    CATEGORY("category", ValueType.TEXT),
    STATUS("status", ValueType.TEXT),
    UNIT("unit", ValueType.TEXT),
    QUANTITY("quantity", ValueType.NUMBER),
    LOW_STOCK("low_stock", ValueType.BOOLEAN);

    private final String code;
    private final ValueType valueType;

    PlanFilterFieldEnum(String code, ValueType valueType) {
        this.code = code;
        this.valueType = valueType;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public ValueType getValueType() {
        return valueType;
    }

    public static PlanFilterFieldEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (PlanFilterFieldEnum value : PlanFilterFieldEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown filter field: " + text);
    }

    /**
     * 过滤值类型。
     */
    public enum ValueType {
        TEXT,
        NUMBER,
        BOOLEAN
    }
}
