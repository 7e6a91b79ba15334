package com.opspilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 库存分析计划的指标。
 */
public enum PlanMetricEnum {

    /**
     * 明细行。
     */
    ROWS("rows"),

    /**
     * 条目数。
     */
    COUNT_ITEMS("count_items"),

    /**
     * 数量合计。
     */
    SUM_QUANTITY("sum_quantity"),

    /**
     * 低库存条目数。
     */
    COUNT_LOW_STOCK("count_low_stock"),

    /**
     * 低库存占比。
     */
    LOW_STOCK_RATIO("low_stock_ratio");

    private final String code;

    PlanMetricEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 是否为聚合指标（rows 以外的四种）。
     */
    public boolean isAggregate() {
        return this != ROWS;
    }

    public static PlanMetricEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (PlanMetricEnum value : PlanMetricEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown plan metric: " + text);
    }
}
