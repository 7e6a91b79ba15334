package com.opspilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 护栏风险信号及其权重表。
 * <p>
 * 权重为纯数据：评分时按命中信号累加（负权重表示降级），再裁剪到 [0, 100]。
 * 判定阈值不在此处定义。
 * </p>
 */
public enum GuardrailSignalEnum {

    EMPTY_QUERY("empty_query", 0),
    PROMPT_INJECTION_REGEX("prompt_injection_regex", 65),
    PROMPT_INJECTION_FUZZY("prompt_injection_fuzzy", 45),
    XML_SYSTEM_TAG("xml_system_tag", 20),
    OUT_OF_SCOPE_INTENT("out_of_scope_intent", 35),
    FINANCE_MARKET_INTENT("finance_market_intent", 45),
    SQL_LIKE_SYNTAX("sql_like_syntax", 55),
    LONG_NON_INVENTORY_QUERY("long_non_inventory_query", 10),
    INVENTORY_INTENT("inventory_intent", -25),
    QUOTED_ITEM_TERM("quoted_item_term", -10),

    /**
     * 注入与库存意图同时出现：不加权，而是把分数下限抬到 40 并强制确定性模式。
     */
    PROMPT_INJECTION_WITH_INVENTORY("prompt_injection_with_inventory", 0);

    private final String code;
    private final int weight;

    GuardrailSignalEnum(String code, int weight) {
        this.code = code;
        this.weight = weight;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getWeight() {
        return weight;
    }
}
