package com.opspilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 护栏判定原因。
 * <p>
 * 拒绝类原因各自绑定一条固定的面向用户提示语；放行类原因提示语为空。
 * </p>
 */
public enum GuardrailReasonEnum {

    EMPTY_QUERY("empty_query",
            "Inventory Copilot needs a question. Try examples like "
                    + "'what's low stock?' or 'do we have usb-c cable?'."),

    OUT_OF_SCOPE_FINANCE("out_of_scope_finance",
            "That looks like financial-market context, which is outside inventory scope. "
                    + "I can help with inventory stock levels, availability, categories, and status."),

    UNSUPPORTED_SQL_STYLE_QUERY("unsupported_sql_style_query",
            "SQL-style queries are not supported here. "
                    + "Ask in natural language, e.g. 'show category counts' or 'what is low stock?'."),

    OUT_OF_SCOPE("out_of_scope",
            "That looks outside inventory scope. I can help with availability, low stock, "
                    + "counts, categories, and status."),

    PROMPT_INJECTION_OUT_OF_SCOPE("prompt_injection_out_of_scope",
            "I can only help with inventory questions. "
                    + "I cannot follow requests about prompts, roles, or hidden instructions."),

    UNCLEAR_SCOPE("unclear_scope",
            "I can answer inventory-related questions only. "
                    + "Try asking about item availability, low stock, category counts, or status."),

    GUARDED_INVENTORY_QUERY("guarded_inventory_query", ""),

    INVENTORY_QUERY("inventory_query", "");

    private final String code;
    private final String message;

    GuardrailReasonEnum(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
