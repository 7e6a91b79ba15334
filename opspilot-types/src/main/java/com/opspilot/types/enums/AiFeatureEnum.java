package com.opspilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * AI 调用功能点，用于调用记录。
 */
public enum AiFeatureEnum {

    INVENTORY_COPILOT("inventory_copilot"),
    INVENTORY_IMPORT_PARSE("inventory_import_parse"),
    EVENTS_NL_CREATE("events_nl_create"),
    EVENTS_SUGGEST_ALTERNATIVES("events_suggest_alternatives"),
    EVENTS_GENERATE_DESCRIPTION("events_generate_description"),
    EVENTS_GENERATE_INVITE("events_generate_invite");

    private final String code;

    AiFeatureEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
