package com.opspilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 护栏动作。
 */
public enum GuardrailActionEnum {

    ALLOW("allow"),
    REJECT("reject");

    private final String code;

    GuardrailActionEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
