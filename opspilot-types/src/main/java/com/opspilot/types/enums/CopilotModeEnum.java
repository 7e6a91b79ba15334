package com.opspilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Copilot 运行模式。
 */
public enum CopilotModeEnum {

    /**
     * 被护栏拦截，未规划也未执行。
     */
    BLOCKED("blocked"),

    /**
     * 确定性模式：不调用生成式模型。
     */
    DETERMINISTIC("deterministic"),

    /**
     * 混合模式：允许调用模型，但结果必须校验并可降级。
     */
    HYBRID("hybrid");

    private final String code;

    CopilotModeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
