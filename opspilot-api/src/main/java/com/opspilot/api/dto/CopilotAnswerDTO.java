package com.opspilot.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Inventory Copilot 回答。
 */
@Data
public class CopilotAnswerDTO {

    private String answer;
    private List<String> toolsUsed;
    private QueryPlanDTO plan;
    private Map<String, Object> result;
    private GuardrailDTO guardrail;
}
