package com.opspilot.domain.copilot.model.valobj;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Copilot 单次问答的完整输出。
 * <p>
 * 护栏拦截时 plan 与 result 为空，toolsUsed 为空列表。
 * </p>
 */
@Data
@Builder
public class CopilotAnswer {

    private String answer;
    private List<String> toolsUsed;
    private InventoryQueryPlan plan;
    private InventoryQueryResult result;
    private GuardrailAssessment guardrail;
}
