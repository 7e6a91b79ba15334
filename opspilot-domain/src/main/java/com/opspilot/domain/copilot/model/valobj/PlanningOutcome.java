package com.opspilot.domain.copilot.model.valobj;

import lombok.Builder;
import lombok.Data;

/**
 * 护栏 + 规划阶段的产出：放行时携带计划，拦截时计划为空。
 */
@Data
@Builder
public class PlanningOutcome {

    private GuardrailAssessment guardrail;
    private InventoryQueryPlan plan;

    public boolean isRefused() {
        return guardrail != null && guardrail.isRejected();
    }

    public String getRefusalMessage() {
        return isRefused() ? guardrail.getMessage() : null;
    }
}
