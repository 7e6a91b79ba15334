package com.opspilot.trigger.application.command;

import com.opspilot.domain.copilot.adapter.gateway.IInventoryQueryExecutor;
import com.opspilot.domain.copilot.model.valobj.CopilotAnswer;
import com.opspilot.domain.copilot.model.valobj.GuardrailAssessment;
import com.opspilot.domain.copilot.model.valobj.InventoryQueryPlan;
import com.opspilot.domain.copilot.model.valobj.InventoryQueryResult;
import com.opspilot.domain.copilot.model.valobj.PlanningOutcome;
import com.opspilot.domain.copilot.service.GuardrailDomainService;
import com.opspilot.domain.copilot.service.InventoryAnswerPhraser;
import com.opspilot.domain.copilot.service.InventoryPlanSynthesizer;
import com.opspilot.trigger.application.common.AiRunTracker;
import com.opspilot.types.common.Constants;
import com.opspilot.types.enums.AiFeatureEnum;
import com.opspilot.types.enums.ResponseCode;
import com.opspilot.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;

/**
 * Inventory Copilot 写用例：护栏 → 规划 → 执行 → 措辞。
 * <p>
 * 护栏拒绝时直接返回固定提示，不规划也不调用执行器；执行器异常在上报后原样抛出。
 * </p>
 */
@Slf4j
@Service
public class InventoryCopilotCommandService {

    private final GuardrailDomainService guardrailDomainService;
    private final InventoryPlanSynthesizer inventoryPlanSynthesizer;
    private final InventoryAnswerPhraser inventoryAnswerPhraser;
    private final AiRunTracker aiRunTracker;

    public InventoryCopilotCommandService(GuardrailDomainService guardrailDomainService,
                                          InventoryPlanSynthesizer inventoryPlanSynthesizer,
                                          InventoryAnswerPhraser inventoryAnswerPhraser,
                                          AiRunTracker aiRunTracker) {
        this.guardrailDomainService = guardrailDomainService;
        this.inventoryPlanSynthesizer = inventoryPlanSynthesizer;
        this.inventoryAnswerPhraser = inventoryAnswerPhraser;
        this.aiRunTracker = aiRunTracker;
    }

    /**
     * 护栏判定并合成计划；拒绝时 plan 为空。
     */
    public PlanningOutcome classifyAndPlan(String query) {
        GuardrailAssessment guardrail = guardrailDomainService.evaluate(query);
        Counter.builder("opspilot.copilot.guardrail.total")
                .tag("action", guardrail.getAction().getCode())
                .tag("reason", guardrail.getReason().getCode())
                .register(Metrics.globalRegistry)
                .increment();
        if (guardrail.isRejected()) {
            return PlanningOutcome.builder().guardrail(guardrail).build();
        }
        InventoryQueryPlan plan = inventoryPlanSynthesizer.synthesize(query, guardrail.isModelAllowed());
        log.debug("COPILOT_PLAN_READY mode={}, plan={}", guardrail.getMode().getCode(), plan.toPayload());
        return PlanningOutcome.builder().guardrail(guardrail).plan(plan).build();
    }

    /**
     * 执行已放行的计划并生成答案。
     */
    public CopilotAnswer executeAndPhrase(String query, PlanningOutcome outcome, IInventoryQueryExecutor executor) {
        if (outcome == null || outcome.isRefused() || outcome.getPlan() == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "护栏未放行的提问不能执行");
        }
        if (executor == null) {
            throw new AppException(ResponseCode.PLAN_EXECUTION_FAILED.getCode(), "未配置库存查询执行器");
        }
        GuardrailAssessment guardrail = outcome.getGuardrail();
        InventoryQueryPlan plan = outcome.getPlan();
        InventoryQueryResult result = executor.execute(plan);
        String answer = inventoryAnswerPhraser.phrase(query, plan, result, guardrail.isModelAllowed());
        return CopilotAnswer.builder()
                .answer(answer)
                .toolsUsed(List.of(Constants.TOOL_QUERY_INVENTORY))
                .plan(plan)
                .result(result)
                .guardrail(guardrail)
                .build();
    }

    /**
     * 完整问答入口，耗时与成败上报为 inventory_copilot。
     */
    public CopilotAnswer ask(String query, IInventoryQueryExecutor executor) {
        return aiRunTracker.track(AiFeatureEnum.INVENTORY_COPILOT, () -> {
            PlanningOutcome outcome = classifyAndPlan(query);
            if (outcome.isRefused()) {
                return CopilotAnswer.builder()
                        .answer(outcome.getRefusalMessage())
                        .toolsUsed(Collections.emptyList())
                        .guardrail(outcome.getGuardrail())
                        .build();
            }
            return executeAndPhrase(query, outcome, executor);
        });
    }
}
