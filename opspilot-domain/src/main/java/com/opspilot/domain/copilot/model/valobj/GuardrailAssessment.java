package com.opspilot.domain.copilot.model.valobj;

import com.opspilot.types.enums.CopilotModeEnum;
import com.opspilot.types.enums.GuardrailActionEnum;
import com.opspilot.types.enums.GuardrailReasonEnum;
import com.opspilot.types.enums.GuardrailSignalEnum;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 护栏评估结果，单次请求内有效。
 */
@Getter
@ToString
public final class GuardrailAssessment {

    private final GuardrailActionEnum action;
    private final GuardrailReasonEnum reason;
    private final boolean forceDeterministic;
    private final int riskScore;
    private final Set<GuardrailSignalEnum> signals;

    @Builder
    private GuardrailAssessment(GuardrailActionEnum action,
                                GuardrailReasonEnum reason,
                                boolean forceDeterministic,
                                int riskScore,
                                Set<GuardrailSignalEnum> signals) {
        this.action = action;
        this.reason = reason;
        this.forceDeterministic = forceDeterministic;
        this.riskScore = Math.max(0, Math.min(100, riskScore));
        this.signals = signals == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(signals));
    }

    public boolean isRejected() {
        return action == GuardrailActionEnum.REJECT;
    }

    /**
     * 面向用户的提示语，仅拒绝时非空。
     */
    public String getMessage() {
        return isRejected() ? reason.getMessage() : "";
    }

    public CopilotModeEnum getMode() {
        if (isRejected()) {
            return CopilotModeEnum.BLOCKED;
        }
        return forceDeterministic ? CopilotModeEnum.DETERMINISTIC : CopilotModeEnum.HYBRID;
    }

    public boolean isModelAllowed() {
        return !isRejected() && !forceDeterministic;
    }

    public List<String> getSignalCodes() {
        List<String> codes = new ArrayList<>(signals.size());
        for (GuardrailSignalEnum signal : signals) {
            codes.add(signal.getCode());
        }
        return codes;
    }
}
