package com.opspilot.domain.copilot.service;

import com.opspilot.domain.copilot.service.GuardrailSignalDomainService.GuardrailSignals;
import com.opspilot.types.enums.GuardrailSignalEnum;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 护栏评分领域服务：按 {@link GuardrailSignalEnum} 权重表累加风险分。
 * <p>
 * 评分与判定阈值分离，判定见 {@link GuardrailDomainService}。
 * </p>
 */
@Service
public class GuardrailScoringDomainService {

    static final int LONG_QUERY_WORD_COUNT = 8;
    static final int INJECTION_WITH_INVENTORY_FLOOR = 40;

    public GuardrailScore score(GuardrailSignals signals) {
        Set<GuardrailSignalEnum> fired = new LinkedHashSet<>();
        if (signals == null || signals.emptyQuery()) {
            fired.add(GuardrailSignalEnum.EMPTY_QUERY);
            return new GuardrailScore(0, fired);
        }

        if (signals.promptInjectionRegex()) {
            fired.add(GuardrailSignalEnum.PROMPT_INJECTION_REGEX);
        }
        if (signals.promptInjectionFuzzy()) {
            fired.add(GuardrailSignalEnum.PROMPT_INJECTION_FUZZY);
        }
        if (signals.systemTag()) {
            fired.add(GuardrailSignalEnum.XML_SYSTEM_TAG);
        }
        if (signals.outOfScopeIntent() && !signals.inventoryIntent()) {
            fired.add(GuardrailSignalEnum.OUT_OF_SCOPE_INTENT);
        }
        if (signals.financeMarketIntent()) {
            fired.add(GuardrailSignalEnum.FINANCE_MARKET_INTENT);
        }
        if (signals.sqlLikeSyntax()) {
            fired.add(GuardrailSignalEnum.SQL_LIKE_SYNTAX);
        }
        if (!signals.inventoryIntent() && signals.wordCount() > LONG_QUERY_WORD_COUNT) {
            fired.add(GuardrailSignalEnum.LONG_NON_INVENTORY_QUERY);
        }
        if (signals.inventoryIntent()) {
            fired.add(GuardrailSignalEnum.INVENTORY_INTENT);
            if (signals.quotedTerm()) {
                fired.add(GuardrailSignalEnum.QUOTED_ITEM_TERM);
            }
        }

        int score = 0;
        for (GuardrailSignalEnum signal : fired) {
            score += signal.getWeight();
        }
        if (signals.promptInjection() && signals.inventoryIntent()) {
            fired.add(GuardrailSignalEnum.PROMPT_INJECTION_WITH_INVENTORY);
            score = Math.max(score, INJECTION_WITH_INVENTORY_FLOOR);
        }
        return new GuardrailScore(clamp(score), fired);
    }

    private int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }

    /**
     * 评分结果。
     */
    public record GuardrailScore(int riskScore, Set<GuardrailSignalEnum> signals) {

        public GuardrailScore {
            signals = Collections.unmodifiableSet(new LinkedHashSet<>(signals));
        }

        public boolean has(GuardrailSignalEnum signal) {
            return signals.contains(signal);
        }
    }
}
