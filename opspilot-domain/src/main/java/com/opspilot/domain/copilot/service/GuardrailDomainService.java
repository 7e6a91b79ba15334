package com.opspilot.domain.copilot.service;

import com.opspilot.domain.copilot.model.valobj.GuardrailAssessment;
import com.opspilot.domain.copilot.service.GuardrailScoringDomainService.GuardrailScore;
import com.opspilot.domain.copilot.service.GuardrailSignalDomainService.GuardrailSignals;
import com.opspilot.domain.text.service.TextNormalizeDomainService;
import com.opspilot.types.enums.GuardrailActionEnum;
import com.opspilot.types.enums.GuardrailReasonEnum;
import com.opspilot.types.enums.GuardrailSignalEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 护栏领域服务：判定提问是否在库存范围内，以及允许模型参与的程度。
 * <p>
 * 判定顺序固定，首个命中即返回：
 * <ol>
 *     <li>空提问拒绝；</li>
 *     <li>金融市场语境（无引号条目、无强库存意图）拒绝；</li>
 *     <li>SQL 语句形态（无引号条目）拒绝；</li>
 *     <li>无库存意图且命中范围外话题拒绝；</li>
 *     <li>无库存意图且风险分 &gt;= 60 拒绝；</li>
 *     <li>无库存意图且超过 5 个词拒绝；</li>
 *     <li>风险分 &gt;= 35 放行但强制确定性模式；</li>
 *     <li>其余放行。</li>
 * </ol>
 * </p>
 */
@Slf4j
@Service
public class GuardrailDomainService {

    static final int REJECT_RISK_THRESHOLD = 60;
    static final int DETERMINISTIC_RISK_THRESHOLD = 35;
    static final int UNCLEAR_SCOPE_WORD_COUNT = 5;

    private final TextNormalizeDomainService textNormalizeDomainService;
    private final GuardrailSignalDomainService guardrailSignalDomainService;
    private final GuardrailScoringDomainService guardrailScoringDomainService;

    public GuardrailDomainService(TextNormalizeDomainService textNormalizeDomainService,
                                  GuardrailSignalDomainService guardrailSignalDomainService,
                                  GuardrailScoringDomainService guardrailScoringDomainService) {
        this.textNormalizeDomainService = textNormalizeDomainService;
        this.guardrailSignalDomainService = guardrailSignalDomainService;
        this.guardrailScoringDomainService = guardrailScoringDomainService;
    }

    public GuardrailAssessment evaluate(String rawQuery) {
        String query = textNormalizeDomainService.normalizeQuery(rawQuery);
        GuardrailSignals signals = guardrailSignalDomainService.detect(query);
        GuardrailScore score = guardrailScoringDomainService.score(signals);
        GuardrailAssessment assessment = decide(signals, score);
        if (assessment.isRejected()) {
            log.info("COPILOT_GUARDRAIL_REJECT reason={}, riskScore={}, signals={}",
                    assessment.getReason().getCode(), assessment.getRiskScore(), assessment.getSignalCodes());
        } else {
            log.debug("COPILOT_GUARDRAIL_ALLOW reason={}, riskScore={}, mode={}",
                    assessment.getReason().getCode(), assessment.getRiskScore(), assessment.getMode().getCode());
        }
        return assessment;
    }

    GuardrailAssessment decide(GuardrailSignals signals, GuardrailScore score) {
        if (signals.emptyQuery()) {
            return reject(GuardrailReasonEnum.EMPTY_QUERY, score);
        }
        if (signals.financeMarketIntent() && !signals.quotedTerm() && !signals.strongInventoryIntent()) {
            return reject(GuardrailReasonEnum.OUT_OF_SCOPE_FINANCE, score);
        }
        if (signals.sqlLikeSyntax() && !signals.quotedTerm()) {
            return reject(GuardrailReasonEnum.UNSUPPORTED_SQL_STYLE_QUERY, score);
        }
        if (!signals.inventoryIntent()) {
            if (signals.outOfScopeIntent()) {
                return reject(GuardrailReasonEnum.OUT_OF_SCOPE, score);
            }
            if (score.riskScore() >= REJECT_RISK_THRESHOLD) {
                return reject(GuardrailReasonEnum.PROMPT_INJECTION_OUT_OF_SCOPE, score);
            }
            if (signals.wordCount() > UNCLEAR_SCOPE_WORD_COUNT) {
                return reject(GuardrailReasonEnum.UNCLEAR_SCOPE, score);
            }
        }
        boolean forceDeterministic = score.riskScore() >= DETERMINISTIC_RISK_THRESHOLD
                || score.has(GuardrailSignalEnum.PROMPT_INJECTION_WITH_INVENTORY);
        return GuardrailAssessment.builder()
                .action(GuardrailActionEnum.ALLOW)
                .reason(forceDeterministic
                        ? GuardrailReasonEnum.GUARDED_INVENTORY_QUERY
                        : GuardrailReasonEnum.INVENTORY_QUERY)
                .forceDeterministic(forceDeterministic)
                .riskScore(score.riskScore())
                .signals(score.signals())
                .build();
    }

    private GuardrailAssessment reject(GuardrailReasonEnum reason, GuardrailScore score) {
        return GuardrailAssessment.builder()
                .action(GuardrailActionEnum.REJECT)
                .reason(reason)
                .forceDeterministic(true)
                .riskScore(score.riskScore())
                .signals(score.signals())
                .build();
    }
}
