package com.opspilot.trigger.application.common;

import com.google.common.base.Stopwatch;
import com.opspilot.domain.ai.adapter.gateway.IAiRunReporter;
import com.opspilot.domain.ai.adapter.gateway.IGenerativeModelGateway;
import com.opspilot.domain.ai.model.valobj.AiRunRecord;
import com.opspilot.types.common.Constants;
import com.opspilot.types.enums.AiFeatureEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * AI 流水线调用计时与上报。
 * <p>
 * 成功与失败都会上报耗时；失败时原异常原样抛出。上报本身失败只记录日志。
 * </p>
 */
@Slf4j
@Component
public class AiRunTracker {

    private final IAiRunReporter aiRunReporter;
    private final IGenerativeModelGateway generativeModelGateway;

    public AiRunTracker(IAiRunReporter aiRunReporter, IGenerativeModelGateway generativeModelGateway) {
        this.aiRunReporter = aiRunReporter;
        this.generativeModelGateway = generativeModelGateway;
    }

    public <T> T track(AiFeatureEnum feature, Supplier<T> action) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            T result = action.get();
            report(feature, true, stopwatch, "");
            return result;
        } catch (RuntimeException ex) {
            report(feature, false, stopwatch, StringUtils.defaultString(ex.getMessage(), ex.getClass().getSimpleName()));
            throw ex;
        }
    }

    private void report(AiFeatureEnum feature, boolean success, Stopwatch stopwatch, String error) {
        try {
            aiRunReporter.report(AiRunRecord.builder()
                    .feature(feature)
                    .promptVersion(Constants.PROMPT_VERSION)
                    .model(generativeModelGateway.getModelName())
                    .success(success)
                    .latencyMs(stopwatch.elapsed(TimeUnit.MILLISECONDS))
                    .error(error)
                    .build());
        } catch (RuntimeException ex) {
            log.warn("AI_RUN_REPORT_FAILED feature={}, error={}", feature.getCode(), ex.getMessage());
        }
    }
}
