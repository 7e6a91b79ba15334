package com.opspilot.infrastructure.report;

import com.opspilot.domain.ai.adapter.gateway.IAiRunReporter;
import com.opspilot.domain.ai.model.valobj.AiRunRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * AI 调用记录上报：写结构化日志并记录 Micrometer 计数与耗时。
 */
@Slf4j
@Component
public class LoggingAiRunReporter implements IAiRunReporter {

    @Override
    public void report(AiRunRecord record) {
        if (record == null) {
            return;
        }
        String feature = record.getFeature() == null ? "unknown" : record.getFeature().getCode();
        String outcome = record.isSuccess() ? "success" : "failure";
        if (record.isSuccess()) {
            log.info("AI_RUN feature={}, model={}, promptVersion={}, success=true, latencyMs={}",
                    feature, record.getModel(), record.getPromptVersion(), record.getLatencyMs());
        } else {
            log.warn("AI_RUN feature={}, model={}, promptVersion={}, success=false, latencyMs={}, error={}",
                    feature, record.getModel(), record.getPromptVersion(), record.getLatencyMs(), record.getError());
        }
        Counter.builder("opspilot.ai.run.total")
                .tag("feature", feature)
                .tag("outcome", outcome)
                .register(Metrics.globalRegistry)
                .increment();
        Timer.builder("opspilot.ai.run.duration")
                .tag("feature", feature)
                .tag("outcome", outcome)
                .register(Metrics.globalRegistry)
                .record(record.getLatencyMs(), TimeUnit.MILLISECONDS);
    }
}
