package com.opspilot.domain.ai.adapter.gateway;

import com.opspilot.domain.ai.model.valobj.AiRunRecord;

/**
 * AI 调用记录端口：上报每次流水线调用的成败与耗时。
 * <p>
 * 上报是尽力而为的副作用，实现失败不得影响流水线结果。
 * </p>
 */
public interface IAiRunReporter {

    void report(AiRunRecord record);
}
