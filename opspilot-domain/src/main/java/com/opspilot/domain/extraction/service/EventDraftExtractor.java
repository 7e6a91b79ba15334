package com.opspilot.domain.extraction.service;

import com.opspilot.domain.extraction.model.valobj.EventDraft;

/**
 * 事件草稿抽取服务接口。
 * <p>
 * 结果总是经过归一与提示词校正：提示词中的显式时间覆盖模型推断。
 * </p>
 */
public interface EventDraftExtractor {

    EventDraft extract(String prompt);
}
