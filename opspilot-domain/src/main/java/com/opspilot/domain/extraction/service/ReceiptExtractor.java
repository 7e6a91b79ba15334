package com.opspilot.domain.extraction.service;

import com.opspilot.domain.extraction.model.valobj.ReceiptExtraction;

/**
 * 收据抽取服务接口：优先模型抽取，失败时使用确定性解析，结果总是经过条目归一。
 */
public interface ReceiptExtractor {

    ReceiptExtraction extract(String rawText);
}
