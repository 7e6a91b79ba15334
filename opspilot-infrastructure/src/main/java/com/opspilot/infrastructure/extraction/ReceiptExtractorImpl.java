package com.opspilot.infrastructure.extraction;

import com.opspilot.domain.ai.adapter.gateway.IGenerativeModelGateway;
import com.opspilot.domain.extraction.model.valobj.ReceiptExtraction;
import com.opspilot.domain.extraction.service.ReceiptExtractor;
import com.opspilot.domain.extraction.service.ReceiptParseDomainService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 收据抽取实现。
 */
@Slf4j
@Component
public class ReceiptExtractorImpl implements ReceiptExtractor {

    private final IGenerativeModelGateway generativeModelGateway;
    private final ReceiptParseDomainService receiptParseDomainService;

    public ReceiptExtractorImpl(IGenerativeModelGateway generativeModelGateway,
                                ReceiptParseDomainService receiptParseDomainService) {
        this.generativeModelGateway = generativeModelGateway;
        this.receiptParseDomainService = receiptParseDomainService;
    }

    @Override
    public ReceiptExtraction extract(String rawText) {
        String normalizedText = receiptParseDomainService.normalizeText(rawText);
        ReceiptExtraction extraction = extractWithModel(normalizedText);
        if (extraction == null) {
            extraction = receiptParseDomainService.parseFallback(normalizedText);
        }
        return receiptParseDomainService.normalize(extraction);
    }

    private ReceiptExtraction extractWithModel(String normalizedText) {
        Map<String, Object> payload = generativeModelGateway.generateJson(
                "Extract receipt fields as JSON with keys vendor,date,items. "
                        + "Each item needs name,quantity,unit,vendor(optional),category(optional),price(optional).\n"
                        + "Text:\n" + normalizedText);
        if (payload == null) {
            return null;
        }
        try {
            return receiptParseDomainService.fromPayload(payload);
        } catch (IllegalArgumentException ex) {
            log.warn("RECEIPT_MODEL_INVALID error={}", ex.getMessage());
            return null;
        }
    }
}
