package com.opspilot.trigger.application.command;

import com.opspilot.domain.extraction.model.valobj.ReceiptExtraction;
import com.opspilot.domain.extraction.service.ReceiptExtractor;
import com.opspilot.trigger.application.common.AiRunTracker;
import com.opspilot.types.enums.AiFeatureEnum;
import com.opspilot.types.enums.ResponseCode;
import com.opspilot.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * 收据导入解析写用例。
 */
@Service
public class ReceiptImportCommandService {

    private final ReceiptExtractor receiptExtractor;
    private final AiRunTracker aiRunTracker;

    public ReceiptImportCommandService(ReceiptExtractor receiptExtractor, AiRunTracker aiRunTracker) {
        this.receiptExtractor = receiptExtractor;
        this.aiRunTracker = aiRunTracker;
    }

    public ReceiptExtraction parse(String rawText) {
        if (StringUtils.isBlank(rawText)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "收据文本不能为空");
        }
        return aiRunTracker.track(AiFeatureEnum.INVENTORY_IMPORT_PARSE, () -> receiptExtractor.extract(rawText));
    }
}
