package com.opspilot.domain.ai.model.valobj;

import com.opspilot.types.enums.AiFeatureEnum;
import lombok.Builder;
import lombok.Data;

/**
 * 单次 AI 流水线调用记录。
 */
@Data
@Builder
public class AiRunRecord {

    private AiFeatureEnum feature;

    /**
     * 提示词版本。
     */
    private String promptVersion;

    private String model;
    private boolean success;
    private long latencyMs;

    /**
     * 失败原因，成功时为空串。
     */
    private String error;
}
