package com.opspilot.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 护栏判定视图。
 */
@Data
public class GuardrailDTO {

    private String reason;
    private String mode;
    private Integer riskScore;
    private List<String> signals;
}
