package com.opspilot.api.dto;

import lombok.Data;

/**
 * Inventory Copilot 提问请求。
 */
@Data
public class CopilotQueryRequestDTO {

    private String query;
}
