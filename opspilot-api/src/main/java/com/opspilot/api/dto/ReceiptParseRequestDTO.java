package com.opspilot.api.dto;

import lombok.Data;

/**
 * 收据文本解析请求。
 */
@Data
public class ReceiptParseRequestDTO {

    private String text;
}
