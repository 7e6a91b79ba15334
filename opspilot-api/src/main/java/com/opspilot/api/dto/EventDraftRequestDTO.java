package com.opspilot.api.dto;

import lombok.Data;

/**
 * 自然语言创建日程请求。
 */
@Data
public class EventDraftRequestDTO {

    private String prompt;
}
