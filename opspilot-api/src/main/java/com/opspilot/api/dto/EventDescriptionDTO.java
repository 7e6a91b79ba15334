package com.opspilot.api.dto;

import lombok.Data;

/**
 * 日程描述。
 */
@Data
public class EventDescriptionDTO {

    private String description;
}
