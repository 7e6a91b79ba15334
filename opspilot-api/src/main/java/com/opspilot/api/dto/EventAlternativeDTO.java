package com.opspilot.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 备选时段。
 */
@Data
public class EventAlternativeDTO {

    private LocalDateTime startAt;
    private LocalDateTime endAt;
    private String reason;
}
