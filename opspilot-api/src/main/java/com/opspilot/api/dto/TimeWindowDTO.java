package com.opspilot.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 时间窗口。
 */
@Data
public class TimeWindowDTO {

    private LocalDateTime startAt;
    private LocalDateTime endAt;
}
