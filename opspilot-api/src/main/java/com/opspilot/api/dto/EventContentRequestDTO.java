package com.opspilot.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 日程描述/邀请文案生成请求。
 */
@Data
public class EventContentRequestDTO {

    private String title;
    private LocalDateTime startAt;
    private LocalDateTime endAt;
    private String location;
    private String description;
}
