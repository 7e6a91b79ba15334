package com.opspilot.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 日程草稿。
 */
@Data
public class EventDraftDTO {

    private String title;
    private LocalDateTime startAt;
    private LocalDateTime endAt;
    private String location;
    private String description;
    private List<String> invitees;
}
