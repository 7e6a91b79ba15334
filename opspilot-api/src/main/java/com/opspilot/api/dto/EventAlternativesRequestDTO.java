package com.opspilot.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 备选时段请求：目标时段与已占用时段。
 */
@Data
public class EventAlternativesRequestDTO {

    private LocalDateTime startAt;
    private LocalDateTime endAt;
    private List<TimeWindowDTO> busyWindows;
}
