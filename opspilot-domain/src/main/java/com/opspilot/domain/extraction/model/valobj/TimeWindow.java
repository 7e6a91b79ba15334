package com.opspilot.domain.extraction.model.valobj;

import java.time.LocalDateTime;

/**
 * 时间窗口 [startAt, endAt)。
 */
public record TimeWindow(LocalDateTime startAt, LocalDateTime endAt) {

    public boolean overlaps(LocalDateTime start, LocalDateTime end) {
        return end.isAfter(startAt) && start.isBefore(endAt);
    }
}
