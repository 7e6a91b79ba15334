package com.opspilot.domain.extraction.model.valobj;

import java.time.LocalDateTime;

/**
 * 备选时段。
 */
public record EventAlternative(LocalDateTime startAt, LocalDateTime endAt, String reason) {
}
