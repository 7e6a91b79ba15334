package com.opspilot.domain.extraction.service;

import com.opspilot.domain.extraction.model.valobj.EventAlternative;
import com.opspilot.domain.extraction.model.valobj.TimeWindow;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 日程领域服务：备选时段计算与描述、邀请文案模板。
 */
@Service
public class EventScheduleDomainService {

    public static final String NO_OVERLAP_REASON = "No overlap with current schedule";

    private static final int MAX_SUGGESTIONS = 3;
    private static final int MAX_PROBES = 20;
    private static final Duration PROBE_STEP = Duration.ofMinutes(30);
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");

    /**
     * 从 start + 30 分钟开始每 30 分钟试探一次，最多 20 次，返回至多 3 个不与忙碌窗口重叠的同长度时段。
     */
    public List<EventAlternative> suggestAlternatives(LocalDateTime startAt,
                                                      LocalDateTime endAt,
                                                      List<TimeWindow> busyWindows) {
        if (startAt == null || endAt == null) {
            throw new IllegalArgumentException("startAt and endAt are required");
        }
        Duration duration = Duration.between(startAt, endAt);
        List<TimeWindow> busy = busyWindows == null ? List.of() : busyWindows;
        List<EventAlternative> suggestions = new ArrayList<>();
        LocalDateTime cursor = startAt.plus(PROBE_STEP);
        for (int probe = 0; probe < MAX_PROBES && suggestions.size() < MAX_SUGGESTIONS; probe++) {
            LocalDateTime candidateEnd = cursor.plus(duration);
            if (!overlapsAny(busy, cursor, candidateEnd)) {
                suggestions.add(new EventAlternative(cursor, candidateEnd, NO_OVERLAP_REASON));
            }
            cursor = cursor.plus(PROBE_STEP);
        }
        return suggestions;
    }

    public String fallbackDescription(String title, LocalDateTime startAt, LocalDateTime endAt, String location) {
        return title + " is scheduled for " + DATE_TIME.format(startAt) + " to " + TIME.format(endAt)
                + " at " + locationOrTbd(location) + ". "
                + "The session will align participants on priorities and close with clear next actions.";
    }

    public String fallbackInvite(String title, LocalDateTime startAt, LocalDateTime endAt, String location) {
        return "You are invited to '" + title + "' on " + DATE_TIME.format(startAt) + " until " + TIME.format(endAt)
                + " at " + locationOrTbd(location) + ".\n\nAgenda:\n- Align on priorities\n- Confirm action items";
    }

    private boolean overlapsAny(List<TimeWindow> busy, LocalDateTime start, LocalDateTime end) {
        for (TimeWindow window : busy) {
            if (window != null && window.overlaps(start, end)) {
                return true;
            }
        }
        return false;
    }

    private String locationOrTbd(String location) {
        return StringUtils.isEmpty(location) ? "TBD" : location;
    }
}
