package com.opspilot.domain.extraction.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 事件草稿。时间不带时区，归一后 endAt 严格晚于 startAt。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EventDraft {

    private String title;
    private LocalDateTime startAt;
    private LocalDateTime endAt;
    @Builder.Default
    private String location = "";
    @Builder.Default
    private String description = "";
    @Builder.Default
    private List<String> invitees = new ArrayList<>();
}
