package com.opspilot.trigger.application.command;

import com.opspilot.domain.extraction.model.valobj.EventAlternative;
import com.opspilot.domain.extraction.model.valobj.EventDraft;
import com.opspilot.domain.extraction.model.valobj.TimeWindow;
import com.opspilot.domain.extraction.service.EventContentGenerator;
import com.opspilot.domain.extraction.service.EventDraftExtractor;
import com.opspilot.domain.extraction.service.EventScheduleDomainService;
import com.opspilot.trigger.application.common.AiRunTracker;
import com.opspilot.types.enums.AiFeatureEnum;
import com.opspilot.types.enums.ResponseCode;
import com.opspilot.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 日程辅助写用例：自然语言建草稿、备选时段、描述与邀请文案。
 */
@Service
public class EventAssistCommandService {

    private final EventDraftExtractor eventDraftExtractor;
    private final EventScheduleDomainService eventScheduleDomainService;
    private final EventContentGenerator eventContentGenerator;
    private final AiRunTracker aiRunTracker;

    public EventAssistCommandService(EventDraftExtractor eventDraftExtractor,
                                     EventScheduleDomainService eventScheduleDomainService,
                                     EventContentGenerator eventContentGenerator,
                                     AiRunTracker aiRunTracker) {
        this.eventDraftExtractor = eventDraftExtractor;
        this.eventScheduleDomainService = eventScheduleDomainService;
        this.eventContentGenerator = eventContentGenerator;
        this.aiRunTracker = aiRunTracker;
    }

    public EventDraft createDraft(String prompt) {
        if (StringUtils.isBlank(prompt)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "日程描述不能为空");
        }
        return aiRunTracker.track(AiFeatureEnum.EVENTS_NL_CREATE, () -> eventDraftExtractor.extract(prompt));
    }

    public List<EventAlternative> suggestAlternatives(LocalDateTime startAt,
                                                      LocalDateTime endAt,
                                                      List<TimeWindow> busyWindows) {
        requireWindow(startAt, endAt);
        return aiRunTracker.track(AiFeatureEnum.EVENTS_SUGGEST_ALTERNATIVES,
                () -> eventScheduleDomainService.suggestAlternatives(startAt, endAt, busyWindows));
    }

    public String generateDescription(String title, LocalDateTime startAt, LocalDateTime endAt,
                                      String location, String notes) {
        requireTitle(title);
        requireWindow(startAt, endAt);
        return aiRunTracker.track(AiFeatureEnum.EVENTS_GENERATE_DESCRIPTION,
                () -> eventContentGenerator.generateDescription(title, startAt, endAt, location, notes));
    }

    public String generateInviteMessage(String title, LocalDateTime startAt, LocalDateTime endAt,
                                        String location, String description) {
        requireTitle(title);
        requireWindow(startAt, endAt);
        return aiRunTracker.track(AiFeatureEnum.EVENTS_GENERATE_INVITE,
                () -> eventContentGenerator.generateInviteMessage(title, startAt, endAt, location, description));
    }

    private void requireTitle(String title) {
        if (StringUtils.isBlank(title)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "日程标题不能为空");
        }
    }

    private void requireWindow(LocalDateTime startAt, LocalDateTime endAt) {
        if (startAt == null || endAt == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "开始与结束时间不能为空");
        }
        if (!endAt.isAfter(startAt)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "结束时间必须晚于开始时间");
        }
    }
}
