package com.opspilot.infrastructure.extraction;

import com.opspilot.domain.ai.adapter.gateway.IGenerativeModelGateway;
import com.opspilot.domain.extraction.model.valobj.EventDraft;
import com.opspilot.domain.extraction.service.EventDraftDomainService;
import com.opspilot.domain.extraction.service.EventDraftExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * 事件草稿抽取实现：模型或兜底解析 → 归一 → 按提示词校正。
 */
@Slf4j
@Component
public class EventDraftExtractorImpl implements EventDraftExtractor {

    private final IGenerativeModelGateway generativeModelGateway;
    private final EventDraftDomainService eventDraftDomainService;
    private final Clock clock;

    public EventDraftExtractorImpl(IGenerativeModelGateway generativeModelGateway,
                                   EventDraftDomainService eventDraftDomainService,
                                   Clock clock) {
        this.generativeModelGateway = generativeModelGateway;
        this.eventDraftDomainService = eventDraftDomainService;
        this.clock = clock;
    }

    @Override
    public EventDraft extract(String prompt) {
        EventDraft draft = extractWithModel(prompt);
        if (draft == null) {
            draft = eventDraftDomainService.parseFallback(prompt);
        }
        draft = eventDraftDomainService.normalize(draft);
        return eventDraftDomainService.align(prompt, draft);
    }

    private EventDraft extractWithModel(String prompt) {
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        Map<String, Object> payload = generativeModelGateway.generateJson(
                "Extract event draft as JSON with keys title,start_at,end_at,location,description,invitees."
                        + " Use the user's local time context and preserve explicit times as written."
                        + " Return ISO datetimes without timezone offsets."
                        + " Current local datetime is " + now + ". Prompt: " + prompt);
        if (payload == null) {
            return null;
        }
        try {
            return eventDraftDomainService.fromPayload(payload);
        } catch (IllegalArgumentException ex) {
            log.warn("EVENT_DRAFT_MODEL_INVALID error={}", ex.getMessage());
            return null;
        }
    }
}
