package com.opspilot.infrastructure.extraction;

import com.opspilot.domain.ai.adapter.gateway.IGenerativeModelGateway;
import com.opspilot.domain.extraction.service.EventContentGenerator;
import com.opspilot.domain.extraction.service.EventScheduleDomainService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 事件文案生成实现。
 */
@Slf4j
@Component
public class EventContentGeneratorImpl implements EventContentGenerator {

    private final IGenerativeModelGateway generativeModelGateway;
    private final EventScheduleDomainService eventScheduleDomainService;

    public EventContentGeneratorImpl(IGenerativeModelGateway generativeModelGateway,
                                     EventScheduleDomainService eventScheduleDomainService) {
        this.generativeModelGateway = generativeModelGateway;
        this.eventScheduleDomainService = eventScheduleDomainService;
    }

    @Override
    public String generateDescription(String title, LocalDateTime startAt, LocalDateTime endAt,
                                      String location, String notes) {
        String modelText = readText(generativeModelGateway.generateJson(
                "Write a concise event description as JSON: {description: string}. "
                        + "Keep it to 2-4 sentences, no greetings, no signatures, and focus on objective, scope, "
                        + "and expected outcome. "
                        + "Title=" + title + "; start=" + startAt + "; end=" + endAt
                        + "; location=" + location + "; notes=" + notes), "description");
        String description = modelText != null
                ? modelText
                : eventScheduleDomainService.fallbackDescription(title, startAt, endAt, location);
        return description.trim();
    }

    @Override
    public String generateInviteMessage(String title, LocalDateTime startAt, LocalDateTime endAt,
                                        String location, String description) {
        String modelText = readText(generativeModelGateway.generateJson(
                "Write a concise event invite message with 2 agenda bullets as JSON: {message: string}. "
                        + "Title=" + title + "; start=" + startAt + "; end=" + endAt
                        + "; location=" + location + "; description=" + description), "message");
        return modelText != null
                ? modelText
                : eventScheduleDomainService.fallbackInvite(title, startAt, endAt, location);
    }

    private String readText(Map<String, Object> payload, String key) {
        if (payload == null) {
            return null;
        }
        Object value = payload.get(key);
        if (value instanceof String) {
            return (String) value;
        }
        log.warn("EVENT_CONTENT_MODEL_INVALID key={}", key);
        return null;
    }
}
