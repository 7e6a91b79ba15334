package com.opspilot.domain.extraction.service;

import java.time.LocalDateTime;

/**
 * 事件文案生成服务接口，模型不可用时使用固定模板。
 */
public interface EventContentGenerator {

    String generateDescription(String title, LocalDateTime startAt, LocalDateTime endAt,
                               String location, String notes);

    String generateInviteMessage(String title, LocalDateTime startAt, LocalDateTime endAt,
                                 String location, String description);
}
