package com.opspilot.domain.extraction.service;

import com.opspilot.domain.extraction.model.valobj.EventDraft;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 事件草稿领域服务：确定性兜底解析、归一，以及用提示词中的显式信号校正草稿。
 * <p>
 * 显式时间优先级：12 小时制 &gt; 24 小时制 &gt; noon/midnight。提示词中出现显式时间时，
 * 无论草稿来自模型还是兜底解析，开始时间都以它为准。
 * </p>
 */
@Slf4j
@Service
public class EventDraftDomainService {

    public static final String DEFAULT_TITLE = "New Event";
    static final int DEFAULT_DURATION_MINUTES = 60;
    static final long MAX_DURATION_MINUTES = 7L * 24 * 60;
    private static final int TITLE_MAX_LENGTH = 120;

    private static final Pattern TWELVE_HOUR = Pattern.compile("\\b(\\d{1,2})(?::([0-5]\\d))?\\s*(am|pm)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TWENTY_FOUR_HOUR = Pattern.compile("\\b([01]?\\d|2[0-3]):([0-5]\\d)\\b");
    private static final Pattern NOON = Pattern.compile("\\bnoon\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MIDNIGHT = Pattern.compile("\\bmidnight\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern DURATION = Pattern.compile("for\\s+(\\d+)\\s*(minutes|minute|min|hours|hour|h)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern INVITE_CLAUSE = Pattern.compile("\\b(invite|inviting)\\b\\s+[A-Za-z0-9._%+@,\\s-]+",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WITH_CLAUSE = Pattern.compile("\\bwith\\b\\s+[A-Za-z0-9._%+@,\\s-]+",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TOMORROW = Pattern.compile("\\btomorrow\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TODAY = Pattern.compile("\\btoday\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b");
    private static final Pattern WEEKDAY = Pattern.compile(
            "\\b(?:on\\s+)?(?:next\\s+)?(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TITLE_SPLIT = Pattern.compile("\\bat\\b|\\bon\\b|\\b\\d{1,2}:?\\d{0,2}\\s*(am|pm)?\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LOCATION = Pattern.compile(".*\\bat\\s+([A-Za-z0-9\\-\\s]+)$", Pattern.CASE_INSENSITIVE);
    private static final DateTimeFormatter SPACED_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    private final Clock clock;

    public EventDraftDomainService(Clock clock) {
        this.clock = clock;
    }

    /**
     * 提取显式时刻，未找到返回 null。
     */
    public LocalTime extractExplicitTime(String text) {
        String source = StringUtils.defaultString(text);
        Matcher twelveHour = TWELVE_HOUR.matcher(source);
        if (twelveHour.find()) {
            int hour = Integer.parseInt(twelveHour.group(1));
            int minute = twelveHour.group(2) == null ? 0 : Integer.parseInt(twelveHour.group(2));
            String meridiem = twelveHour.group(3).toLowerCase(Locale.ROOT);
            if ("pm".equals(meridiem) && hour != 12) {
                hour += 12;
            }
            if ("am".equals(meridiem) && hour == 12) {
                hour = 0;
            }
            if (hour <= 23) {
                return LocalTime.of(hour, minute);
            }
        }
        Matcher twentyFour = TWENTY_FOUR_HOUR.matcher(source);
        if (twentyFour.find()) {
            return LocalTime.of(Integer.parseInt(twentyFour.group(1)), Integer.parseInt(twentyFour.group(2)));
        }
        if (NOON.matcher(source).find()) {
            return LocalTime.NOON;
        }
        if (MIDNIGHT.matcher(source).find()) {
            return LocalTime.MIDNIGHT;
        }
        return null;
    }

    /**
     * 无模型时的兜底解析。
     */
    public EventDraft parseFallback(String prompt) {
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
        String text = HtmlUtils.htmlUnescape(StringUtils.trimToEmpty(prompt));

        List<String> invitees = new ArrayList<>();
        Matcher emails = EMAIL.matcher(text);
        while (emails.find()) {
            invitees.add(emails.group());
        }

        long durationMinutes = DEFAULT_DURATION_MINUTES;
        Matcher duration = DURATION.matcher(text);
        if (duration.find()) {
            durationMinutes = toDurationMinutes(duration.group(1), duration.group(2));
        }

        String working = EMAIL.matcher(text).replaceAll(" ");
        working = INVITE_CLAUSE.matcher(working).replaceAll(" ");
        working = WITH_CLAUSE.matcher(working).replaceAll(" ");
        working = DURATION.matcher(working).replaceAll(" ");

        LocalDate baseDate = now.toLocalDate();
        if (TOMORROW.matcher(working).find()) {
            baseDate = baseDate.plusDays(1);
            working = TOMORROW.matcher(working).replaceAll(" ");
        } else if (TODAY.matcher(working).find()) {
            working = TODAY.matcher(working).replaceAll(" ");
        } else {
            LocalDate explicitDate = extractExplicitDate(working, baseDate);
            if (explicitDate != null) {
                baseDate = explicitDate;
                working = ISO_DATE.matcher(working).replaceAll(" ");
                working = WEEKDAY.matcher(working).replaceAll(" ");
            }
        }

        LocalTime explicitTime = extractExplicitTime(working);
        LocalTime startTime = explicitTime != null
                ? explicitTime
                : now.plusHours(1).truncatedTo(ChronoUnit.HOURS).toLocalTime();
        LocalDateTime startAt = LocalDateTime.of(baseDate, startTime);

        return EventDraft.builder()
                .title(deriveTitle(working))
                .startAt(startAt)
                .endAt(startAt.plusMinutes(durationMinutes))
                .location(deriveLocation(text))
                .description("")
                .invitees(invitees)
                .build();
    }

    /**
     * 从模型 JSON 构造草稿。
     *
     * @throws IllegalArgumentException 缺少必填字段或时间无法解析
     */
    public EventDraft fromPayload(Map<String, Object> payload) {
        if (payload == null) {
            throw new IllegalArgumentException("event payload is empty");
        }
        Object title = payload.get("title");
        if (!(title instanceof String)) {
            throw new IllegalArgumentException("event title is required");
        }
        List<String> invitees = new ArrayList<>();
        Object rawInvitees = payload.get("invitees");
        if (rawInvitees instanceof List<?>) {
            for (Object invitee : (List<?>) rawInvitees) {
                if (invitee != null && EMAIL.matcher(String.valueOf(invitee).trim()).matches()) {
                    invitees.add(String.valueOf(invitee).trim());
                }
            }
        }
        return EventDraft.builder()
                .title((String) title)
                .startAt(parseDateTime(payload.get("start_at")))
                .endAt(parseDateTime(payload.get("end_at")))
                .location(payload.get("location") == null ? "" : String.valueOf(payload.get("location")))
                .description(payload.get("description") == null ? "" : String.valueOf(payload.get("description")))
                .invitees(invitees)
                .build();
    }

    /**
     * 归一：非正时长时结束时间改为开始后 60 分钟，空字段补空串。
     */
    public EventDraft normalize(EventDraft draft) {
        LocalDateTime endAt = draft.getEndAt();
        if (!endAt.isAfter(draft.getStartAt())) {
            endAt = draft.getStartAt().plusMinutes(DEFAULT_DURATION_MINUTES);
        }
        return draft.toBuilder()
                .endAt(endAt)
                .location(StringUtils.defaultString(draft.getLocation()))
                .description(StringUtils.defaultString(draft.getDescription()))
                .invitees(draft.getInvitees() == null ? new ArrayList<>() : draft.getInvitees())
                .build();
    }

    /**
     * 用提示词中的显式时间与 today/tomorrow 校正草稿，保持时长不变。
     */
    public EventDraft align(String prompt, EventDraft draft) {
        LocalTime explicitTime = extractExplicitTime(prompt);
        String lowered = StringUtils.defaultString(prompt).toLowerCase(Locale.ROOT);

        LocalDateTime startAt = draft.getStartAt();
        LocalDateTime endAt = draft.getEndAt();
        Duration duration = endAt.isAfter(startAt)
                ? Duration.between(startAt, endAt)
                : Duration.ofMinutes(DEFAULT_DURATION_MINUTES);

        if (explicitTime != null) {
            startAt = startAt.with(explicitTime);
        }
        LocalDate today = LocalDate.now(clock);
        if (lowered.contains("tomorrow")) {
            startAt = startAt.with(today.plusDays(1));
        } else if (lowered.contains("today")) {
            startAt = startAt.with(today);
        }
        if (!startAt.equals(draft.getStartAt())) {
            log.debug("EVENT_DRAFT_ALIGNED before={}, after={}", draft.getStartAt(), startAt);
        }
        return draft.toBuilder()
                .startAt(startAt)
                .endAt(startAt.plus(duration))
                .location(StringUtils.defaultString(draft.getLocation()))
                .description(StringUtils.defaultString(draft.getDescription()))
                .build();
    }

    /**
     * 时长上限为 7 天，数字溢出时保留默认时长。
     */
    private long toDurationMinutes(String amount, String unit) {
        long value = NumberUtils.toLong(amount, -1L);
        if (value <= 0) {
            log.debug("EVENT_DRAFT_DURATION_IGNORED value={}", amount);
            return DEFAULT_DURATION_MINUTES;
        }
        boolean hours = unit.toLowerCase(Locale.ROOT).startsWith("h");
        long minutes = hours ? Math.min(value, MAX_DURATION_MINUTES / 60) * 60 : value;
        return Math.min(minutes, MAX_DURATION_MINUTES);
    }

    private LocalDate extractExplicitDate(String text, LocalDate today) {
        Matcher isoDate = ISO_DATE.matcher(text);
        if (isoDate.find()) {
            try {
                return LocalDate.parse(isoDate.group(1));
            } catch (DateTimeParseException ex) {
                log.debug("EVENT_DRAFT_DATE_IGNORED value={}", isoDate.group(1));
            }
        }
        Matcher weekday = WEEKDAY.matcher(text);
        if (weekday.find()) {
            DayOfWeek dayOfWeek = DayOfWeek.valueOf(weekday.group(1).toUpperCase(Locale.ROOT));
            return today.with(TemporalAdjusters.next(dayOfWeek));
        }
        return null;
    }

    private String deriveTitle(String working) {
        String head = TITLE_SPLIT.split(working, 2)[0];
        head = TODAY.matcher(TOMORROW.matcher(head).replaceAll(" ")).replaceAll(" ");
        String title = StringUtils.normalizeSpace(head);
        if (title.isEmpty()) {
            return DEFAULT_TITLE;
        }
        return StringUtils.left(title, TITLE_MAX_LENGTH);
    }

    private String deriveLocation(String text) {
        Matcher location = LOCATION.matcher(text);
        if (!location.find()) {
            return "";
        }
        String value = location.group(1).trim();
        // "at 3pm" 之类的结尾是时间而非地点
        if (extractExplicitTime(value) != null) {
            return "";
        }
        return value;
    }

    private LocalDateTime parseDateTime(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("event datetime is required");
        }
        String text = String.valueOf(value).trim();
        try {
            return LocalDateTime.parse(text);
        } catch (DateTimeParseException ex) {
            try {
                return OffsetDateTime.parse(text).toLocalDateTime();
            } catch (DateTimeParseException offsetEx) {
                try {
                    return LocalDateTime.parse(text, SPACED_DATE_TIME);
                } catch (DateTimeParseException nested) {
                    throw new IllegalArgumentException("Invalid event datetime '" + text + "'", nested);
                }
            }
        }
    }
}
