package com.opspilot.test.domain;

import com.opspilot.domain.extraction.model.valobj.EventAlternative;
import com.opspilot.domain.extraction.model.valobj.TimeWindow;
import com.opspilot.domain.extraction.service.EventScheduleDomainService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

public class EventScheduleDomainServiceTest {

    private static final LocalDateTime START = LocalDateTime.of(2026, 3, 2, 10, 0);
    private static final LocalDateTime END = LocalDateTime.of(2026, 3, 2, 11, 0);

    private final EventScheduleDomainService service = new EventScheduleDomainService();

    @Test
    public void shouldSkipBusyWindows() {
        List<EventAlternative> alternatives = service.suggestAlternatives(START, END,
                List.of(new TimeWindow(LocalDateTime.of(2026, 3, 2, 10, 30), LocalDateTime.of(2026, 3, 2, 12, 0))));

        Assertions.assertEquals(3, alternatives.size());
        Assertions.assertEquals(LocalDateTime.of(2026, 3, 2, 12, 0), alternatives.get(0).startAt());
        Assertions.assertEquals(LocalDateTime.of(2026, 3, 2, 13, 0), alternatives.get(0).endAt());
        Assertions.assertEquals(LocalDateTime.of(2026, 3, 2, 12, 30), alternatives.get(1).startAt());
        Assertions.assertEquals(LocalDateTime.of(2026, 3, 2, 13, 0), alternatives.get(2).startAt());
        Assertions.assertEquals(EventScheduleDomainService.NO_OVERLAP_REASON, alternatives.get(0).reason());
    }

    @Test
    public void shouldProbeFromHalfHourAfterStartWhenFree() {
        List<EventAlternative> alternatives = service.suggestAlternatives(START, END, null);

        Assertions.assertEquals(LocalDateTime.of(2026, 3, 2, 10, 30), alternatives.get(0).startAt());
        Assertions.assertEquals(LocalDateTime.of(2026, 3, 2, 11, 30), alternatives.get(2).startAt());
    }

    @Test
    public void shouldReturnEmptyWhenEveryProbeOverlaps() {
        List<EventAlternative> alternatives = service.suggestAlternatives(START, END,
                List.of(new TimeWindow(LocalDateTime.of(2026, 3, 2, 9, 0), LocalDateTime.of(2026, 3, 2, 23, 0))));

        Assertions.assertTrue(alternatives.isEmpty());
    }

    @Test
    public void shouldTreatTouchingWindowsAsFree() {
        TimeWindow window = new TimeWindow(START, END);

        Assertions.assertFalse(window.overlaps(END, END.plusHours(1)));
        Assertions.assertFalse(window.overlaps(START.minusHours(1), START));
        Assertions.assertTrue(window.overlaps(START.plusMinutes(59), END.plusHours(1)));
    }

    @Test
    public void shouldRenderFallbackTemplates() {
        Assertions.assertEquals("Sync is scheduled for 2026-03-02 10:00 to 11:00 at TBD. "
                        + "The session will align participants on priorities and close with clear next actions.",
                service.fallbackDescription("Sync", START, END, ""));
        Assertions.assertEquals("You are invited to 'Sync' on 2026-03-02 10:00 until 11:00 at Room 1.\n\n"
                        + "Agenda:\n- Align on priorities\n- Confirm action items",
                service.fallbackInvite("Sync", START, END, "Room 1"));
    }
}
