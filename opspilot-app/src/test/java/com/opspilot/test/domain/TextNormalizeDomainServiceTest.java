package com.opspilot.test.domain;

import com.opspilot.domain.text.service.TextNormalizeDomainService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TextNormalizeDomainServiceTest {

    private final TextNormalizeDomainService service = new TextNormalizeDomainService();

    @Test
    public void shouldCollapseQueryWhitespaceAndDecodeEntities() {
        Assertions.assertEquals("do we have salt & pepper?", service.normalizeQuery("  do   we\thave salt &amp; pepper? "));
        Assertions.assertEquals("", service.normalizeQuery(null));
    }

    @Test
    public void shouldNormalizeLineEndingsAndBlankLines() {
        Assertions.assertEquals("Acme\n2 x Tape\n1 x Glue", service.normalizeDocument("Acme\r\n2 x   Tape\r\n\r\n\r\n1 x Glue\n"));
    }

    @Test
    public void shouldTurnHtmlBlocksIntoLines() {
        String normalized = service.normalizeDocument("<div>Acme &amp; Sons</div><p>2 x Tape</p>");

        Assertions.assertTrue(normalized.startsWith("Acme & Sons\n"));
        Assertions.assertTrue(normalized.endsWith("2 x Tape"));
        Assertions.assertFalse(normalized.contains("<"));
    }
}
