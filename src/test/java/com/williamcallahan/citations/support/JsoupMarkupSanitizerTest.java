package com.williamcallahan.citations.support;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies the allow-list keeps citation markup and strips active content.
 */
class JsoupMarkupSanitizerTest {

    private final JsoupMarkupSanitizer sanitizer = new JsoupMarkupSanitizer();

    @Test
    void keepsCitationLinksAndStateAttributes() {
        String markup = "<p><mark class=\"bg-yellow-200\" data-state=\"matched-number\" title=\"Reference #1\">"
            + "[<span class=\"citation-link\" data-ref=\"1\" style=\"cursor: pointer;\">1</span>]</mark></p>";

        String sanitized = sanitizer.sanitize(markup);

        assertTrue(sanitized.contains("data-ref=\"1\""), sanitized);
        assertTrue(sanitized.contains("class=\"citation-link\""));
        assertTrue(sanitized.contains("data-state=\"matched-number\""));
        assertTrue(sanitized.contains("title=\"Reference #1\""));
    }

    @Test
    void stripsScriptsAndEventHandlers() {
        String sanitized = sanitizer.sanitize(
            "<p onclick=\"steal()\">Text<script>alert(1)</script> <a href=\"javascript:alert(1)\">x</a></p>");

        assertFalse(sanitized.contains("<script"), sanitized);
        assertFalse(sanitized.contains("onclick"));
        assertFalse(sanitized.contains("javascript:"));
        assertTrue(sanitized.contains("Text"));
    }

    @Test
    void dropsDataRefOutsideSpans() {
        String sanitized = sanitizer.sanitize("<p data-ref=\"2\">Body</p>");

        assertEquals("<p>Body</p>", sanitized);
    }

    @Test
    void emptyInputYieldsEmptyOutput() {
        assertEquals("", sanitizer.sanitize(null));
        assertEquals("", sanitizer.sanitize(""));
    }
}
