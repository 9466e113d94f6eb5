package com.williamcallahan.citations.support;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MarkupEscaperTest {

    @Test
    void escapeHtml_encodesMarkupAndQuotes() {
        assertEquals("&lt;b&gt;A &amp; B&lt;/b&gt; &quot;x&quot; &#039;y&#039;", MarkupEscaper.escapeHtml("<b>A & B</b> \"x\" 'y'"));
    }

    @Test
    void escapeText_leavesQuotesAlone() {
        assertEquals("A &amp; \"B\"", MarkupEscaper.escapeText("A & \"B\""));
    }

    @Test
    void nullBecomesEmpty() {
        assertEquals("", MarkupEscaper.escapeHtml(null));
        assertEquals("", MarkupEscaper.escapeText(null));
    }
}
