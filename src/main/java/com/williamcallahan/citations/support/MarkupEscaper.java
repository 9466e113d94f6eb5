package com.williamcallahan.citations.support;

/**
 * Escapes text for insertion into HTML markup.
 */
public final class MarkupEscaper {

    private MarkupEscaper() {
        // Utility class - no instantiation
    }

    /**
     * Escapes text for use in element content and quoted attribute values.
     *
     * @param text the raw text (may be null)
     * @return escaped text, or empty string if null
     */
    public static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text
            .replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&#039;");
    }

    /**
     * Escapes only the characters an HTML serializer always encodes in text nodes.
     * This is the form a plain citation text takes inside rendered markup.
     */
    public static String escapeText(String text) {
        if (text == null) {
            return "";
        }
        return text
            .replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;");
    }
}
