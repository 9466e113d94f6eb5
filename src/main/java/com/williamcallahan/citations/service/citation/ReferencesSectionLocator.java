package com.williamcallahan.citations.service.citation;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a document body from its trailing bibliography so that entries in the reference
 * list are never annotated as citations.
 */
public class ReferencesSectionLocator {

    private static final String HEADING_WORDS = "(References|Bibliography|Works Cited)";

    /**
     * Heading shapes, most specific first; the first one found wins even if a later shape
     * occurs earlier in the body.
     */
    private static final List<Pattern> HEADING_PATTERNS = List.of(
        Pattern.compile("<p[^>]*>\\s*<strong[^>]*>\\s*" + HEADING_WORDS + "\\s*</strong>\\s*</p>", Pattern.CASE_INSENSITIVE),
        Pattern.compile("<p[^>]*><b[^>]*>" + HEADING_WORDS + "</b></p>", Pattern.CASE_INSENSITIVE),
        Pattern.compile("<h[1-6][^>]*>\\s*" + HEADING_WORDS + "\\s*</h[1-6]>", Pattern.CASE_INSENSITIVE),
        Pattern.compile("<p[^>]*>\\s*<em[^>]*>\\s*" + HEADING_WORDS + "\\s*</em>\\s*</p>", Pattern.CASE_INSENSITIVE),
        Pattern.compile("<p[^>]*>\\s*" + HEADING_WORDS + "\\s*</p>", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^[ \\t]*" + HEADING_WORDS + "[ \\t]*:?[ \\t]*$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE)
    );

    /**
     * A body split at its references heading.
     *
     * @param body markup before the heading, or the whole markup when no heading was found
     * @param referencesSection markup from the heading on, empty when no heading was found
     */
    public record MarkupSections(String body, String referencesSection) {

        public boolean hasReferencesSection() {
            return !referencesSection.isEmpty();
        }
    }

    public MarkupSections split(String markup) {
        if (markup == null || markup.isEmpty()) {
            return new MarkupSections("", "");
        }
        for (Pattern heading : HEADING_PATTERNS) {
            Matcher matcher = heading.matcher(markup);
            if (matcher.find()) {
                return new MarkupSections(markup.substring(0, matcher.start()), markup.substring(matcher.start()));
            }
        }
        return new MarkupSections(markup, "");
    }
}
