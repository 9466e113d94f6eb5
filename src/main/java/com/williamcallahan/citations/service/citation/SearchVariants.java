package com.williamcallahan.citations.service.citation;

import com.williamcallahan.citations.support.MarkupEscaper;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Spellings under which a citation text may appear in rendered markup.
 */
final class SearchVariants {

    private static final String EN_DASH = "–";
    private static final String EN_DASH_NUMERIC = "&#8211;";
    private static final String EN_DASH_NAMED = "&ndash;";

    private SearchVariants() {
    }

    /**
     * Expands each text into its literal, entity-escaped and en-dash-encoded spellings.
     *
     * @param texts search texts in priority order
     * @return distinct non-empty variants, keeping the priority order of the texts
     */
    static List<String> of(List<String> texts) {
        Set<String> variants = new LinkedHashSet<>();
        for (String text : texts) {
            if (text == null || text.isEmpty()) {
                continue;
            }
            addWithDashVariants(variants, text);
            addWithDashVariants(variants, MarkupEscaper.escapeText(text));
        }
        return new ArrayList<>(variants);
    }

    /**
     * Text at the citation's offsets in the plain-text rendering, clamped to its bounds.
     *
     * @return the slice, or an empty string when the offsets are missing or empty
     */
    static String positionFallback(String plainText, Integer startOffset, Integer endOffset) {
        if (plainText == null || startOffset == null || endOffset == null) {
            return "";
        }
        if (startOffset < 0 || endOffset <= startOffset) {
            return "";
        }
        int start = Math.min(startOffset, plainText.length());
        int end = Math.min(endOffset, plainText.length());
        return plainText.substring(start, end);
    }

    private static void addWithDashVariants(Set<String> variants, String text) {
        variants.add(text);
        if (text.contains(EN_DASH)) {
            variants.add(text.replace(EN_DASH, EN_DASH_NUMERIC));
            variants.add(text.replace(EN_DASH, EN_DASH_NAMED));
        }
    }
}
