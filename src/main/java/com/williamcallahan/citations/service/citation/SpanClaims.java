package com.williamcallahan.citations.service.citation;

import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Spans of a body that have been claimed by a placeholder, plus the tag regions nothing may claim.
 *
 * <p>Claimed text is never rewritten in place; {@link #render} substitutes each span's
 * fragment in a single pass at the end, so one citation's fragment can never be searched
 * by a later citation.</p>
 */
final class SpanClaims {

    private static final Pattern MARKUP_SIGNAL = Pattern.compile(
        "</[A-Za-z][\\w:-]*\\s*>|<!--|<[A-Za-z][\\w:-]*(?:\\s[^<>]*)?/>"
            + "|<(?:br|hr|img|wbr|input|meta|link|source|col)(?:\\s[^<>]*)?>",
        Pattern.CASE_INSENSITIVE);

    private record ClaimedSpan(int end, String placeholder) {
    }

    private final String body;
    private final RangeSet<Integer> unavailable = TreeRangeSet.create();
    private final NavigableMap<Integer, ClaimedSpan> claimed = new TreeMap<>();

    private SpanClaims(String body) {
        this.body = body;
    }

    /**
     * Creates a ledger over the body with every tag and comment blocked.
     *
     * <p>A body without any closing tag, comment, self-closing tag or void element is plain text,
     * and a stray {@code <} in it is not a tag.</p>
     */
    static SpanClaims over(String body) {
        SpanClaims claims = new SpanClaims(body);
        if (!MARKUP_SIGNAL.matcher(body).find()) {
            return claims;
        }
        int tagStart = body.indexOf('<');
        while (tagStart >= 0) {
            int tagEnd = tagEnd(body, tagStart);
            if (tagEnd < 0) {
                tagStart = body.indexOf('<', tagStart + 1);
                continue;
            }
            claims.unavailable.add(Range.closedOpen(tagStart, tagEnd));
            tagStart = body.indexOf('<', tagEnd);
        }
        return claims;
    }

    /**
     * Exclusive end of the tag opening at {@code start}, or -1 when the text there is not tag-shaped.
     * Quoted attribute values may contain {@code >}; an unterminated tag runs to the end of the body.
     */
    private static int tagEnd(String body, int start) {
        int length = body.length();
        if (body.startsWith("<!--", start)) {
            int close = body.indexOf("-->", start + 4);
            return close < 0 ? length : close + 3;
        }
        int cursor = start + 1;
        if (cursor >= length) {
            return -1;
        }
        char first = body.charAt(cursor);
        if (first == '!' || first == '?') {
            int close = body.indexOf('>', cursor);
            return close < 0 ? length : close + 1;
        }
        if (first == '/') {
            cursor++;
        }
        if (cursor >= length || !isAsciiLetter(body.charAt(cursor))) {
            return -1;
        }
        while (cursor < length && isTagNameChar(body.charAt(cursor))) {
            cursor++;
        }
        if (cursor >= length) {
            return -1;
        }
        char afterName = body.charAt(cursor);
        if (!Character.isWhitespace(afterName) && afterName != '/' && afterName != '>') {
            return -1;
        }
        while (cursor < length) {
            char current = body.charAt(cursor);
            if (current == '>') {
                return cursor + 1;
            }
            if (current == '"' || current == '\'') {
                int closeQuote = body.indexOf(current, cursor + 1);
                if (closeQuote < 0) {
                    return length;
                }
                cursor = closeQuote + 1;
                continue;
            }
            cursor++;
        }
        return length;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isTagNameChar(char c) {
        return isAsciiLetter(c) || (c >= '0' && c <= '9') || c == '-' || c == '_' || c == ':';
    }

    /**
     * Claims every free, non-overlapping occurrence of a variant, scanning left to right.
     *
     * @param starts ascending start offsets of the variant
     * @param length variant length
     * @param placeholder key of the fragment these spans render as
     * @return number of occurrences claimed; zero leaves the ledger unchanged
     */
    int claimAll(List<Integer> starts, int length, String placeholder) {
        List<Range<Integer>> accepted = new ArrayList<>();
        int previousEnd = -1;
        for (int start : starts) {
            if (start < previousEnd) {
                continue;
            }
            Range<Integer> span = Range.closedOpen(start, start + length);
            if (unavailable.intersects(span)) {
                continue;
            }
            accepted.add(span);
            previousEnd = start + length;
        }
        for (Range<Integer> span : accepted) {
            unavailable.add(span);
            claimed.put(span.lowerEndpoint(), new ClaimedSpan(span.upperEndpoint(), placeholder));
        }
        return accepted.size();
    }

    /**
     * Rebuilds the body with each claimed span replaced by its placeholder's fragment.
     */
    String render(Map<String, String> fragments) {
        if (claimed.isEmpty()) {
            return body;
        }
        StringBuilder rendered = new StringBuilder(body.length() + claimed.size() * 160);
        int cursor = 0;
        for (Map.Entry<Integer, ClaimedSpan> entry : claimed.entrySet()) {
            rendered.append(body, cursor, entry.getKey());
            rendered.append(fragments.get(entry.getValue().placeholder()));
            cursor = entry.getValue().end();
        }
        rendered.append(body, cursor, body.length());
        return rendered.toString();
    }
}
