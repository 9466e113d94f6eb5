package com.williamcallahan.citations.service.citation;

import com.williamcallahan.citations.domain.citation.AuthorYearMatch;
import com.williamcallahan.citations.domain.citation.ChangeRecord;
import com.williamcallahan.citations.domain.citation.CitationLinkContract;
import com.williamcallahan.citations.domain.citation.ClassificationState;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.williamcallahan.citations.support.MarkupEscaper.escapeHtml;

/**
 * Builds the markup fragment that replaces a citation occurrence.
 *
 * <p>Fragments are a {@code mark} wrapper whose class and title reflect the citation state,
 * around display content in which each reference number or author-year span is a clickable
 * unit per {@link CitationLinkContract}. All citation text is escaped.</p>
 */
class CitationMarkupRenderer {

    static final String DEFAULT_WRAPPER = "bg-yellow-200 px-1 rounded hover:bg-yellow-300 transition-colors";
    static final String UNMATCHED_WRAPPER =
        "bg-orange-200 px-1 rounded hover:bg-orange-300 transition-colors border border-orange-400";
    static final String ORPHANED_WRAPPER =
        "track-change-deletion animate-pulse px-1 rounded hover:bg-red-300 transition-colors";
    static final String RENUMBER_WRAPPER =
        "track-change-renumber animate-pulse px-1 rounded hover:bg-blue-200 transition-colors";
    static final String CHANGED_WRAPPER_SUFFIX = " animate-pulse px-1 rounded transition-colors";

    static final String ADDITION_CLASS = "track-change-addition";
    static final String RENUMBER_CLASS = "track-change-renumber";

    private static final String ARROW = " → ";
    private static final String ORPHAN_WARNING = "<span style=\"color: #dc2626; font-weight: bold;\">⚠</span>";
    private static final String UNMATCHED_WARNING = "<span style=\"color: #ea580c; font-weight: bold;\">⚠</span>";

    static final String UNMATCHED_TITLE = "No matching reference found in reference list";
    static final String GENERIC_ORPHAN_TITLE = "Reference deleted - citation needs fixing";

    private static final Pattern BRACKETED = Pattern.compile("^\\[([^\\]]+)\\]$");

    private final RangeExpander rangeExpander;

    CitationMarkupRenderer(RangeExpander rangeExpander) {
        this.rangeExpander = rangeExpander;
    }

    /**
     * Old text struck through, an arrow, then the new text with clickable numbers.
     */
    String changed(ChangeRecord change) {
        String display = "<span class=\"track-change-deletion-sm\">" + escapeHtml(change.oldText()) + "</span>"
            + "<span class=\"track-change-arrow\">" + ARROW + "</span>"
            + clickableNumbers(change.newText(), ADDITION_CLASS);
        String wrapper = change.changeType().getTrackChangeClass() + CHANGED_WRAPPER_SUFFIX;
        return wrap(ClassificationState.CHANGED, wrapper, changedTitle(change), display);
    }

    String orphaned(String text, String title) {
        String display = "<span class=\"track-change-deletion\">" + escapeHtml(text) + "</span> " + ORPHAN_WARNING;
        return wrap(ClassificationState.ORPHANED, ORPHANED_WRAPPER, title, display);
    }

    String unmatched(String rawText) {
        String display = escapeHtml(rawText) + " " + UNMATCHED_WARNING;
        return wrap(ClassificationState.UNMATCHED, UNMATCHED_WRAPPER, UNMATCHED_TITLE, display);
    }

    String matchedNumbers(String rawText, String title) {
        return wrap(ClassificationState.MATCHED_NUMBER, DEFAULT_WRAPPER, title, clickableNumbers(rawText, ""));
    }

    String renumbered(String rawText, ChangeRecord change) {
        return wrap(ClassificationState.MATCHED_NUMBER, RENUMBER_WRAPPER, renumberTitle(change),
            clickableNumbers(rawText, RENUMBER_CLASS));
    }

    static String renumberTitle(ChangeRecord change) {
        return "Updated: [" + change.oldNumber() + "]" + ARROW + "[" + change.newNumber() + "]";
    }

    static String authorYearTitle(List<AuthorYearMatch> matches) {
        return "References: " + matches.stream()
            .map(match -> "#" + match.referenceNumber())
            .collect(Collectors.joining(", "));
    }

    /**
     * Makes each matched author-year span clickable, escaping the text around it.
     */
    String matchedAuthorYear(String rawText, List<AuthorYearMatch> matches) {
        StringBuilder display = new StringBuilder(rawText.length() + 96 * matches.size());
        int cursor = 0;
        for (AuthorYearMatch match : matches) {
            int spanStart = rawText.indexOf(match.matchedSpan(), cursor);
            if (spanStart < 0) {
                continue;
            }
            display.append(escapeHtml(rawText.substring(cursor, spanStart)));
            display.append(link(match.referenceNumber(), escapeHtml(match.matchedSpan()), ""));
            cursor = spanStart + match.matchedSpan().length();
        }
        display.append(escapeHtml(rawText.substring(cursor)));

        return wrap(ClassificationState.MATCHED_AUTHOR_YEAR, DEFAULT_WRAPPER, authorYearTitle(matches), display.toString());
    }

    String defaultHighlight(String rawText, String title) {
        return wrap(ClassificationState.DEFAULT, DEFAULT_WRAPPER, title, clickableNumbers(rawText, ""));
    }

    static String changedTitle(ChangeRecord change) {
        return "Updated: " + change.oldText() + ARROW + change.newText();
    }

    /**
     * Tooltip for an orphaned citation, naming the deleted reference when it is known.
     */
    static String orphanTitle(ChangeRecord change, List<Integer> missingNumbers) {
        if (change != null) {
            return change.oldNumber() != null && change.oldNumber() > 0
                ? "Reference #" + change.oldNumber() + " was deleted - citation needs fixing"
                : GENERIC_ORPHAN_TITLE;
        }
        if (!missingNumbers.isEmpty()) {
            return "Reference #" + missingNumbers.stream().map(String::valueOf).collect(Collectors.joining(", #"))
                + " deleted - citation needs fixing";
        }
        return GENERIC_ORPHAN_TITLE;
    }

    /**
     * Renders {@code [1-3]} as {@code [1, 2, 3]} with every number clickable; other text is escaped as is.
     */
    String clickableNumbers(String text, String changeClass) {
        Matcher bracketed = BRACKETED.matcher(text);
        if (bracketed.matches()) {
            List<Integer> numbers = rangeExpander.expand(bracketed.group(1));
            if (!numbers.isEmpty()) {
                return numbers.stream()
                    .map(number -> link(number, String.valueOf(number), changeClass))
                    .collect(Collectors.joining(", ", "[", "]"));
            }
        }
        return escapeHtml(text);
    }

    private static String link(int referenceNumber, String escapedLabel, String changeClass) {
        String linkClass = changeClass.isEmpty()
            ? CitationLinkContract.LINK_CLASS
            : CitationLinkContract.LINK_CLASS + " " + changeClass;
        return "<span class=\"" + linkClass + "\" " + CitationLinkContract.REFERENCE_ATTRIBUTE + "=\"" + referenceNumber
            + "\" style=\"" + CitationLinkContract.LINK_STYLE + "\">" + escapedLabel + "</span>";
    }

    private static String wrap(ClassificationState state, String wrapperClass, String title, String displayContent) {
        return "<mark class=\"" + wrapperClass + "\" " + CitationLinkContract.STATE_ATTRIBUTE + "=\"" + state.getIdentifier()
            + "\" title=\"" + escapeHtml(title) + "\">" + displayContent + "</mark>";
    }
}
