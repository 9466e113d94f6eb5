package com.williamcallahan.citations.service.citation;

import com.williamcallahan.citations.domain.citation.AuthorYearMatch;
import com.williamcallahan.citations.domain.citation.ReferenceEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses author-year citations such as {@code (Brown et al., 2020; Marcus & Davis, 2019)} and
 * resolves each segment against the reference list by year and author last name.
 */
public class AuthorYearParser {

    private static final Pattern ENCLOSING_PARENTHESES = Pattern.compile("^\\(|\\)$");
    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("\\s*;\\s*");

    /**
     * Segment shapes, tried in declaration order; the first that matches wins.
     */
    private enum SegmentShape {
        TWO_AUTHORS("([A-Z][a-zA-Z'-]+)\\s*(&|and)\\s*([A-Z][a-zA-Z'-]+),?\\s*(\\d{4})", 4, 1, 3),
        ET_AL("([A-Z][a-zA-Z'-]+)\\s+et\\s+al\\.?,?\\s*(\\d{4})", 2, 1),
        SINGLE_AUTHOR("([A-Z][a-zA-Z'-]+),?\\s*(\\d{4})", 2, 1);

        private final Pattern pattern;
        private final int yearGroup;
        private final int[] authorGroups;

        SegmentShape(String regex, int yearGroup, int... authorGroups) {
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
            this.yearGroup = yearGroup;
            this.authorGroups = authorGroups;
        }

        List<String> authors(Matcher matcher) {
            List<String> authors = new ArrayList<>(authorGroups.length);
            for (int group : authorGroups) {
                authors.add(matcher.group(group));
            }
            return authors;
        }

        String year(Matcher matcher) {
            return matcher.group(yearGroup);
        }
    }

    /**
     * Parses every author-year segment of a citation.
     *
     * @param text citation text
     * @param references current reference list
     * @return one entry per recognizable segment, in citation order; unmatched segments carry a null reference number
     */
    public List<AuthorYearMatch> parse(String text, List<ReferenceEntry> references) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        String inner = ENCLOSING_PARENTHESES.matcher(text.trim()).replaceAll("");
        List<AuthorYearMatch> matches = new ArrayList<>();
        for (String segment : SEGMENT_SEPARATOR.split(inner)) {
            for (SegmentShape shape : SegmentShape.values()) {
                Matcher matcher = shape.pattern.matcher(segment);
                if (matcher.find()) {
                    List<String> authors = shape.authors(matcher);
                    String year = shape.year(matcher);
                    Integer referenceNumber = findReference(authors, year, references);
                    matches.add(new AuthorYearMatch(authors.get(0), authors, year, referenceNumber, matcher.group().trim()));
                    break;
                }
            }
        }
        return matches;
    }

    private static Integer findReference(List<String> citedAuthors, String year, List<ReferenceEntry> references) {
        if (references == null) {
            return null;
        }
        for (ReferenceEntry reference : references) {
            if (!year.equals(reference.year()) || reference.authors().isEmpty()) {
                continue;
            }
            List<String> referenceLastNames = reference.authors().stream()
                .map(AuthorYearParser::lastNameOf)
                .toList();
            for (String citedAuthor : citedAuthors) {
                if (referenceLastNames.contains(citedAuthor.toLowerCase(Locale.ROOT))) {
                    return reference.number();
                }
            }
        }
        return null;
    }

    /**
     * Derives the lower-cased last name of a reference author written as
     * "Last, First" or "First Last".
     */
    static String lastNameOf(String author) {
        String trimmed = author.trim();
        int commaIndex = trimmed.indexOf(',');
        if (commaIndex >= 0) {
            return trimmed.substring(0, commaIndex).trim().toLowerCase(Locale.ROOT);
        }
        String[] tokens = trimmed.split("\\s+");
        return tokens[tokens.length - 1].toLowerCase(Locale.ROOT);
    }
}
