package com.williamcallahan.citations.domain.citation;

import java.util.List;
import java.util.Objects;

/**
 * One author-year segment parsed out of a citation, e.g. {@code Marcus & Davis, 2019}.
 *
 * @param author primary author token, used for display
 * @param candidateLastNames every author token the segment names
 * @param year four-digit year
 * @param referenceNumber number of the matching reference, null when none matched
 * @param matchedSpan exact substring of the citation that the pattern consumed
 */
public record AuthorYearMatch(
    String author,
    List<String> candidateLastNames,
    String year,
    Integer referenceNumber,
    String matchedSpan
) {

    public AuthorYearMatch {
        Objects.requireNonNull(author, "Author cannot be null");
        Objects.requireNonNull(year, "Year cannot be null");
        Objects.requireNonNull(matchedSpan, "Matched span cannot be null");
        candidateLastNames = candidateLastNames == null ? List.of() : List.copyOf(candidateLastNames);
    }

    public boolean isMatched() {
        return referenceNumber != null;
    }
}
