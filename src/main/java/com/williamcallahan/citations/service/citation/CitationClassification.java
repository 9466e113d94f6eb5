package com.williamcallahan.citations.service.citation;

import com.williamcallahan.citations.domain.citation.ChangeRecord;
import com.williamcallahan.citations.domain.citation.Citation;
import com.williamcallahan.citations.domain.citation.ClassificationState;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of classifying one citation: its state, the fragment that replaces it and the
 * texts it is searched for by.
 *
 * @param state validity state
 * @param citation classified citation
 * @param change resolved pending change, null when none applies
 * @param searchTexts texts to locate in the body, most specific first; never empty
 * @param title tooltip carried by the fragment
 * @param fragment replacement markup
 */
public record CitationClassification(
    ClassificationState state,
    Citation citation,
    ChangeRecord change,
    List<String> searchTexts,
    String title,
    String fragment
) {

    public CitationClassification {
        Objects.requireNonNull(state, "State cannot be null");
        Objects.requireNonNull(citation, "Citation cannot be null");
        Objects.requireNonNull(fragment, "Fragment cannot be null");
        searchTexts = searchTexts == null ? List.of() : List.copyOf(searchTexts);
        if (searchTexts.isEmpty()) {
            throw new IllegalArgumentException("A classification needs at least one search text");
        }
        title = title == null ? "" : title;
    }

    public boolean hasChange() {
        return change != null;
    }
}
