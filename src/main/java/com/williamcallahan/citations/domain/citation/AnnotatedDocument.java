package com.williamcallahan.citations.domain.citation;

import java.util.List;
import java.util.Objects;

/**
 * Result of annotating a document body.
 *
 * @param markup annotated body, ending before the references section
 * @param referencesSection unannotated tail starting at the references heading, empty if none was found
 * @param highlightedOccurrences number of citation occurrences wrapped in markup
 * @param unlocatedCitations texts of citations that could not be found in the body
 */
public record AnnotatedDocument(
    String markup,
    String referencesSection,
    int highlightedOccurrences,
    List<String> unlocatedCitations
) {

    public AnnotatedDocument {
        Objects.requireNonNull(markup, "Markup cannot be null");
        referencesSection = referencesSection == null ? "" : referencesSection;
        unlocatedCitations = unlocatedCitations == null ? List.of() : List.copyOf(unlocatedCitations);
    }

    public static AnnotatedDocument unannotated(String markup, String referencesSection) {
        return new AnnotatedDocument(markup, referencesSection, 0, List.of());
    }

    public boolean hasReferencesSection() {
        return !referencesSection.isEmpty();
    }
}
