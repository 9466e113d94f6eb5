package com.williamcallahan.citations.domain.citation;

import java.util.List;

/**
 * Inputs for one annotation pass.
 *
 * @param documentMarkup rendered document body, HTML or plain text
 * @param plainText optional plain-text rendering that citation offsets refer to
 * @param citations detected citations
 * @param references current reference list snapshot
 * @param changeRecords pending changes since the last stable render
 */
public record AnnotationRequest(
    String documentMarkup,
    String plainText,
    List<Citation> citations,
    List<ReferenceEntry> references,
    List<ChangeRecord> changeRecords
) {

    public AnnotationRequest {
        documentMarkup = documentMarkup == null ? "" : documentMarkup;
        citations = citations == null ? List.of() : List.copyOf(citations);
        references = references == null ? List.of() : List.copyOf(references);
        changeRecords = changeRecords == null ? List.of() : List.copyOf(changeRecords);
    }

    public static AnnotationRequest of(
        String documentMarkup,
        List<Citation> citations,
        List<ReferenceEntry> references,
        List<ChangeRecord> changeRecords
    ) {
        return new AnnotationRequest(documentMarkup, null, citations, references, changeRecords);
    }

    public boolean hasPlainText() {
        return plainText != null && !plainText.isEmpty();
    }
}
