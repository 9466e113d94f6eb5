package com.williamcallahan.citations.domain.citation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A pending-change row as reported by the change-tracking store's document preview.
 *
 * @param id citation identifier
 * @param changeType pending change kind
 * @param orphaned true when the citation's reference no longer exists
 * @param referenceNumber reference number after the change
 * @param originalText citation text currently in the document
 * @param newText citation text after the change is applied
 */
public record CitationPreview(
    String id,
    ChangeType changeType,
    @JsonProperty("isOrphaned") boolean orphaned,
    Integer referenceNumber,
    String originalText,
    String newText
) {

    @JsonCreator
    public static CitationPreview create(
        @JsonProperty("id") String id,
        @JsonProperty("changeType") ChangeType changeType,
        @JsonProperty("isOrphaned") Boolean orphaned,
        @JsonProperty("referenceNumber") Integer referenceNumber,
        @JsonProperty("originalText") String originalText,
        @JsonProperty("newText") String newText
    ) {
        return new CitationPreview(id, changeType, Boolean.TRUE.equals(orphaned), referenceNumber, originalText, newText);
    }
}
