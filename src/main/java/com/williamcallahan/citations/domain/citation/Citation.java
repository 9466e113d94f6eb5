package com.williamcallahan.citations.domain.citation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An in-text citation detected upstream, located by its exact text in the rendered document.
 *
 * <p>Offsets point into the plain-text rendering of the document and are only used as a
 * last-resort search fallback. Citations are read-only snapshots; the annotation engine
 * derives a classification from them but never changes them.</p>
 *
 * @param id stable identifier, empty for synthetic or orphan entries
 * @param rawText exact substring expected in the markup
 * @param paragraphIndex optional paragraph the citation was detected in
 * @param startOffset optional start offset into the plain-text rendering
 * @param endOffset optional end offset (exclusive) into the plain-text rendering
 * @param citationNumber optional number as written in the citation
 * @param referenceNumber optional number of the reference this citation is linked to
 * @param orphaned true when upstream already knows the target reference was deleted
 */
public record Citation(
    String id,
    String rawText,
    Integer paragraphIndex,
    Integer startOffset,
    Integer endOffset,
    Integer citationNumber,
    Integer referenceNumber,
    @JsonProperty("isOrphaned") boolean orphaned
) {

    public Citation {
        id = id == null ? "" : id;
        rawText = rawText == null ? "" : rawText;
    }

    /**
     * Binds an upstream citation payload, where the orphan flag is named {@code isOrphaned}.
     */
    @JsonCreator
    public static Citation fromJson(
        @JsonProperty("id") String id,
        @JsonProperty("rawText") String rawText,
        @JsonProperty("paragraphIndex") Integer paragraphIndex,
        @JsonProperty("startOffset") Integer startOffset,
        @JsonProperty("endOffset") Integer endOffset,
        @JsonProperty("citationNumber") Integer citationNumber,
        @JsonProperty("referenceNumber") Integer referenceNumber,
        @JsonProperty("isOrphaned") Boolean orphaned
    ) {
        return new Citation(id, rawText, paragraphIndex, startOffset, endOffset,
            citationNumber, referenceNumber, Boolean.TRUE.equals(orphaned));
    }

    /**
     * Creates a citation known only by its identifier and text.
     */
    public static Citation of(String id, String rawText) {
        return new Citation(id, rawText, null, null, null, null, null, false);
    }

    public Citation withReferenceNumber(Integer number) {
        return new Citation(id, rawText, paragraphIndex, startOffset, endOffset, citationNumber, number, orphaned);
    }

    public Citation withOffsets(int start, int end) {
        return new Citation(id, rawText, paragraphIndex, start, end, citationNumber, referenceNumber, orphaned);
    }

    public Citation markedOrphaned() {
        return new Citation(id, rawText, paragraphIndex, startOffset, endOffset, citationNumber, referenceNumber, true);
    }

    public boolean hasText() {
        return !rawText.isEmpty();
    }
}
