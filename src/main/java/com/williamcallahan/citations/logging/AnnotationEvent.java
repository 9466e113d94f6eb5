package com.williamcallahan.citations.logging;

import java.util.Objects;

/**
 * A diagnostic emitted while annotating citations.
 *
 * @param type event category
 * @param citationId identifier of the citation concerned, empty when not tied to one
 * @param text citation text or search text concerned
 * @param detail human-readable context
 */
public record AnnotationEvent(EventType type, String citationId, String text, String detail) {

    public AnnotationEvent {
        Objects.requireNonNull(type, "Event type cannot be null");
        citationId = citationId == null ? "" : citationId;
        text = text == null ? "" : text;
        detail = detail == null ? "" : detail;
    }

    public static AnnotationEvent of(EventType type, String citationId, String text, String detail) {
        return new AnnotationEvent(type, citationId, text, detail);
    }

    /**
     * Event categories.
     */
    public enum EventType {
        /**
         * Citation had no text and was not searched for.
         */
        CITATION_SKIPPED,

        /**
         * No search variant of the citation occurs in the body.
         */
        CITATION_NOT_FOUND,

        /**
         * Citation occurrences were claimed for annotation.
         */
        CITATION_REPLACED,

        /**
         * A pending change was resolved for a citation.
         */
        CHANGE_RESOLVED,

        /**
         * An orphan change with no live citation was located and wrapped.
         */
        ORPHAN_CHANGE_REPLACED,

        /**
         * Body was cut at a references heading.
         */
        REFERENCES_SECTION_FOUND,

        /**
         * No references heading matched; the whole body is annotated.
         */
        REFERENCES_SECTION_MISSING,

        /**
         * Annotation failed unexpectedly and the body was returned unannotated.
         */
        ANNOTATION_FAILED
    }
}
