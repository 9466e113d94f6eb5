package com.williamcallahan.citations.logging;

/**
 * Receives annotation diagnostics. Implementations must not throw.
 */
@FunctionalInterface
public interface AnnotationTrace {

    void record(AnnotationEvent event);

    default void record(AnnotationEvent.EventType type, String citationId, String text, String detail) {
        record(AnnotationEvent.of(type, citationId, text, detail));
    }

    static AnnotationTrace noop() {
        return event -> { };
    }
}
