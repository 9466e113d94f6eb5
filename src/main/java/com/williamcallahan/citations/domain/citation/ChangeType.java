package com.williamcallahan.citations.domain.citation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of transition a citation went through between two render passes.
 */
public enum ChangeType {
    /**
     * Citation text was converted to another style, e.g. a range became a list.
     */
    STYLE("style", "track-change-addition"),

    /**
     * Citation now points at a different reference number.
     */
    RENUMBER("renumber", "track-change-renumber"),

    /**
     * Target reference was deleted.
     */
    DELETED("deleted", "track-change-deletion"),

    UNCHANGED("unchanged", "track-change-addition");

    private final String identifier;
    private final String trackChangeClass;

    ChangeType(String identifier, String trackChangeClass) {
        this.identifier = identifier;
        this.trackChangeClass = trackChangeClass;
    }

    @JsonValue
    public String getIdentifier() {
        return identifier;
    }

    /**
     * CSS class the host uses to style this kind of tracked change.
     */
    public String getTrackChangeClass() {
        return trackChangeClass;
    }

    /**
     * Resolves a wire identifier; unknown or missing values map to {@link #UNCHANGED}.
     */
    @JsonCreator
    public static ChangeType fromIdentifier(String identifier) {
        if (identifier == null) {
            return UNCHANGED;
        }
        String normalized = identifier.trim().toLowerCase(Locale.ROOT);
        for (ChangeType type : values()) {
            if (type.identifier.equals(normalized)) {
                return type;
            }
        }
        return UNCHANGED;
    }
}
