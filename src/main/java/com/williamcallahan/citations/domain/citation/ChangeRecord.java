package com.williamcallahan.citations.domain.citation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Describes how one citation changed since the last stable render.
 *
 * <p>Change records are transient: the caller supplies them for a single rendering and then
 * discards them.</p>
 *
 * @param citationId identifier of the changed citation, may be empty
 * @param oldNumber reference number before the change
 * @param newNumber reference number after the change, null when the reference was deleted
 * @param oldText citation text before the change
 * @param newText citation text after the change
 * @param changeType kind of change
 */
public record ChangeRecord(
    String citationId,
    Integer oldNumber,
    Integer newNumber,
    String oldText,
    String newText,
    ChangeType changeType
) {

    public ChangeRecord {
        citationId = citationId == null ? "" : citationId;
        oldText = oldText == null ? "" : oldText;
        newText = newText == null ? "" : newText;
        changeType = changeType == null ? ChangeType.UNCHANGED : changeType;
        if (changeType == ChangeType.DELETED && newNumber != null) {
            throw new IllegalArgumentException("A deleted change cannot carry a new reference number");
        }
    }

    @JsonCreator
    public static ChangeRecord create(
        @JsonProperty("citationId") String citationId,
        @JsonProperty("oldNumber") Integer oldNumber,
        @JsonProperty("newNumber") Integer newNumber,
        @JsonProperty("oldText") String oldText,
        @JsonProperty("newText") String newText,
        @JsonProperty("changeType") ChangeType changeType
    ) {
        return new ChangeRecord(citationId, oldNumber, newNumber, oldText, newText, changeType);
    }

    /**
     * Records a renumbering, e.g. {@code [5]} becoming {@code [4]}.
     */
    public static ChangeRecord renumbered(String citationId, int oldNumber, int newNumber, String oldText, String newText) {
        return new ChangeRecord(citationId, oldNumber, newNumber, oldText, newText, ChangeType.RENUMBER);
    }

    /**
     * Records a citation whose reference was deleted; its text stays as it was.
     */
    public static ChangeRecord deleted(String citationId, Integer oldNumber, String text) {
        return new ChangeRecord(citationId, oldNumber, null, text, text, ChangeType.DELETED);
    }

    /**
     * True when the text shown in the document differs before and after the change.
     */
    public boolean changesText() {
        return !oldText.isEmpty() && !newText.isEmpty() && !oldText.equals(newText);
    }

    /**
     * True when this change leaves its citation pointing at nothing.
     */
    public boolean denotesOrphan() {
        return changeType == ChangeType.DELETED || (newNumber == null && Objects.equals(oldText, newText));
    }

    /**
     * Text the orphan is expected to appear as in the document.
     */
    public String orphanText() {
        return oldText.isEmpty() ? newText : oldText;
    }
}
