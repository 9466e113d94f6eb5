package com.williamcallahan.citations.domain.citation;

/**
 * Validity state of a citation, in the priority order used to classify it.
 *
 * <p>The first state whose condition holds wins. A change in flight is ranked above
 * orphan detection, so a citation that is being renumbered shows the transition even if
 * the reference snapshot already lost its old target.</p>
 */
public enum ClassificationState {
    /**
     * A pending change rewrites the citation text (style conversion or renumbering).
     */
    CHANGED("changed"),

    /**
     * The citation points at a reference that no longer exists.
     */
    ORPHANED("orphaned"),

    /**
     * The citation never matched any reference.
     */
    UNMATCHED("unmatched"),

    /**
     * The citation resolves through an explicit reference number.
     */
    MATCHED_NUMBER("matched-number"),

    /**
     * The citation resolves through author and year.
     */
    MATCHED_AUTHOR_YEAR("matched-author-year"),

    /**
     * Nothing conclusive applies; rendered with the default highlight.
     */
    DEFAULT("default");

    private final String identifier;

    ClassificationState(String identifier) {
        this.identifier = identifier;
    }

    /**
     * Value emitted in the {@code data-state} attribute of the citation wrapper.
     */
    public String getIdentifier() {
        return identifier;
    }

    public boolean isWarning() {
        return this == ORPHANED || this == UNMATCHED;
    }
}
