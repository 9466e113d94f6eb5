package com.williamcallahan.citations.domain.citation;

import java.util.List;
import java.util.OptionalInt;

/**
 * Click-routing contract shared with the host page.
 *
 * <p>Every clickable citation unit is a {@code span} with the {@link #LINK_CLASS} class and a
 * {@link #REFERENCE_ATTRIBUTE} attribute holding the reference number. The host scrolls to the
 * first existing element among {@link #referenceElementIds(int)} and may notify a selection
 * callback. These names are consumed by existing pages and must not change.</p>
 */
public final class CitationLinkContract {

    public static final String LINK_CLASS = "citation-link";
    public static final String REFERENCE_ATTRIBUTE = "data-ref";
    public static final String LINK_STYLE = "cursor: pointer;";
    public static final String STATE_ATTRIBUTE = "data-state";

    private CitationLinkContract() {
    }

    /**
     * Element ids the host tries, in order, when scrolling to a reference.
     */
    public static List<String> referenceElementIds(int referenceNumber) {
        return List.of("ref-" + referenceNumber, "reference-" + referenceNumber);
    }

    /**
     * Parses the value of a clicked unit's reference attribute.
     *
     * @return the reference number, or empty for missing, zero or malformed values
     */
    public static OptionalInt parseReferenceNumber(String attributeValue) {
        if (attributeValue == null || attributeValue.isBlank()) {
            return OptionalInt.empty();
        }
        try {
            int referenceNumber = Integer.parseInt(attributeValue.trim());
            return referenceNumber == 0 ? OptionalInt.empty() : OptionalInt.of(referenceNumber);
        } catch (NumberFormatException malformedValue) {
            return OptionalInt.empty();
        }
    }
}
