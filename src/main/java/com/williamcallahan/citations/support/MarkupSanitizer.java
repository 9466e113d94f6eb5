package com.williamcallahan.citations.support;

/**
 * Makes annotated markup safe for direct rendering in the host page.
 */
public interface MarkupSanitizer {

    /**
     * @param markup annotated markup
     * @return markup restricted to the allowed tags and attributes
     */
    String sanitize(String markup);
}
