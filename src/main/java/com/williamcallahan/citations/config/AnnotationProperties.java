package com.williamcallahan.citations.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for the citation annotation engine, bound from {@code app.citations.*}.
 */
@ConfigurationProperties(prefix = "app.citations")
public class AnnotationProperties {

    static final int DEFAULT_RANGE_SPAN_LIMIT = 50;
    static final int DEFAULT_MAX_CITATION_NUMBER = 1000;

    /**
     * Ranges spanning this many numbers or more are treated as malformed and not expanded.
     */
    private int rangeSpanLimit = DEFAULT_RANGE_SPAN_LIMIT;

    /**
     * Numbers at or above this bound are treated as noise (years, page numbers).
     */
    private int maxCitationNumber = DEFAULT_MAX_CITATION_NUMBER;

    /**
     * Whether display output is passed through the markup sanitizer.
     */
    private boolean sanitizeOutput = true;

    public int getRangeSpanLimit() {
        return rangeSpanLimit;
    }

    public void setRangeSpanLimit(int rangeSpanLimit) {
        this.rangeSpanLimit = rangeSpanLimit;
    }

    public int getMaxCitationNumber() {
        return maxCitationNumber;
    }

    public void setMaxCitationNumber(int maxCitationNumber) {
        this.maxCitationNumber = maxCitationNumber;
    }

    public boolean isSanitizeOutput() {
        return sanitizeOutput;
    }

    public void setSanitizeOutput(boolean sanitizeOutput) {
        this.sanitizeOutput = sanitizeOutput;
    }

    @PostConstruct
    public void validateConfiguration() {
        if (rangeSpanLimit <= 0) {
            throw new IllegalArgumentException("app.citations.range-span-limit must be positive, got " + rangeSpanLimit);
        }
        if (maxCitationNumber <= 0) {
            throw new IllegalArgumentException("app.citations.max-citation-number must be positive, got " + maxCitationNumber);
        }
    }
}
