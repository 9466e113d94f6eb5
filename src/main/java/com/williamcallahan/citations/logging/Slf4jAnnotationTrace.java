package com.williamcallahan.citations.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes annotation events to the {@code CITATIONS} pipeline log.
 */
@Component
public class Slf4jAnnotationTrace implements AnnotationTrace {

    private static final Logger CITATIONS_LOG = LoggerFactory.getLogger("CITATIONS");

    @Override
    public void record(AnnotationEvent event) {
        switch (event.type()) {
            case ANNOTATION_FAILED -> CITATIONS_LOG.error("[{}] {} ({})",
                event.type(), event.detail(), event.text());
            case CITATION_SKIPPED, CITATION_NOT_FOUND -> CITATIONS_LOG.debug("[{}] citation={} text=\"{}\" {}",
                event.type(), event.citationId(), event.text(), event.detail());
            case REFERENCES_SECTION_FOUND, REFERENCES_SECTION_MISSING -> CITATIONS_LOG.debug("[{}] {}",
                event.type(), event.detail());
            default -> CITATIONS_LOG.trace("[{}] citation={} text=\"{}\" {}",
                event.type(), event.citationId(), event.text(), event.detail());
        }
    }
}
