package com.williamcallahan.citations.service.citation;

import com.williamcallahan.citations.config.AnnotationProperties;
import com.williamcallahan.citations.domain.citation.AnnotatedDocument;
import com.williamcallahan.citations.domain.citation.AnnotationRequest;
import com.williamcallahan.citations.domain.citation.ChangeRecord;
import com.williamcallahan.citations.domain.citation.Citation;
import com.williamcallahan.citations.domain.citation.CitationSummary;
import com.williamcallahan.citations.domain.citation.ClassificationState;
import com.williamcallahan.citations.domain.citation.ReferenceEntry;
import com.williamcallahan.citations.logging.AnnotationEvent.EventType;
import com.williamcallahan.citations.logging.AnnotationTrace;
import com.williamcallahan.citations.support.JsoupMarkupSanitizer;
import com.williamcallahan.citations.support.MarkupSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point for annotating citations in a rendered document.
 *
 * <p>Annotation is a pure function of its inputs: identical requests produce identical markup
 * and no state is kept between calls.</p>
 */
@Service
public class CitationAnnotationService {

    private static final Logger logger = LoggerFactory.getLogger(CitationAnnotationService.class);

    private final ValidityClassifier classifier;
    private final CitationMarkupRewriter rewriter;
    private final ReferencesSectionLocator sectionLocator;
    private final MarkupSanitizer sanitizer;
    private final AnnotationTrace trace;
    private final boolean sanitizeOutput;

    /**
     * Creates a service with default limits, the jsoup sanitizer and no tracing.
     */
    public CitationAnnotationService() {
        this(new AnnotationProperties(), new JsoupMarkupSanitizer(), AnnotationTrace.noop());
    }

    @Autowired
    public CitationAnnotationService(AnnotationProperties properties, MarkupSanitizer sanitizer, AnnotationTrace trace) {
        Objects.requireNonNull(properties, "Annotation properties cannot be null");
        this.sanitizer = Objects.requireNonNull(sanitizer, "Sanitizer cannot be null");
        this.trace = trace == null ? AnnotationTrace.noop() : trace;
        this.sanitizeOutput = properties.isSanitizeOutput();
        this.classifier = new ValidityClassifier(
            new RangeExpander(properties.getRangeSpanLimit(), properties.getMaxCitationNumber()));
        this.sectionLocator = new ReferencesSectionLocator();
        this.rewriter = new CitationMarkupRewriter(classifier, sectionLocator, this.trace);
        logger.info("CitationAnnotationService initialized (range span limit {}, max citation number {})",
            properties.getRangeSpanLimit(), properties.getMaxCitationNumber());
    }

    public String annotate(String documentMarkup, List<Citation> citations, List<ReferenceEntry> references) {
        return annotate(documentMarkup, citations, references, List.of());
    }

    /**
     * Annotates a document body and returns the markup before its references section.
     */
    public String annotate(
        String documentMarkup,
        List<Citation> citations,
        List<ReferenceEntry> references,
        List<ChangeRecord> changeRecords
    ) {
        return annotate(AnnotationRequest.of(documentMarkup, citations, references, changeRecords)).markup();
    }

    /**
     * Annotates a document body.
     *
     * <p>Unexpected failures never propagate: the body is returned unannotated instead.</p>
     *
     * @param request markup, optional plain-text rendering, citations, references and changes
     * @return annotated body with the references section kept apart
     */
    public AnnotatedDocument annotate(AnnotationRequest request) {
        if (request == null) {
            return AnnotatedDocument.unannotated("", "");
        }
        try {
            return rewriter.rewrite(request);
        } catch (RuntimeException e) {
            logger.error("Citation annotation failed; returning unannotated markup", e);
            trace.record(EventType.ANNOTATION_FAILED, "", e.getClass().getSimpleName(), String.valueOf(e.getMessage()));
            return unannotatedFallback(request.documentMarkup());
        }
    }

    /**
     * Annotates and sanitizes a document body for direct rendering.
     */
    public String annotateForDisplay(AnnotationRequest request) {
        String markup = annotate(request).markup();
        return sanitizeOutput ? sanitizer.sanitize(markup) : markup;
    }

    public CitationSummary summarize(List<Citation> citations, List<ReferenceEntry> references) {
        return summarize(citations, references, List.of());
    }

    /**
     * Counts citations needing attention without rewriting any markup.
     *
     * @return orphaned texts from orphaned citations and orphan changes, deduplicated, and
     *         unmatched citation texts that are not also orphaned
     */
    public CitationSummary summarize(
        List<Citation> citations,
        List<ReferenceEntry> references,
        List<ChangeRecord> changeRecords
    ) {
        ReferenceSnapshot snapshot = ReferenceSnapshot.of(references);
        List<ChangeRecord> changes = changeRecords == null
            ? List.of()
            : changeRecords.stream().filter(Objects::nonNull).toList();

        Set<String> orphanedTexts = new LinkedHashSet<>();
        Set<ChangeRecord> coveredChanges = new HashSet<>();
        List<Citation> unmatchedCandidates = new ArrayList<>();
        if (citations != null) {
            for (Citation citation : citations) {
                if (citation == null || !citation.hasText()) {
                    continue;
                }
                CitationClassification classification = classifier.classify(citation, snapshot, changes);
                if (!classification.state().isWarning()) {
                    continue;
                }
                if (classification.state() == ClassificationState.ORPHANED) {
                    orphanedTexts.add(citation.rawText());
                    if (classification.hasChange()) {
                        coveredChanges.add(classification.change());
                    }
                } else {
                    unmatchedCandidates.add(citation);
                }
            }
        }
        // A change already resolved by an orphaned citation is that citation, whatever text it carries.
        for (ChangeRecord change : changes) {
            if (change.denotesOrphan() && !change.orphanText().isEmpty() && !coveredChanges.contains(change)) {
                orphanedTexts.add(change.orphanText());
            }
        }

        List<String> unmatchedTexts = unmatchedCandidates.stream()
            .map(Citation::rawText)
            .filter(text -> !orphanedTexts.contains(text))
            .toList();
        return CitationSummary.of(unmatchedTexts, new ArrayList<>(orphanedTexts));
    }

    private AnnotatedDocument unannotatedFallback(String documentMarkup) {
        try {
            ReferencesSectionLocator.MarkupSections sections = sectionLocator.split(documentMarkup);
            return AnnotatedDocument.unannotated(sections.body(), sections.referencesSection());
        } catch (RuntimeException e) {
            logger.warn("Could not locate references section in fallback; returning whole document", e);
            return AnnotatedDocument.unannotated(documentMarkup, "");
        }
    }
}
