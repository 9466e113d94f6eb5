package com.williamcallahan.citations.service.citation;

import com.williamcallahan.citations.config.AnnotationProperties;
import com.williamcallahan.citations.domain.citation.AnnotatedDocument;
import com.williamcallahan.citations.domain.citation.AnnotationRequest;
import com.williamcallahan.citations.domain.citation.ChangeRecord;
import com.williamcallahan.citations.domain.citation.ChangeType;
import com.williamcallahan.citations.domain.citation.Citation;
import com.williamcallahan.citations.domain.citation.CitationSummary;
import com.williamcallahan.citations.domain.citation.ReferenceEntry;
import com.williamcallahan.citations.logging.AnnotationEvent;
import com.williamcallahan.citations.logging.AnnotationEvent.EventType;
import com.williamcallahan.citations.logging.AnnotationTrace;
import com.williamcallahan.citations.support.MarkupSanitizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end tests of the annotation facade.
 */
class CitationAnnotationServiceTest {

    private static final List<ReferenceEntry> TWO_REFERENCES = List.of(ReferenceEntry.numbered(1), ReferenceEntry.numbered(2));

    private final CitationAnnotationService service = new CitationAnnotationService();

    @Test
    @DisplayName("Orphaned number is flagged and the references section is cut off")
    void orphanedNumberScenario() {
        String markup = "Findings were clear [3].\nReferences\n1. Marcus, G. (2019)";

        String annotated = service.annotate(markup, List.of(Citation.of("c1", "[3]")), TWO_REFERENCES);

        assertTrue(annotated.startsWith("Findings were clear <mark "), annotated);
        assertTrue(annotated.contains("data-state=\"orphaned\""), "Missing reference 3 must be flagged");
        assertTrue(annotated.endsWith("</mark>.\n"), "Annotated prefix ends before the references heading");
        assertFalse(annotated.contains("Marcus"));
    }

    @Test
    @DisplayName("Renumbered citation renders the transition rather than an orphan")
    void renumberScenario() {
        ChangeRecord change = new ChangeRecord("c1", null, null, "[5]", "[4]", ChangeType.RENUMBER);
        List<ReferenceEntry> references = List.of(ReferenceEntry.numbered(1), ReferenceEntry.numbered(2),
            ReferenceEntry.numbered(3), ReferenceEntry.numbered(4));

        String annotated = service.annotate("<p>As shown [4].</p>", List.of(Citation.of("c1", "[4]")), references,
            List.of(change));

        assertTrue(annotated.contains("data-state=\"changed\""), annotated);
        assertTrue(annotated.contains("track-change-arrow"));
        assertFalse(annotated.contains("data-state=\"orphaned\""));
    }

    @Test
    void annotateTwiceWithSameInputsIsByteIdentical() {
        List<Citation> citations = List.of(Citation.of("a", "[1]"), Citation.of("b", "[1,2]"), Citation.of("c", "[3]"));
        String markup = "<p>[1] [1,2] [3]</p>";

        assertEquals(service.annotate(markup, citations, TWO_REFERENCES), service.annotate(markup, citations, TWO_REFERENCES));
    }

    @Test
    void nullInputsAreNormalized() {
        assertEquals("", service.annotate(null, null, null));
        assertEquals("", service.annotate((AnnotationRequest) null).markup());
    }

    @Test
    void summarizeCountsDistinctOrphansAndUnmatchedCitations() {
        List<Citation> citations = List.of(
            Citation.of("c1", "[3]"),
            Citation.of("c2", "(Nobody, 2001)"),
            Citation.of("c3", "[1]"),
            Citation.of("c4", "[3]"),
            Citation.of("c5", ""));
        List<ChangeRecord> changes = List.of(ChangeRecord.deleted("", 3, "[3]"), ChangeRecord.deleted("", 8, "[8]"));

        CitationSummary summary = service.summarize(citations, TWO_REFERENCES, changes);

        assertEquals(2, summary.orphanedCount());
        assertEquals(List.of("[3]", "[8]"), summary.orphanedTexts());
        assertEquals(1, summary.unmatchedCount());
        assertEquals(List.of("(Nobody, 2001)"), summary.unmatchedTexts());
        assertFalse(summary.isClean());
    }

    @Test
    @DisplayName("Citation orphaned through its own deletion record is counted once")
    void summarizeCountsCitationAndItsDeletionRecordOnce() {
        List<ReferenceEntry> references = List.of(ReferenceEntry.numbered(1), ReferenceEntry.numbered(4));

        CitationSummary summary = service.summarize(List.of(Citation.of("c1", "[4]")), references,
            List.of(ChangeRecord.deleted("c1", 5, "[5]")));

        assertEquals(1, summary.orphanedCount());
        assertEquals(List.of("[4]"), summary.orphanedTexts());
        assertEquals(0, summary.unmatchedCount());
    }

    @Test
    void summarizeWithoutReferencesFlagsNothingNumeric() {
        CitationSummary summary = service.summarize(List.of(Citation.of("c1", "[3]")), List.of());

        assertTrue(summary.isClean());
    }

    @Test
    void annotateForDisplayPassesOutputThroughSanitizer() {
        MarkupSanitizer sanitizer = mock(MarkupSanitizer.class);
        when(sanitizer.sanitize(anyString())).thenReturn("<p>clean</p>");
        CitationAnnotationService sanitizing =
            new CitationAnnotationService(new AnnotationProperties(), sanitizer, AnnotationTrace.noop());

        String display = sanitizing.annotateForDisplay(
            AnnotationRequest.of("<p>[1]</p>", List.of(Citation.of("c1", "[1]")), TWO_REFERENCES, List.of()));

        assertEquals("<p>clean</p>", display);
        verify(sanitizer).sanitize(anyString());
    }

    @Test
    void annotateForDisplaySkipsSanitizerWhenDisabled() {
        MarkupSanitizer sanitizer = mock(MarkupSanitizer.class);
        AnnotationProperties properties = new AnnotationProperties();
        properties.setSanitizeOutput(false);
        CitationAnnotationService unsanitized = new CitationAnnotationService(properties, sanitizer, AnnotationTrace.noop());

        String display = unsanitized.annotateForDisplay(
            AnnotationRequest.of("<p>[1]</p>", List.of(Citation.of("c1", "[1]")), TWO_REFERENCES, List.of()));

        assertTrue(display.contains("citation-link"));
        verify(sanitizer, never()).sanitize(anyString());
    }

    @Test
    void unexpectedFailureFallsBackToUnannotatedBody() {
        List<AnnotationEvent> recorded = new ArrayList<>();
        AnnotationTrace failingTrace = event -> {
            if (event.type() == EventType.CITATION_REPLACED) {
                throw new IllegalStateException("trace sink unavailable");
            }
            recorded.add(event);
        };
        CitationAnnotationService fragile =
            new CitationAnnotationService(new AnnotationProperties(), markup -> markup, failingTrace);

        AnnotatedDocument document = fragile.annotate(AnnotationRequest.of(
            "<p>Claim [1].</p><h2>References</h2>", List.of(Citation.of("c1", "[1]")), TWO_REFERENCES, List.of()));

        assertEquals("<p>Claim [1].</p>", document.markup());
        assertEquals("<h2>References</h2>", document.referencesSection());
        assertTrue(recorded.stream().anyMatch(event -> event.type() == EventType.ANNOTATION_FAILED));
    }

    @Test
    void configuredLimitsReachTheRangeExpander() {
        AnnotationProperties properties = new AnnotationProperties();
        properties.setMaxCitationNumber(3);
        CitationAnnotationService bounded = new CitationAnnotationService(properties, markup -> markup, AnnotationTrace.noop());

        String annotated = bounded.annotate("<p>[1-4]</p>", List.of(Citation.of("c1", "[1-4]")), TWO_REFERENCES);

        assertTrue(annotated.contains("data-ref=\"2\""));
        assertFalse(annotated.contains("data-ref=\"3\""), "Numbers at or above the bound are noise");
    }
}
