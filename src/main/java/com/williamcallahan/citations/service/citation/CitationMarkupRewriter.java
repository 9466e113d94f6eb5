package com.williamcallahan.citations.service.citation;

import com.williamcallahan.citations.domain.citation.AnnotatedDocument;
import com.williamcallahan.citations.domain.citation.AnnotationRequest;
import com.williamcallahan.citations.domain.citation.ChangeRecord;
import com.williamcallahan.citations.domain.citation.Citation;
import com.williamcallahan.citations.logging.AnnotationEvent.EventType;
import com.williamcallahan.citations.logging.AnnotationTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Locates every citation in a document body and rewrites its occurrences with classified markup.
 *
 * <p>Rewriting happens in two phases. First each citation, longest text first, claims all free
 * occurrences of the first of its search variants found in the body and maps a placeholder to
 * its fragment. Then the claimed spans are replaced by their fragments in one pass. Claimed
 * spans and markup tags are off limits to later claims, so overlapping citation texts are
 * rewritten exactly once and tag structure is never touched.</p>
 */
public class CitationMarkupRewriter {

    private static final Logger logger = LoggerFactory.getLogger(CitationMarkupRewriter.class);

    private static final String PLACEHOLDER_PREFIX = "__CITE_PLACEHOLDER_";
    private static final String PLACEHOLDER_SUFFIX = "__";

    private final ValidityClassifier classifier;
    private final ReferencesSectionLocator sectionLocator;
    private final AnnotationTrace trace;

    public CitationMarkupRewriter(ValidityClassifier classifier, ReferencesSectionLocator sectionLocator, AnnotationTrace trace) {
        this.classifier = Objects.requireNonNull(classifier, "Classifier cannot be null");
        this.sectionLocator = Objects.requireNonNull(sectionLocator, "Section locator cannot be null");
        this.trace = trace == null ? AnnotationTrace.noop() : trace;
    }

    /**
     * One citation or orphan change waiting to claim its occurrences.
     */
    private record Substitution(String citationId, String text, String fragment, List<String> variants, EventType event) {
    }

    /**
     * Annotates the body of a document, leaving its references section untouched.
     *
     * @param request markup, citations, references and pending changes
     * @return annotated body with the references tail kept apart
     */
    public AnnotatedDocument rewrite(AnnotationRequest request) {
        ReferencesSectionLocator.MarkupSections sections = sectionLocator.split(request.documentMarkup());
        if (sections.hasReferencesSection()) {
            trace.record(EventType.REFERENCES_SECTION_FOUND, "", "",
                "body cut at offset " + sections.body().length());
        } else {
            trace.record(EventType.REFERENCES_SECTION_MISSING, "", "", "annotating the whole document");
        }

        String body = sections.body();
        List<Substitution> substitutions = planSubstitutions(request);
        if (body.isEmpty() || substitutions.isEmpty()) {
            return AnnotatedDocument.unannotated(body, sections.referencesSection());
        }

        Set<String> allVariants = new LinkedHashSet<>();
        for (Substitution substitution : substitutions) {
            allVariants.addAll(substitution.variants());
        }
        Map<String, List<Integer>> occurrences = new VariantTrie(allVariants).findOccurrences(body);

        SpanClaims claims = SpanClaims.over(body);
        Map<String, String> fragments = new LinkedHashMap<>();
        List<String> unlocated = new ArrayList<>();
        int highlighted = 0;
        for (Substitution substitution : substitutions) {
            String placeholder = PLACEHOLDER_PREFIX + fragments.size() + PLACEHOLDER_SUFFIX;
            int claimedCount = 0;
            String matchedVariant = null;
            for (String variant : substitution.variants()) {
                List<Integer> starts = occurrences.getOrDefault(variant, List.of());
                if (starts.isEmpty()) {
                    continue;
                }
                claimedCount = claims.claimAll(starts, variant.length(), placeholder);
                if (claimedCount > 0) {
                    matchedVariant = variant;
                    break;
                }
            }

            if (claimedCount == 0) {
                if (substitution.event() == EventType.CITATION_REPLACED) {
                    unlocated.add(substitution.text());
                    trace.record(EventType.CITATION_NOT_FOUND, substitution.citationId(), substitution.text(),
                        "tried " + substitution.variants().size() + " variants");
                }
                continue;
            }
            fragments.put(placeholder, substitution.fragment());
            highlighted += claimedCount;
            trace.record(substitution.event(), substitution.citationId(), substitution.text(),
                claimedCount + " occurrence(s) via \"" + matchedVariant + "\"");
        }

        logger.debug("Annotated {} occurrence(s) for {} of {} substitution(s)",
            highlighted, fragments.size(), substitutions.size());
        return new AnnotatedDocument(claims.render(fragments), sections.referencesSection(), highlighted, unlocated);
    }

    private List<Substitution> planSubstitutions(AnnotationRequest request) {
        ReferenceSnapshot references = ReferenceSnapshot.of(request.references());
        List<ChangeRecord> changes = request.changeRecords().stream().filter(Objects::nonNull).toList();

        List<Substitution> substitutions = new ArrayList<>();
        Set<String> seenTexts = new LinkedHashSet<>();
        Set<ChangeRecord> coveredChanges = new HashSet<>();
        for (Citation citation : orderForSubstitution(request.citations())) {
            seenTexts.add(citation.rawText());
            CitationClassification classification = classifier.classify(citation, references, changes);
            if (classification.hasChange()) {
                coveredChanges.add(classification.change());
                trace.record(EventType.CHANGE_RESOLVED, citation.id(), citation.rawText(),
                    classification.change().changeType().getIdentifier());
            }

            List<String> searchTexts = new ArrayList<>(classification.searchTexts());
            if (request.hasPlainText()) {
                String fallback = SearchVariants.positionFallback(
                    request.plainText(), citation.startOffset(), citation.endOffset());
                if (!fallback.isEmpty()) {
                    searchTexts.add(fallback);
                }
            }
            substitutions.add(new Substitution(citation.id(), citation.rawText(), classification.fragment(),
                SearchVariants.of(searchTexts), EventType.CITATION_REPLACED));
        }

        for (ChangeRecord change : changes) {
            if (!change.denotesOrphan() || coveredChanges.contains(change)) {
                continue;
            }
            String text = change.orphanText();
            if (text.isEmpty() || !seenTexts.add(text)) {
                continue;
            }
            substitutions.add(new Substitution(change.citationId(), text, classifier.renderOrphanChange(change),
                SearchVariants.of(List.of(text)), EventType.ORPHAN_CHANGE_REPLACED));
        }
        return substitutions;
    }

    /**
     * Drops citations without text and repeated texts, then orders the rest longest first so a
     * shorter text cannot claim part of a longer one. The sort is stable.
     */
    private List<Citation> orderForSubstitution(List<Citation> citations) {
        Map<String, Citation> byText = new LinkedHashMap<>();
        for (Citation citation : citations) {
            if (citation == null) {
                continue;
            }
            if (!citation.hasText()) {
                trace.record(EventType.CITATION_SKIPPED, citation.id(), "", "citation has no text");
                continue;
            }
            byText.putIfAbsent(citation.rawText(), citation);
        }
        List<Citation> ordered = new ArrayList<>(byText.values());
        ordered.sort(Comparator.comparingInt((Citation citation) -> citation.rawText().length()).reversed());
        return ordered;
    }
}
