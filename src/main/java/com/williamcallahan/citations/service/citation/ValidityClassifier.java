package com.williamcallahan.citations.service.citation;

import com.williamcallahan.citations.domain.citation.AuthorYearMatch;
import com.williamcallahan.citations.domain.citation.ChangeRecord;
import com.williamcallahan.citations.domain.citation.Citation;
import com.williamcallahan.citations.domain.citation.ClassificationState;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Decides which of the six {@link ClassificationState}s a citation is in and renders its fragment.
 *
 * <p>States are checked in priority order: a text change in flight, then orphaned, unmatched,
 * matched by number, matched by author and year, and finally the default highlight. An empty
 * reference list disables the orphan and unmatched checks for numeric citations, since the
 * list may simply not have loaded yet.</p>
 */
public class ValidityClassifier {

    private final RangeExpander rangeExpander;
    private final AuthorYearParser authorYearParser;
    private final ChangeResolver changeResolver;
    private final CitationMarkupRenderer renderer;

    public ValidityClassifier() {
        this(new RangeExpander());
    }

    public ValidityClassifier(RangeExpander rangeExpander) {
        this.rangeExpander = Objects.requireNonNull(rangeExpander, "Range expander cannot be null");
        this.authorYearParser = new AuthorYearParser();
        this.changeResolver = new ChangeResolver();
        this.renderer = new CitationMarkupRenderer(rangeExpander);
    }

    /**
     * Classifies a citation against the current references and pending changes.
     *
     * @param citation citation with non-empty text
     * @param references current reference list
     * @param changes pending changes, may be empty
     * @return the state with its replacement fragment and search texts
     */
    public CitationClassification classify(Citation citation, ReferenceSnapshot references, List<ChangeRecord> changes) {
        ChangeRecord change = changeResolver.resolve(citation, changes).orElse(null);
        List<Integer> citedNumbers = rangeExpander.expand(citation.rawText());

        if (change != null && change.changesText()) {
            return new CitationClassification(ClassificationState.CHANGED, citation, change,
                changedSearchTexts(citation, change), CitationMarkupRenderer.changedTitle(change),
                renderer.changed(change));
        }

        List<Integer> missingNumbers = references.isEmpty()
            ? List.of()
            : citedNumbers.stream().filter(number -> !references.contains(number)).toList();
        if (isOrphaned(citation, change, missingNumbers, references)) {
            String searchText = change != null && !change.oldText().isEmpty() ? change.oldText() : citation.rawText();
            String title = CitationMarkupRenderer.orphanTitle(change, missingNumbers);
            return new CitationClassification(ClassificationState.ORPHANED, citation, change,
                List.of(searchText), title, renderer.orphaned(searchText, title));
        }

        List<Integer> presentNumbers = citedNumbers.stream().filter(references::contains).toList();
        boolean referenceNumberPresent = references.contains(citation.referenceNumber());
        boolean numericallyMatched = referenceNumberPresent || !presentNumbers.isEmpty();
        List<AuthorYearMatch> authorYearMatches = numericallyMatched
            ? List.of()
            : authorYearParser.parse(citation.rawText(), references.entries()).stream()
                .filter(AuthorYearMatch::isMatched)
                .toList();
        List<String> searchTexts = List.of(citation.rawText());

        boolean numbersWithoutReferences = references.isEmpty() && !citedNumbers.isEmpty();
        if (citation.referenceNumber() == null && !numericallyMatched && authorYearMatches.isEmpty()
            && !numbersWithoutReferences) {
            return new CitationClassification(ClassificationState.UNMATCHED, citation, change, searchTexts,
                CitationMarkupRenderer.UNMATCHED_TITLE, renderer.unmatched(citation.rawText()));
        }

        if (numericallyMatched) {
            if (isPureRenumber(change)) {
                return new CitationClassification(ClassificationState.MATCHED_NUMBER, citation, change, searchTexts,
                    CitationMarkupRenderer.renumberTitle(change),
                    renderer.renumbered(citation.rawText(), change));
            }
            String title = referenceNumberPresent
                ? "Reference #" + citation.referenceNumber()
                : "References: " + presentNumbers.stream().map(String::valueOf).collect(Collectors.joining(", "));
            return new CitationClassification(ClassificationState.MATCHED_NUMBER, citation, change, searchTexts,
                title, renderer.matchedNumbers(citation.rawText(), title));
        }

        if (!authorYearMatches.isEmpty()) {
            return new CitationClassification(ClassificationState.MATCHED_AUTHOR_YEAR, citation, change, searchTexts,
                CitationMarkupRenderer.authorYearTitle(authorYearMatches),
                renderer.matchedAuthorYear(citation.rawText(), authorYearMatches));
        }

        String title = citation.referenceNumber() != null ? "Reference #" + citation.referenceNumber() : "Citation";
        return new CitationClassification(ClassificationState.DEFAULT, citation, change, searchTexts,
            title, renderer.defaultHighlight(citation.rawText(), title));
    }

    /**
     * Fragment for an orphan change record that no live citation covers.
     */
    String renderOrphanChange(ChangeRecord change) {
        String text = change.orphanText();
        return renderer.orphaned(text, CitationMarkupRenderer.orphanTitle(change, List.of()));
    }

    private static boolean isOrphaned(
        Citation citation,
        ChangeRecord change,
        List<Integer> missingNumbers,
        ReferenceSnapshot references
    ) {
        if (citation.orphaned()) {
            return true;
        }
        if (change != null && change.denotesOrphan()) {
            return true;
        }
        if (references.isEmpty()) {
            return false;
        }
        Integer referenceNumber = citation.referenceNumber();
        return (referenceNumber != null && !references.contains(referenceNumber)) || !missingNumbers.isEmpty();
    }

    // The document markup may hold either text; prefer whichever one the citation currently shows.
    private static List<String> changedSearchTexts(Citation citation, ChangeRecord change) {
        if (citation.rawText().equals(change.oldText()) && !citation.rawText().equals(change.newText())) {
            return List.of(change.oldText(), change.newText());
        }
        return List.of(change.newText(), change.oldText());
    }

    private static boolean isPureRenumber(ChangeRecord change) {
        return change != null
            && change.newNumber() != null
            && change.oldNumber() != null
            && change.oldNumber() > 0
            && !change.oldNumber().equals(change.newNumber());
    }
}
