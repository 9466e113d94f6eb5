package com.williamcallahan.citations.domain.citation;

import java.util.List;

/**
 * Badge counts for citations that need attention.
 *
 * @param unmatchedCount citations without any matching reference
 * @param orphanedCount distinct citation texts whose reference was deleted
 * @param unmatchedTexts texts of the unmatched citations, in input order
 * @param orphanedTexts distinct orphaned citation texts, in first-seen order
 */
public record CitationSummary(
    int unmatchedCount,
    int orphanedCount,
    List<String> unmatchedTexts,
    List<String> orphanedTexts
) {

    public CitationSummary {
        unmatchedTexts = unmatchedTexts == null ? List.of() : List.copyOf(unmatchedTexts);
        orphanedTexts = orphanedTexts == null ? List.of() : List.copyOf(orphanedTexts);
    }

    public static CitationSummary of(List<String> unmatchedTexts, List<String> orphanedTexts) {
        return new CitationSummary(unmatchedTexts.size(), orphanedTexts.size(), unmatchedTexts, orphanedTexts);
    }

    public boolean isClean() {
        return unmatchedCount == 0 && orphanedCount == 0;
    }
}
