package com.williamcallahan.citations.service.citation;

import com.williamcallahan.citations.domain.citation.ChangeRecord;
import com.williamcallahan.citations.domain.citation.Citation;

import java.util.List;
import java.util.Optional;

/**
 * Finds the pending change that applies to a citation.
 *
 * <p>A citation's text may show either the pre- or post-change state depending on whether the
 * document markup was regenerated, so lookup falls back from identity to the new text and then
 * to the old text.</p>
 */
public class ChangeResolver {

    /**
     * @return the first change matching by id, else by new text, else by old text
     */
    public Optional<ChangeRecord> resolve(Citation citation, List<ChangeRecord> changes) {
        if (citation == null || changes == null || changes.isEmpty()) {
            return Optional.empty();
        }

        if (!citation.id().isEmpty()) {
            for (ChangeRecord change : changes) {
                if (citation.id().equals(change.citationId())) {
                    return Optional.of(change);
                }
            }
        }
        if (!citation.hasText()) {
            return Optional.empty();
        }
        for (ChangeRecord change : changes) {
            if (change.newText().equals(citation.rawText())) {
                return Optional.of(change);
            }
        }
        for (ChangeRecord change : changes) {
            if (change.oldText().equals(citation.rawText())) {
                return Optional.of(change);
            }
        }
        return Optional.empty();
    }
}
