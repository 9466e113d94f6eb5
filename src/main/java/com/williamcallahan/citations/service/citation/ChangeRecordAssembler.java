package com.williamcallahan.citations.service.citation;

import com.williamcallahan.citations.domain.citation.ChangeRecord;
import com.williamcallahan.citations.domain.citation.ChangeType;
import com.williamcallahan.citations.domain.citation.CitationPreview;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts change-tracking preview rows into the change records a render consumes.
 */
public final class ChangeRecordAssembler {

    private ChangeRecordAssembler() {
    }

    /**
     * Maps pending preview rows to change records, dropping rows with no pending change.
     *
     * <p>Previews do not carry the number a citation had before the change, so every record
     * gets an old number of 0. Orphaned rows become deletions whose text is the text still
     * shown in the document.</p>
     *
     * @param previews preview rows, may be null
     * @return change records in preview order
     */
    public static List<ChangeRecord> fromPreviews(List<CitationPreview> previews) {
        if (previews == null || previews.isEmpty()) {
            return List.of();
        }
        List<ChangeRecord> records = new ArrayList<>(previews.size());
        for (CitationPreview preview : previews) {
            if (preview == null) {
                continue;
            }
            ChangeType changeType = preview.changeType() == null ? ChangeType.UNCHANGED : preview.changeType();
            if (changeType == ChangeType.UNCHANGED) {
                continue;
            }
            boolean removed = preview.orphaned() || changeType == ChangeType.DELETED;
            records.add(new ChangeRecord(
                preview.id(),
                0,
                removed ? null : preview.referenceNumber(),
                preview.originalText(),
                removed ? preview.originalText() : preview.newText(),
                preview.orphaned() ? ChangeType.DELETED : changeType
            ));
        }
        return List.copyOf(records);
    }
}
