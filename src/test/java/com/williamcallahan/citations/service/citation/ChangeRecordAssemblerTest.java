package com.williamcallahan.citations.service.citation;

import com.williamcallahan.citations.domain.citation.ChangeRecord;
import com.williamcallahan.citations.domain.citation.ChangeType;
import com.williamcallahan.citations.domain.citation.CitationPreview;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests conversion of preview rows into change records.
 */
class ChangeRecordAssemblerTest {

    @Test
    void fromPreviews_dropsUnchangedRows() {
        List<ChangeRecord> records = ChangeRecordAssembler.fromPreviews(List.of(
            new CitationPreview("c1", ChangeType.UNCHANGED, false, 1, "[1]", "[1]")));

        assertTrue(records.isEmpty());
    }

    @Test
    void fromPreviews_renumberKeepsNewNumberAndText() {
        ChangeRecord record = ChangeRecordAssembler.fromPreviews(List.of(
            new CitationPreview("c1", ChangeType.RENUMBER, false, 4, "[5]", "[4]"))).get(0);

        assertEquals("c1", record.citationId());
        assertEquals(0, record.oldNumber());
        assertEquals(4, record.newNumber());
        assertEquals("[5]", record.oldText());
        assertEquals("[4]", record.newText());
        assertEquals(ChangeType.RENUMBER, record.changeType());
    }

    @Test
    void fromPreviews_orphanedRowBecomesDeletion() {
        ChangeRecord record = ChangeRecordAssembler.fromPreviews(List.of(
            new CitationPreview("c2", ChangeType.STYLE, true, 7, "[7]", "[6]"))).get(0);

        assertEquals(ChangeType.DELETED, record.changeType());
        assertNull(record.newNumber());
        assertEquals("[7]", record.newText());
        assertTrue(record.denotesOrphan());
    }

    @Test
    void fromPreviews_deletedRowKeepsDocumentText() {
        ChangeRecord record = ChangeRecordAssembler.fromPreviews(List.of(
            new CitationPreview("c3", ChangeType.DELETED, false, 2, "[2]", ""))).get(0);

        assertNull(record.newNumber());
        assertEquals("[2]", record.newText());
    }

    @Test
    void fromPreviews_nullInput_isEmpty() {
        assertTrue(ChangeRecordAssembler.fromPreviews(null).isEmpty());
    }
}
