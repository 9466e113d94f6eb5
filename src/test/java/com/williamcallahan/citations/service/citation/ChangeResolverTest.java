package com.williamcallahan.citations.service.citation;

import com.williamcallahan.citations.domain.citation.ChangeRecord;
import com.williamcallahan.citations.domain.citation.Citation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests the identity, new-text, old-text lookup order for pending changes.
 */
class ChangeResolverTest {

    private final ChangeResolver resolver = new ChangeResolver();

    @Test
    void resolve_prefersIdentityOverText() {
        ChangeRecord byText = ChangeRecord.renumbered("other", 2, 1, "[2]", "[1]");
        ChangeRecord byId = ChangeRecord.renumbered("c1", 5, 4, "[5]", "[4]");

        Optional<ChangeRecord> resolved = resolver.resolve(Citation.of("c1", "[1]"), List.of(byText, byId));

        assertEquals(Optional.of(byId), resolved);
    }

    @Test
    void resolve_prefersNewTextOverOldText() {
        ChangeRecord oldTextMatch = ChangeRecord.renumbered("x", 3, 2, "[3]", "[2]");
        ChangeRecord newTextMatch = ChangeRecord.renumbered("y", 4, 3, "[4]", "[3]");

        Optional<ChangeRecord> resolved = resolver.resolve(Citation.of("c9", "[3]"), List.of(oldTextMatch, newTextMatch));

        assertEquals(Optional.of(newTextMatch), resolved);
    }

    @Test
    void resolve_fallsBackToOldText() {
        ChangeRecord change = ChangeRecord.renumbered("x", 3, 2, "[3]", "[2]");

        assertEquals(Optional.of(change), resolver.resolve(Citation.of("c9", "[3]"), List.of(change)));
    }

    @Test
    void resolve_blankIdentifiersNeverMatchEachOther() {
        ChangeRecord change = ChangeRecord.deleted("", 7, "[7]");

        assertTrue(resolver.resolve(Citation.of("", "[8]"), List.of(change)).isEmpty());
    }

    @Test
    void resolve_emptyInputs_returnEmpty() {
        assertTrue(resolver.resolve(Citation.of("c1", "[1]"), List.of()).isEmpty());
        assertTrue(resolver.resolve(Citation.of("c1", "[1]"), null).isEmpty());
        assertTrue(resolver.resolve(null, List.of(ChangeRecord.deleted("c1", 1, "[1]"))).isEmpty());
    }
}
