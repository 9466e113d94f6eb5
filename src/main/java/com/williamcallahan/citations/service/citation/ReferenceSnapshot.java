package com.williamcallahan.citations.service.citation;

import com.williamcallahan.citations.domain.citation.ReferenceEntry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The reference list of one render, indexed by display number.
 *
 * @param entries references in list order
 * @param numbers display numbers present in the list
 */
public record ReferenceSnapshot(List<ReferenceEntry> entries, Set<Integer> numbers) {

    public ReferenceSnapshot {
        entries = entries == null ? List.of() : List.copyOf(entries);
        numbers = numbers == null ? Set.of() : Set.copyOf(numbers);
    }

    public static ReferenceSnapshot of(List<ReferenceEntry> references) {
        if (references == null) {
            return new ReferenceSnapshot(List.of(), Set.of());
        }
        List<ReferenceEntry> entries = references.stream().filter(Objects::nonNull).toList();
        Set<Integer> numbers = new LinkedHashSet<>();
        for (ReferenceEntry entry : entries) {
            numbers.add(entry.number());
        }
        return new ReferenceSnapshot(entries, numbers);
    }

    public boolean contains(Integer number) {
        return number != null && numbers.contains(number);
    }

    /**
     * An empty list means there is nothing to compare against, not that every citation is broken.
     */
    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
