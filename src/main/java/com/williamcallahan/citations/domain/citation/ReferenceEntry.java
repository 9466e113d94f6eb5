package com.williamcallahan.citations.domain.citation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One bibliography entry with its display number, as currently held by the reference store.
 *
 * @param id reference identifier
 * @param number 1-indexed display number, unique within one snapshot
 * @param authors ordered author names in "Last, First" or "First Last" form
 * @param year four-digit publication year, empty when unknown
 */
public record ReferenceEntry(String id, int number, List<String> authors, String year) {

    public ReferenceEntry {
        id = id == null ? "" : id;
        authors = authors == null ? List.of() : authors.stream().filter(Objects::nonNull).toList();
        year = year == null ? "" : year.trim();
    }

    @JsonCreator
    public static ReferenceEntry create(
        @JsonProperty("id") String id,
        @JsonProperty("number") int number,
        @JsonProperty("authors") List<String> authors,
        @JsonProperty("year") String year
    ) {
        return new ReferenceEntry(id, number, authors, year);
    }

    /**
     * Creates an entry that only carries a number, as used for purely numeric reference lists.
     */
    public static ReferenceEntry numbered(int number) {
        return new ReferenceEntry("ref-" + number, number, List.of(), "");
    }
}
