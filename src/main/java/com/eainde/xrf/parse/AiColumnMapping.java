package com.eainde.xrf.parse;

import java.util.List;
import java.util.Map;

/**
 * What an AI column mapper proposed, before validation against the real headers.
 *
 * @param assignments field key ("readingId", "leadContent", ...) to proposed column header
 * @param unmapped    headers the mapper could not place
 * @param confidence  overall confidence, 0..1
 */
public record AiColumnMapping(Map<String, String> assignments, List<String> unmapped, double confidence) {

    public AiColumnMapping {
        assignments = assignments == null ? Map.of() : Map.copyOf(assignments);
        unmapped = unmapped == null ? List.of() : List.copyOf(unmapped);
    }
}
