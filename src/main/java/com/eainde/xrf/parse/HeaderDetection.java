package com.eainde.xrf.parse;

import java.util.List;

/**
 * Where the header row was found and what it says.
 *
 * @param headerRowIndex 0-based index of the header row in the grid
 * @param headers        trimmed header texts, "" for empty cells
 * @param matchCount     number of key-field aliases the row matched
 * @param warnings       human-readable notes about the detection
 */
public record HeaderDetection(int headerRowIndex, List<String> headers, int matchCount, List<String> warnings) {

    public HeaderDetection {
        headers = List.copyOf(headers);
        warnings = List.copyOf(warnings);
    }
}
