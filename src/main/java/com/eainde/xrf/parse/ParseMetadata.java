package com.eainde.xrf.parse;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Counters and mapping details describing one parsed sheet.
 *
 * <p>{@code totalRows} counts the non-empty rows below the header; calibration and junk rows
 * are part of {@code skippedRows}.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParseMetadata(
        int totalRows,
        int validRows,
        int skippedRows,
        String sheetName,
        Map<String, String> detectedColumns,
        List<String> unmappedColumns,
        boolean usedAiMapping,
        Double aiMappingConfidence,
        int skippedCalibration,
        int skippedJunk,
        Map<JunkReason, Integer> skippedJunkReasons,
        List<SkippedJunkRow> skippedJunkRows) {

    public ParseMetadata {
        detectedColumns = detectedColumns == null ? Map.of() : Map.copyOf(detectedColumns);
        unmappedColumns = unmappedColumns == null ? List.of() : List.copyOf(unmappedColumns);
        skippedJunkReasons = skippedJunkReasons == null ? Map.of() : Map.copyOf(skippedJunkReasons);
        skippedJunkRows = skippedJunkRows == null ? List.of() : List.copyOf(skippedJunkRows);
    }

    public static ParseMetadata empty(String sheetName) {
        return new ParseMetadata(0, 0, 0, sheetName, Map.of(), List.of(), false, null,
                0, 0, Map.of(), List.of());
    }

    public int junkCount(JunkReason reason) {
        return skippedJunkReasons.getOrDefault(reason, 0);
    }
}
