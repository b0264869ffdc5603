package com.eainde.xrf.parse;

import com.eainde.xrf.model.ColumnMapping;

import java.util.List;

/**
 * A validated column mapping and how it was obtained.
 */
public record ColumnMappingResult(
        ColumnMapping mapping,
        List<String> unmappedColumns,
        boolean usedAiMapping,
        Double aiMappingConfidence,
        List<String> warnings) {

    public ColumnMappingResult {
        unmappedColumns = List.copyOf(unmappedColumns);
        warnings = List.copyOf(warnings);
    }
}
