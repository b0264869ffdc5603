package com.eainde.xrf.parse;

import java.util.List;
import java.util.Map;

/**
 * Maps unfamiliar header layouts to canonical fields when the alias table cannot.
 */
public interface AiColumnMapper {

    /** False when no model is configured; callers then skip the mapper entirely. */
    boolean isAvailable();

    /**
     * @param headers    every header of the sheet, as spelled in the file
     * @param sampleRows a few data rows keyed by header, to show what the columns contain
     * @throws RuntimeException when the model call or its reply fails
     */
    AiColumnMapping mapColumns(List<String> headers, List<Map<String, Object>> sampleRows);
}
