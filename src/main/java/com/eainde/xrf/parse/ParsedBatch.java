package com.eainde.xrf.parse;

import com.eainde.xrf.model.Reading;

import java.util.List;

/**
 * Readings of one sheet together with the rows that failed and what was skipped.
 */
public record ParsedBatch(List<Reading> readings, List<ParseError> errors, List<String> warnings,
                          ParseMetadata metadata) {

    public ParsedBatch {
        readings = List.copyOf(readings);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /** True when every data row was accounted for as a reading, an error or a skip. */
    public boolean isBalanced() {
        return readings.size() + errors.size() + metadata.skippedCalibration() + metadata.skippedJunk()
                == metadata.totalRows();
    }
}
