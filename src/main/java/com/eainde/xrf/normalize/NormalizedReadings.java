package com.eainde.xrf.normalize;

import com.eainde.xrf.model.Reading;

import java.util.List;

/**
 * Readings with their normalized field filled in.
 *
 * @param aiNormalizations number of entries produced by the grouping service in this run
 */
public record NormalizedReadings(List<Reading> readings, int aiNormalizations) {

    public NormalizedReadings {
        readings = List.copyOf(readings);
    }
}
