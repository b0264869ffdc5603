package com.eainde.xrf.hazard;

import com.eainde.xrf.model.AreaType;
import com.eainde.xrf.summary.ClassificationType;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A group with positive findings, as handed to the hazard assessor.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PositiveComponentInput(
        String component,
        String substrate,
        AreaType areaType,
        int totalReadings,
        int positiveCount,
        ClassificationType classificationType) {
}
