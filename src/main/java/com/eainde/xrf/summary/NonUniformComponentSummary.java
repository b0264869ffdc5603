package com.eainde.xrf.summary;

import com.eainde.xrf.model.Reading;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A small group with mixed results. Carries every reading so the report can list
 * locations individually.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NonUniformComponentSummary(
        @JsonProperty("component")       String component,
        @JsonProperty("substrate")       String substrate,
        @JsonProperty("totalReadings")   int totalReadings,
        @JsonProperty("positiveCount")   int positiveCount,
        @JsonProperty("negativeCount")   int negativeCount,
        @JsonProperty("positivePercent") double positivePercent,
        @JsonProperty("negativePercent") double negativePercent,
        @JsonProperty("readings")        List<Reading> readings
) implements ComponentSummary {

    public NonUniformComponentSummary {
        readings = readings == null ? List.of() : List.copyOf(readings);
    }

    @Override
    @JsonIgnore
    public ClassificationType classificationType() {
        return ClassificationType.NON_UNIFORM;
    }
}
