package com.eainde.xrf.summary;

import com.eainde.xrf.model.Verdict;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A group large enough for statistical sampling. {@code result} is POSITIVE when more than
 * 2.5% of the readings are positive.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AverageComponentSummary(
        @JsonProperty("component")       String component,
        @JsonProperty("substrate")       String substrate,
        @JsonProperty("totalReadings")   int totalReadings,
        @JsonProperty("positiveCount")   int positiveCount,
        @JsonProperty("negativeCount")   int negativeCount,
        @JsonProperty("positivePercent") double positivePercent,
        @JsonProperty("negativePercent") double negativePercent,
        @JsonProperty("result")          Verdict result
) implements ComponentSummary {

    @Override
    @JsonIgnore
    public ClassificationType classificationType() {
        return ClassificationType.AVERAGE;
    }
}
