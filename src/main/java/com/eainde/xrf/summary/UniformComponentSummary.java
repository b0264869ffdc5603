package com.eainde.xrf.summary;

import com.eainde.xrf.model.Verdict;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A small group whose readings all agree.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UniformComponentSummary(
        @JsonProperty("component")     String component,
        @JsonProperty("substrate")     String substrate,
        @JsonProperty("totalReadings") int totalReadings,
        @JsonProperty("result")        Verdict result
) implements ComponentSummary {

    @Override
    @JsonIgnore
    public ClassificationType classificationType() {
        return ClassificationType.UNIFORM;
    }
}
