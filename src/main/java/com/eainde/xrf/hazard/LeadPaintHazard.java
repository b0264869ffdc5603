package com.eainde.xrf.hazard;

import com.eainde.xrf.model.AreaType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A hazard entry for the inspection report, with abatement and interim control codes
 * expanded to their full text.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LeadPaintHazard(
        @JsonProperty("hazardDescription")     String hazardDescription,
        @JsonProperty("severity")              String severity,
        @JsonProperty("priority")              String priority,
        @JsonProperty("abateCode")             String abateCode,
        @JsonProperty("icCode")                String icCode,
        @JsonProperty("abatementOptions")      String abatementOptions,
        @JsonProperty("interimControlOptions") String interimControlOptions,
        @JsonProperty("component")             String component,
        @JsonProperty("substrate")             String substrate,
        @JsonProperty("areaType")              AreaType areaType) {
}
