package com.eainde.xrf.hazard;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One assessor reply, before code expansion. Any field may be missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssessedHazard(
        @JsonProperty("hazardDescription") String hazardDescription,
        @JsonProperty("severity")          String severity,
        @JsonProperty("priority")          String priority,
        @JsonProperty("abateCode")         String abateCode,
        @JsonProperty("icCode")            String icCode) {
}
