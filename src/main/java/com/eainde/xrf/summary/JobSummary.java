package com.eainde.xrf.summary;

import com.eainde.xrf.hazard.LeadPaintHazard;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * The persisted result of one job: both dataset summaries plus audit fields.
 *
 * @param aiNormalizationsApplied number of names normalized by the grouping service
 * @param hazards                 present only when hazard assessment ran
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSummary(
        @JsonProperty("jobNumber")               String jobNumber,
        @JsonProperty("processedDate")           Instant processedDate,
        @JsonProperty("sourceFileName")          String sourceFileName,
        @JsonProperty("aiNormalizationsApplied") int aiNormalizationsApplied,
        @JsonProperty("commonAreaSummary")       DatasetSummary commonAreaSummary,
        @JsonProperty("unitsSummary")            DatasetSummary unitsSummary,
        @JsonProperty("hazards")                 List<LeadPaintHazard> hazards
) {

    public JobSummary {
        hazards = hazards == null ? null : List.copyOf(hazards);
    }

    public JobSummary withHazards(List<LeadPaintHazard> hazards) {
        return new JobSummary(jobNumber, processedDate, sourceFileName, aiNormalizationsApplied,
                commonAreaSummary, unitsSummary, hazards);
    }
}
