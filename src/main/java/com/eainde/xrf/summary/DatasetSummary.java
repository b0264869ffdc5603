package com.eainde.xrf.summary;

import com.eainde.xrf.model.AreaType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Classification of every reading of one area type. The three lists are disjoint and each
 * is sorted by component, then substrate.
 */
public record DatasetSummary(
        @JsonProperty("datasetType")          AreaType datasetType,
        @JsonProperty("totalReadings")        int totalReadings,
        @JsonProperty("totalPositive")        int totalPositive,
        @JsonProperty("totalNegative")        int totalNegative,
        @JsonProperty("uniqueComponents")     int uniqueComponents,
        @JsonProperty("averageComponents")    List<AverageComponentSummary> averageComponents,
        @JsonProperty("uniformComponents")    List<UniformComponentSummary> uniformComponents,
        @JsonProperty("nonUniformComponents") List<NonUniformComponentSummary> nonUniformComponents
) {

    public DatasetSummary {
        averageComponents = averageComponents == null ? List.of() : List.copyOf(averageComponents);
        uniformComponents = uniformComponents == null ? List.of() : List.copyOf(uniformComponents);
        nonUniformComponents = nonUniformComponents == null ? List.of() : List.copyOf(nonUniformComponents);
    }

    public static DatasetSummary empty(AreaType datasetType) {
        return new DatasetSummary(datasetType, 0, 0, 0, 0, List.of(), List.of(), List.of());
    }
}
