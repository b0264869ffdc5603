package com.eainde.xrf.normalize;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One raw label and the canonical name it was mapped to.
 *
 * @param originalName   lowercased, trimmed raw label
 * @param normalizedName canonical display name
 * @param confidence     0..1
 * @param source         where the mapping came from
 */
public record NormalizationEntry(
        @JsonProperty("originalName") String originalName,
        @JsonProperty("normalizedName") String normalizedName,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("source") NormalizationSource source) {
}
