package com.eainde.xrf.normalize;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A canonical name and the raw spellings a grouping service put under it.
 */
public record NormalizationGroup(
        @JsonProperty("canonical") String canonical,
        @JsonProperty("variants") List<String> variants,
        @JsonProperty("confidence") double confidence) {

    public NormalizationGroup {
        variants = variants == null ? List.of() : List.copyOf(variants);
    }
}
