package com.eainde.xrf.job;

import com.eainde.xrf.model.AreaType;
import com.eainde.xrf.parse.ParseError;
import com.eainde.xrf.parse.ParseMetadata;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parse outcome of a single uploaded file, kept alongside the job summary.
 */
public record FileParseReport(
        @JsonProperty("fileName")  String fileName,
        @JsonProperty("areaType")  AreaType areaType,
        @JsonProperty("metadata")  ParseMetadata metadata,
        @JsonProperty("warnings")  List<String> warnings,
        @JsonProperty("errors")    List<ParseError> errors
) {

    public FileParseReport {
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
    }
}
