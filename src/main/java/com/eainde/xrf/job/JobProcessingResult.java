package com.eainde.xrf.job;

import com.eainde.xrf.summary.JobSummary;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of processing one job. {@code summary} is {@code null} when a file could not be parsed;
 * {@code files} then tells which one and why.
 */
public record JobProcessingResult(JobSummary summary, List<FileParseReport> files) {

    public JobProcessingResult {
        files = List.copyOf(files);
    }

    public boolean isSuccess() {
        return summary != null;
    }

    public List<String> warnings() {
        List<String> warnings = new ArrayList<>();
        files.forEach(f -> f.warnings().forEach(w -> warnings.add(f.fileName() + ": " + w)));
        return warnings;
    }

    public List<String> errors() {
        List<String> errors = new ArrayList<>();
        files.forEach(f -> f.errors().forEach(e -> errors.add(
                f.fileName() + (e.row() > 0 ? " row " + e.row() : "") + ": " + e.message())));
        return errors;
    }
}
