package com.eainde.xrf.summary;

import com.eainde.xrf.exception.XrfProcessingException;
import com.eainde.xrf.model.AreaType;
import com.eainde.xrf.model.Reading;
import com.eainde.xrf.model.Verdict;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds, serializes and names job summaries.
 */
@Slf4j
@Service
public class SummaryService {

    private final ClassificationEngine classificationEngine;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public SummaryService(ClassificationEngine classificationEngine, ObjectMapper objectMapper) {
        this(classificationEngine, objectMapper, Clock.systemUTC());
    }

    SummaryService(ClassificationEngine classificationEngine, ObjectMapper objectMapper, Clock clock) {
        this.classificationEngine = classificationEngine;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
    }

    /**
     * @param commonAreaReadings may be {@code null}; yields an empty common-area summary
     * @param unitReadings       may be {@code null}; yields an empty units summary
     */
    public JobSummary generateJobSummary(String jobNumber, String sourceFileName,
                                         List<Reading> commonAreaReadings, List<Reading> unitReadings,
                                         int aiNormalizationsApplied) {
        JobSummary summary = new JobSummary(
                jobNumber,
                clock.instant(),
                sourceFileName,
                aiNormalizationsApplied,
                classificationEngine.classifyDataset(commonAreaReadings, AreaType.COMMON_AREA),
                classificationEngine.classifyDataset(unitReadings, AreaType.UNITS),
                null);
        log.info("Job {} summarized: {} common-area and {} unit readings", jobNumber,
                summary.commonAreaSummary().totalReadings(), summary.unitsSummary().totalReadings());
        return summary;
    }

    public SummaryStats calculateStats(DatasetSummary summary) {
        return new SummaryStats(
                summary.totalReadings(),
                summary.totalPositive(),
                summary.totalNegative(),
                ClassificationEngine.percent(summary.totalPositive(), summary.totalReadings()),
                summary.uniqueComponents(),
                summary.averageComponents().size(),
                summary.uniformComponents().size(),
                summary.nonUniformComponents().size());
    }

    public ClassificationCounts classificationCounts(DatasetSummary summary) {
        return new ClassificationCounts(
                (int) summary.averageComponents().stream().filter(c -> c.result() == Verdict.POSITIVE).count(),
                (int) summary.averageComponents().stream().filter(c -> c.result() == Verdict.NEGATIVE).count(),
                (int) summary.uniformComponents().stream().filter(c -> c.result() == Verdict.POSITIVE).count(),
                (int) summary.uniformComponents().stream().filter(c -> c.result() == Verdict.NEGATIVE).count(),
                summary.nonUniformComponents().size());
    }

    /**
     * "Component (Substrate)" labels of every group with a positive finding, sorted.
     * Non-uniform groups count when at least one reading is positive.
     */
    public List<String> allPositiveComponents(DatasetSummary summary) {
        List<String> positives = new ArrayList<>();
        summary.averageComponents().stream()
                .filter(c -> c.result() == Verdict.POSITIVE)
                .forEach(c -> positives.add(label(c)));
        summary.uniformComponents().stream()
                .filter(c -> c.result() == Verdict.POSITIVE)
                .forEach(c -> positives.add(label(c)));
        summary.nonUniformComponents().stream()
                .filter(c -> c.positiveCount() > 0)
                .forEach(c -> positives.add(label(c)));
        positives.sort(null);
        return positives;
    }

    public String toJson(JobSummary summary) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new XrfProcessingException("Failed to serialize summary for job " + summary.jobNumber(), e);
        }
    }

    public JobSummary fromJson(String json) {
        try {
            return objectMapper.readValue(json, JobSummary.class);
        } catch (JsonProcessingException e) {
            throw new XrfProcessingException("Failed to read job summary: " + e.getOriginalMessage(), e);
        }
    }

    /** {@code <job>-<units|common-areas>-summary-<yyyy-MM-dd>.json} */
    public String summaryFileName(String jobNumber, AreaType areaType) {
        return jobNumber + "-" + areaType.fileSlug() + "-summary-" + today() + ".json";
    }

    /** {@code <job>-summary-<yyyy-MM-dd>.json} */
    public String combinedSummaryFileName(String jobNumber) {
        return jobNumber + "-summary-" + today() + ".json";
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private static String label(ComponentSummary summary) {
        return summary.substrate() != null
                ? summary.component() + " (" + summary.substrate() + ")"
                : summary.component();
    }
}
