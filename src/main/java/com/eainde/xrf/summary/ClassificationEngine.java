package com.eainde.xrf.summary;

import com.eainde.xrf.model.AreaType;
import com.eainde.xrf.model.Reading;
import com.eainde.xrf.model.Verdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HUD/EPA classification of readings grouped by (component, substrate).
 *
 * <ul>
 *   <li>{@value #STATISTICAL_SAMPLE_SIZE} or more readings: average, POSITIVE when more than
 *       {@value #POSITIVE_PERCENT_THRESHOLD}% are positive</li>
 *   <li>fewer, all with the same result: uniform</li>
 *   <li>fewer, mixed: non-uniform, with every reading kept</li>
 * </ul>
 */
@Slf4j
@Component
public class ClassificationEngine {

    public static final int STATISTICAL_SAMPLE_SIZE = 40;
    public static final double POSITIVE_PERCENT_THRESHOLD = 2.5;

    static final Comparator<ComponentSummary> BY_COMPONENT_THEN_SUBSTRATE =
            Comparator.comparing(ComponentSummary::component)
                    .thenComparing(s -> s.substrate() == null ? "" : s.substrate());

    public DatasetSummary classifyDataset(List<Reading> readings, AreaType datasetType) {
        if (readings == null || readings.isEmpty()) {
            return DatasetSummary.empty(datasetType);
        }

        Map<GroupKey, List<Reading>> groups = new LinkedHashMap<>();
        for (Reading reading : readings) {
            GroupKey key = new GroupKey(reading.effectiveComponent(), reading.effectiveSubstrate());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(reading);
        }

        List<AverageComponentSummary> average = new ArrayList<>();
        List<UniformComponentSummary> uniform = new ArrayList<>();
        List<NonUniformComponentSummary> nonUniform = new ArrayList<>();

        groups.forEach((key, members) -> {
            ComponentSummary summary = classifyGroup(key.component(), key.substrate(), members);
            if (summary instanceof AverageComponentSummary a) {
                average.add(a);
            } else if (summary instanceof UniformComponentSummary u) {
                uniform.add(u);
            } else if (summary instanceof NonUniformComponentSummary n) {
                nonUniform.add(n);
            }
        });

        average.sort(BY_COMPONENT_THEN_SUBSTRATE);
        uniform.sort(BY_COMPONENT_THEN_SUBSTRATE);
        nonUniform.sort(BY_COMPONENT_THEN_SUBSTRATE);

        int totalPositive = (int) readings.stream().filter(Reading::isPositive).count();
        log.debug("{}: {} readings in {} groups ({} average, {} uniform, {} non-uniform)", datasetType,
                readings.size(), groups.size(), average.size(), uniform.size(), nonUniform.size());

        return new DatasetSummary(
                datasetType,
                readings.size(),
                totalPositive,
                readings.size() - totalPositive,
                groups.size(),
                average,
                uniform,
                nonUniform);
    }

    /**
     * Classifies one group. {@code readings} must not be empty.
     */
    public ComponentSummary classifyGroup(String component, String substrate, List<Reading> readings) {
        int total = readings.size();
        int positive = (int) readings.stream().filter(Reading::isPositive).count();
        int negative = total - positive;

        if (total >= STATISTICAL_SAMPLE_SIZE) {
            return new AverageComponentSummary(component, substrate, total, positive, negative,
                    percent(positive, total), percent(negative, total),
                    Verdict.of(exceedsPositiveThreshold(positive, total)));
        }
        if (positive == 0 || negative == 0) {
            return new UniformComponentSummary(component, substrate, total, Verdict.of(positive > 0));
        }
        return new NonUniformComponentSummary(component, substrate, total, positive, negative,
                percent(positive, total), percent(negative, total), readings);
    }

    /** positive / total > 2.5%, evaluated exactly. */
    static boolean exceedsPositiveThreshold(int positive, int total) {
        return BigDecimal.valueOf(positive).multiply(BigDecimal.valueOf(100))
                .compareTo(BigDecimal.valueOf(POSITIVE_PERCENT_THRESHOLD).multiply(BigDecimal.valueOf(total))) > 0;
    }

    /** count / total as a percentage, half-up to one decimal. */
    static double percent(int count, int total) {
        if (total == 0) return 0.0;
        return BigDecimal.valueOf(count)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(total), 1, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private record GroupKey(String component, String substrate) {}
}
