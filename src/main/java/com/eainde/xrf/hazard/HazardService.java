package com.eainde.xrf.hazard;

import com.eainde.xrf.model.AreaType;
import com.eainde.xrf.model.Verdict;
import com.eainde.xrf.summary.ClassificationType;
import com.eainde.xrf.summary.DatasetSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns positive classification results into report hazards.
 *
 * <p>Hazards are optional output: with no assessor, or when the assessor fails, the
 * result is an empty list and the job still completes.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HazardService {

    static final String DEFAULT_ABATE_CODE = "d";
    static final String DEFAULT_IC_CODE = "5";
    static final String DEFAULT_SEVERITY = "Moderate";
    static final String DEFAULT_PRIORITY = "Schedule";

    private final HazardAssessor hazardAssessor;
    private final HazardReference hazardReference;

    /**
     * Positive average and uniform groups plus every non-uniform group, common areas first.
     * Either summary may be {@code null}.
     */
    public List<PositiveComponentInput> collectPositiveComponents(DatasetSummary commonArea, DatasetSummary units) {
        List<PositiveComponentInput> items = new ArrayList<>();
        if (commonArea != null) collect(commonArea, AreaType.COMMON_AREA, items);
        if (units != null) collect(units, AreaType.UNITS, items);
        return items;
    }

    private static void collect(DatasetSummary summary, AreaType areaType, List<PositiveComponentInput> items) {
        summary.averageComponents().stream()
                .filter(c -> c.result() == Verdict.POSITIVE)
                .forEach(c -> items.add(new PositiveComponentInput(c.component(), c.substrate(), areaType,
                        c.totalReadings(), c.positiveCount(), ClassificationType.AVERAGE)));
        summary.uniformComponents().stream()
                .filter(c -> c.result() == Verdict.POSITIVE)
                .forEach(c -> items.add(new PositiveComponentInput(c.component(), c.substrate(), areaType,
                        c.totalReadings(), c.totalReadings(), ClassificationType.UNIFORM)));
        summary.nonUniformComponents()
                .forEach(c -> items.add(new PositiveComponentInput(c.component(), c.substrate(), areaType,
                        c.totalReadings(), c.positiveCount(), ClassificationType.NON_UNIFORM)));
    }

    public boolean isAvailable() {
        return hazardAssessor != null && hazardAssessor.isAvailable();
    }

    public List<LeadPaintHazard> generateHazards(List<PositiveComponentInput> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            return List.of();
        }
        if (!isAvailable()) {
            log.warn("Hazard assessor not configured, skipping hazard generation");
            return List.of();
        }

        try {
            List<AssessedHazard> replies = hazardAssessor.assess(inputs);
            List<LeadPaintHazard> hazards = new ArrayList<>();
            for (int i = 0; i < replies.size() && i < inputs.size(); i++) {
                AssessedHazard reply = replies.get(i);
                if (reply == null || isBlank(reply.hazardDescription())) continue;
                hazards.add(toHazard(reply, inputs.get(i)));
            }
            log.info("Generated {} hazard(s) for {} positive component(s)", hazards.size(), inputs.size());
            return hazards;
        } catch (RuntimeException e) {
            log.error("Hazard assessment failed", e);
            return List.of();
        }
    }

    private LeadPaintHazard toHazard(AssessedHazard reply, PositiveComponentInput input) {
        String abateCode = orDefault(reply.abateCode(), DEFAULT_ABATE_CODE).toLowerCase(Locale.ROOT);
        String icCode = orDefault(reply.icCode(), DEFAULT_IC_CODE);
        return new LeadPaintHazard(
                reply.hazardDescription(),
                orDefault(reply.severity(), DEFAULT_SEVERITY),
                orDefault(reply.priority(), DEFAULT_PRIORITY),
                abateCode,
                icCode,
                hazardReference.abatementText(abateCode),
                hazardReference.interimControlText(icCode),
                input.component(),
                input.substrate(),
                input.areaType());
    }

    private static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
