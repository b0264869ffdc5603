package com.eainde.xrf.hazard;

import java.util.List;

/**
 * Writes a hazard assessment for each positive component.
 */
public interface HazardAssessor {

    boolean isAvailable();

    /**
     * @return replies in input order; element {@code i} belongs to {@code components.get(i)}
     * @throws RuntimeException when the assessment call fails
     */
    List<AssessedHazard> assess(List<PositiveComponentInput> components);
}
