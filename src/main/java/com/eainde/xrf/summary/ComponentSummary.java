package com.eainde.xrf.summary;

/**
 * Common view of the three per-group summary shapes.
 */
public interface ComponentSummary {

    String component();

    /** {@code null} when the group has no substrate. */
    String substrate();

    int totalReadings();

    ClassificationType classificationType();
}
