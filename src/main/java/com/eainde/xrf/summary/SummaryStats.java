package com.eainde.xrf.summary;

public record SummaryStats(
        int totalReadings,
        int totalPositive,
        int totalNegative,
        double positivePercent,
        int uniqueComponents,
        int averageComponentCount,
        int uniformComponentCount,
        int nonUniformComponentCount) {
}
