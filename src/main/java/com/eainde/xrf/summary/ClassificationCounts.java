package com.eainde.xrf.summary;

public record ClassificationCounts(
        int averagePositive,
        int averageNegative,
        int uniformPositive,
        int uniformNegative,
        int nonUniformCount) {
}
