package com.eainde.xrf.normalize;

/**
 * Which free-text label a normalizer works on.
 */
public enum NormalizationKind {
    COMPONENT("component"),
    SUBSTRATE("substrate");

    private final String label;

    NormalizationKind(String label) {
        this.label = label;
    }

    /** Lowercase singular noun, used in log and progress messages. */
    public String label() {
        return label;
    }
}
