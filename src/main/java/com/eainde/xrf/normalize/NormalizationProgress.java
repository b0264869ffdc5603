package com.eainde.xrf.normalize;

public record NormalizationProgress(NormalizationStage stage, int processed, int total, String message) {

    @FunctionalInterface
    public interface Listener {

        Listener NONE = progress -> { };

        void onProgress(NormalizationProgress progress);
    }
}
