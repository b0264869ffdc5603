package com.eainde.xrf.parse;

/**
 * Receives parse progress. Called on the parsing thread.
 */
@FunctionalInterface
public interface ParseProgressListener {

    ParseProgressListener NONE = (processed, total, stage) -> { };

    void onProgress(int processed, int total, ParseStage stage);
}
