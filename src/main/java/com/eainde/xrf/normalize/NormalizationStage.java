package com.eainde.xrf.normalize;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NormalizationStage {
    CHECKING_CACHE("checking-cache"),
    CALLING_AI("calling-ai"),
    SAVING_CACHE("saving-cache"),
    COMPLETE("complete");

    private final String code;

    NormalizationStage(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
