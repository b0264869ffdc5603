package com.eainde.xrf.parse;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a row was skipped as not being a real shot. A missing reading id is not one of them.
 */
public enum JunkReason {
    NO_COMPONENT("noComponent"),
    NO_LEAD_CONTENT("noLeadContent");

    private final String code;

    JunkReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
