package com.eainde.xrf.parse;

public enum ParseStage {
    AI_MAPPING,
    PARSING
}
