package com.eainde.xrf.normalize;

public enum NormalizationSource {
    CACHE,
    AI,
    MANUAL
}
