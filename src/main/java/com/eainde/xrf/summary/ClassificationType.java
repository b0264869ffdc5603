package com.eainde.xrf.summary;

public enum ClassificationType {
    AVERAGE,
    UNIFORM,
    NON_UNIFORM
}
