package com.eainde.xrf.model;

public enum Verdict {
    POSITIVE,
    NEGATIVE;

    public static Verdict of(boolean positive) {
        return positive ? POSITIVE : NEGATIVE;
    }
}
