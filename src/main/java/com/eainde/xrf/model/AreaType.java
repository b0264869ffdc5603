package com.eainde.xrf.model;

/**
 * The two kinds of inspected area a dataset can belong to.
 */
public enum AreaType {
    COMMON_AREA("common-areas"),
    UNITS("units");

    private final String fileSlug;

    AreaType(String fileSlug) {
        this.fileSlug = fileSlug;
    }

    public String fileSlug() {
        return fileSlug;
    }
}
