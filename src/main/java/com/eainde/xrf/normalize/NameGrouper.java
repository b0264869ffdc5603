package com.eainde.xrf.normalize;

import java.util.List;

/**
 * Groups spelling variants of the same thing under one canonical name.
 */
public interface NameGrouper {

    boolean isAvailable();

    /**
     * @param names lowercased, trimmed, distinct names
     * @return groups; names not placed in any group are left to the caller
     * @throws RuntimeException when the grouping call fails
     */
    List<NormalizationGroup> group(List<String> names);
}
