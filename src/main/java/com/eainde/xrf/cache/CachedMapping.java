package com.eainde.xrf.cache;

import com.eainde.xrf.normalize.NormalizationSource;

import java.time.Instant;

/**
 * A stored normalization, keyed externally by the lowercased original name.
 */
public record CachedMapping(
        String normalizedName,
        double confidence,
        NormalizationSource source,
        long usageCount,
        Instant lastUsed) {
}
