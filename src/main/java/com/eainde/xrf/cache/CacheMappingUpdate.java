package com.eainde.xrf.cache;

import com.eainde.xrf.normalize.NormalizationEntry;
import com.eainde.xrf.normalize.NormalizationSource;

/**
 * A normalization to upsert. {@code originalName} is lowercased by the store.
 */
public record CacheMappingUpdate(String originalName, String normalizedName, double confidence,
                                 NormalizationSource source) {

    public static CacheMappingUpdate of(NormalizationEntry entry) {
        return new CacheMappingUpdate(entry.originalName(), entry.normalizedName(), entry.confidence(), entry.source());
    }
}
