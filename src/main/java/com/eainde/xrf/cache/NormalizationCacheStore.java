package com.eainde.xrf.cache;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Persistent name → canonical name lookup shared across jobs.
 *
 * <p>Concurrent writers are tolerated; the last write for a name wins.</p>
 */
public interface NormalizationCacheStore {

    /**
     * @param names lowercased names to look up
     * @return hits only, keyed by lowercased name
     */
    Map<String, CachedMapping> getCachedMappings(Collection<String> names);

    /**
     * Upserts each mapping by lowercased original name, incrementing its usage counter
     * and refreshing its last-used time. Each upsert is atomic per name; concurrent writers
     * of the same name resolve last-write-wins.
     */
    void updateCache(List<CacheMappingUpdate> mappings);

    static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
