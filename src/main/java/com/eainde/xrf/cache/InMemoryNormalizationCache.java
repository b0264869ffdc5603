package com.eainde.xrf.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cache store. Entries live as long as the application.
 */
@Slf4j
public class InMemoryNormalizationCache implements NormalizationCacheStore {

    private final Map<String, CachedMapping> storage = new ConcurrentHashMap<>();
    private final int chunkSize;
    private final Clock clock;

    public InMemoryNormalizationCache(int chunkSize) {
        this(chunkSize, Clock.systemUTC());
    }

    InMemoryNormalizationCache(int chunkSize, Clock clock) {
        this.chunkSize = Math.max(1, chunkSize);
        this.clock = clock;
    }

    @Override
    public Map<String, CachedMapping> getCachedMappings(Collection<String> names) {
        Map<String, CachedMapping> hits = new LinkedHashMap<>();
        for (String name : names) {
            String key = NormalizationCacheStore.key(name);
            CachedMapping mapping = storage.get(key);
            if (mapping != null) hits.put(key, mapping);
        }
        return hits;
    }

    @Override
    public void updateCache(List<CacheMappingUpdate> mappings) {
        int written = 0;
        for (CacheMappingUpdate update : mappings) {
            String key = NormalizationCacheStore.key(update.originalName());
            if (key.isEmpty()) continue;
            storage.compute(key, (k, existing) -> new CachedMapping(
                    update.normalizedName(),
                    update.confidence(),
                    update.source(),
                    existing == null ? 1 : existing.usageCount() + 1,
                    clock.instant()));
            if (++written % chunkSize == 0) {
                Thread.yield();
            }
        }
        log.debug("Cached {} normalization(s), {} entries total", written, storage.size());
    }

    public int size() {
        return storage.size();
    }
}
