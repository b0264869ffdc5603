package com.eainde.xrf.normalize;

import com.eainde.xrf.cache.CacheMappingUpdate;
import com.eainde.xrf.cache.CachedMapping;
import com.eainde.xrf.cache.NormalizationCacheStore;
import com.eainde.xrf.model.Reading;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps free-text component or substrate labels to canonical names.
 *
 * <ol>
 *   <li>lowercase, trim and de-duplicate the names, dropping empty ones</li>
 *   <li>look them up in the cache, {@code filterBatchSize} names per query</li>
 *   <li>send the misses to the {@link NameGrouper} in a single call; names it does not
 *       place get their own title-cased form with confidence 1.0</li>
 *   <li>if that call fails (or no grouper is available) every miss gets its title-cased
 *       form with confidence {@value #FALLBACK_CONFIDENCE}</li>
 *   <li>write every new entry back to the cache; a failed write is logged and ignored</li>
 * </ol>
 *
 * The two instances in the application differ only in kind, cache store and grouper.
 */
@Slf4j
public class NameNormalizer {

    static final double UNGROUPED_CONFIDENCE = 1.0;
    static final double FALLBACK_CONFIDENCE = 0.5;

    private final NormalizationKind kind;
    private final NormalizationCacheStore cache;
    private final NameGrouper grouper;
    private final int filterBatchSize;

    public NameNormalizer(NormalizationKind kind, NormalizationCacheStore cache, NameGrouper grouper,
                          int filterBatchSize) {
        if (filterBatchSize < 1) {
            throw new IllegalArgumentException("filterBatchSize must be positive: " + filterBatchSize);
        }
        this.kind = kind;
        this.cache = cache;
        this.grouper = grouper;
        this.filterBatchSize = filterBatchSize;
    }

    public NormalizationKind kind() {
        return kind;
    }

    public List<NormalizationEntry> normalize(List<String> names) {
        return normalize(names, NormalizationProgress.Listener.NONE);
    }

    /**
     * @return one entry per distinct lowercased name: cache hits first, then new entries
     */
    public List<NormalizationEntry> normalize(List<String> names, NormalizationProgress.Listener progress) {
        List<String> unique = distinctNames(names);
        if (unique.isEmpty()) {
            return List.of();
        }
        int total = unique.size();
        List<NormalizationEntry> results = new ArrayList<>(total);

        report(progress, NormalizationStage.CHECKING_CACHE, 0, total, null);
        Map<String, CachedMapping> cached = lookupCache(unique);

        List<String> uncached = new ArrayList<>();
        for (String name : unique) {
            CachedMapping hit = cached.get(name);
            if (hit != null) {
                results.add(new NormalizationEntry(name, hit.normalizedName(), hit.confidence(), NormalizationSource.CACHE));
            } else {
                uncached.add(name);
            }
        }
        report(progress, NormalizationStage.CHECKING_CACHE, results.size(), total,
                "Found " + results.size() + " cached mappings");

        if (!uncached.isEmpty()) {
            report(progress, NormalizationStage.CALLING_AI, results.size(), total,
                    "Normalizing " + uncached.size() + " new " + kind.label() + "s...");
            results.addAll(groupUncached(uncached));
        }

        List<NormalizationEntry> fresh = results.stream()
                .filter(e -> e.source() == NormalizationSource.AI)
                .toList();
        if (!fresh.isEmpty()) {
            report(progress, NormalizationStage.SAVING_CACHE, results.size(), total,
                    "Caching " + fresh.size() + " new mappings...");
            saveToCache(fresh);
        }

        report(progress, NormalizationStage.COMPLETE, total, total,
                "Normalized " + total + " " + kind.label() + "s");
        log.info("Normalized {} {} name(s): {} from cache, {} new", total, kind.label(),
                total - fresh.size(), fresh.size());
        return results;
    }

    public NormalizedReadings normalizeReadings(List<Reading> readings) {
        return normalizeReadings(readings, NormalizationProgress.Listener.NONE);
    }

    /**
     * Normalizes the labels found in {@code readings} and returns copies with the
     * normalized field set. A reading without a substrate keeps it absent.
     */
    public NormalizedReadings normalizeReadings(List<Reading> readings, NormalizationProgress.Listener progress) {
        List<String> names = new ArrayList<>();
        for (Reading reading : readings) {
            String raw = rawName(reading);
            if (raw != null) names.add(raw);
        }
        if (distinctNames(names).isEmpty()) {
            return new NormalizedReadings(readings, 0);
        }

        List<NormalizationEntry> entries = normalize(names, progress);
        Map<String, String> lookup = new HashMap<>();
        entries.forEach(e -> lookup.put(e.originalName(), e.normalizedName()));

        List<Reading> updated = new ArrayList<>(readings.size());
        for (Reading reading : readings) {
            String raw = rawName(reading);
            if (raw == null) {
                updated.add(reading);
                continue;
            }
            String normalized = lookup.getOrDefault(fold(raw), raw);
            updated.add(kind == NormalizationKind.COMPONENT
                    ? reading.withNormalizedComponent(normalized)
                    : reading.withNormalizedSubstrate(normalized));
        }

        int aiCount = (int) entries.stream().filter(e -> e.source() == NormalizationSource.AI).count();
        return new NormalizedReadings(updated, aiCount);
    }

    private String rawName(Reading reading) {
        String raw = kind == NormalizationKind.COMPONENT ? reading.component() : reading.substrate();
        return raw == null || raw.isBlank() ? null : raw;
    }

    private Map<String, CachedMapping> lookupCache(List<String> names) {
        Map<String, CachedMapping> hits = new HashMap<>();
        for (int start = 0; start < names.size(); start += filterBatchSize) {
            List<String> batch = names.subList(start, Math.min(start + filterBatchSize, names.size()));
            try {
                hits.putAll(cache.getCachedMappings(batch));
                log.debug("Checked {} {} name(s) against cache", batch.size(), kind.label());
            } catch (RuntimeException e) {
                log.warn("{} cache lookup failed, treating {} name(s) as uncached", kind.label(), batch.size(), e);
            }
        }
        return hits;
    }

    private List<NormalizationEntry> groupUncached(List<String> uncached) {
        List<NormalizationEntry> entries = new ArrayList<>(uncached.size());
        if (grouper == null || !grouper.isAvailable()) {
            log.warn("No {} grouping service available, title-casing {} name(s)", kind.label(), uncached.size());
            return fallback(uncached);
        }
        try {
            List<NormalizationGroup> groups = grouper.group(uncached);

            Set<String> pending = new HashSet<>(uncached);
            Set<String> claimed = new HashSet<>();
            for (NormalizationGroup group : groups) {
                for (String variant : group.variants()) {
                    String name = fold(variant);
                    if (pending.contains(name) && claimed.add(name)) {
                        entries.add(new NormalizationEntry(name, group.canonical(), group.confidence(),
                                NormalizationSource.AI));
                    }
                }
            }
            for (String name : uncached) {
                if (!claimed.contains(name)) {
                    entries.add(new NormalizationEntry(name, TitleCase.of(name), UNGROUPED_CONFIDENCE,
                            NormalizationSource.AI));
                }
            }
            return entries;
        } catch (RuntimeException e) {
            log.warn("{} grouping failed, title-casing {} name(s)", kind.label(), uncached.size(), e);
            return fallback(uncached);
        }
    }

    private static List<NormalizationEntry> fallback(List<String> names) {
        return names.stream()
                .map(name -> new NormalizationEntry(name, TitleCase.of(name), FALLBACK_CONFIDENCE,
                        NormalizationSource.AI))
                .toList();
    }

    private void saveToCache(List<NormalizationEntry> entries) {
        try {
            cache.updateCache(entries.stream().map(CacheMappingUpdate::of).toList());
        } catch (RuntimeException e) {
            log.error("Failed to save {} {} normalization(s) to cache", entries.size(), kind.label(), e);
        }
    }

    private static void report(NormalizationProgress.Listener listener, NormalizationStage stage,
                               int processed, int total, String message) {
        listener.onProgress(new NormalizationProgress(stage, processed, total,
                message != null ? message : stage.code() + ": " + processed + "/" + total));
    }

    private static List<String> distinctNames(List<String> names) {
        Set<String> unique = new LinkedHashSet<>();
        for (String name : names) {
            String folded = fold(name);
            if (!folded.isEmpty()) unique.add(folded);
        }
        return new ArrayList<>(unique);
    }

    private static String fold(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
