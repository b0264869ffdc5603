package com.eainde.xrf.cache;

import com.eainde.xrf.exception.XrfProcessingException;
import com.eainde.xrf.normalize.NormalizationKind;
import com.eainde.xrf.normalize.NormalizationSource;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cache store over plain JDBC, one table per {@link NormalizationKind}
 * ({@code xrf_component_cache}, {@code xrf_substrate_cache}; see {@code schema.sql}).
 *
 * <p>Lookups go out as {@code IN (...)} queries of at most {@code lookupBatchSize} names.
 * Upserts are one {@code MERGE} per row, so a row written by another session in the meantime
 * is updated rather than inserted twice.</p>
 */
@Slf4j
public class JdbcNormalizationCache implements NormalizationCacheStore {

    private final DataSource dataSource;
    private final String table;
    private final int lookupBatchSize;
    private final int chunkSize;
    private final Clock clock;

    public JdbcNormalizationCache(DataSource dataSource, NormalizationKind kind, int lookupBatchSize, int chunkSize) {
        this(dataSource, kind, lookupBatchSize, chunkSize, Clock.systemUTC());
    }

    JdbcNormalizationCache(DataSource dataSource, NormalizationKind kind, int lookupBatchSize, int chunkSize,
                           Clock clock) {
        this.dataSource = dataSource;
        this.table = tableName(kind);
        this.lookupBatchSize = Math.max(1, lookupBatchSize);
        this.chunkSize = Math.max(1, chunkSize);
        this.clock = clock;
    }

    static String tableName(NormalizationKind kind) {
        return "xrf_" + kind.label() + "_cache";
    }

    @Override
    public Map<String, CachedMapping> getCachedMappings(Collection<String> names) {
        Set<String> keys = new LinkedHashSet<>();
        names.forEach(n -> {
            String key = NormalizationCacheStore.key(n);
            if (!key.isEmpty()) keys.add(key);
        });

        Map<String, CachedMapping> hits = new LinkedHashMap<>();
        List<String> all = new ArrayList<>(keys);
        for (int start = 0; start < all.size(); start += lookupBatchSize) {
            List<String> batch = all.subList(start, Math.min(start + lookupBatchSize, all.size()));
            hits.putAll(lookup(batch));
        }
        return hits;
    }

    private Map<String, CachedMapping> lookup(List<String> keys) {
        String placeholders = String.join(", ", Collections.nCopies(keys.size(), "?"));
        String sql = "SELECT original_name, normalized_name, confidence, source, usage_count, last_used"
                + " FROM " + table + " WHERE original_name IN (" + placeholders + ")";

        Map<String, CachedMapping> hits = new LinkedHashMap<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            for (int i = 0; i < keys.size(); i++) {
                ps.setString(i + 1, keys.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    hits.put(rs.getString("original_name"), mapRow(rs));
                }
            }
            return hits;
        } catch (SQLException e) {
            throw new XrfProcessingException("Failed to read " + table, e);
        }
    }

    @Override
    public void updateCache(List<CacheMappingUpdate> mappings) {
        String sql = """
            MERGE INTO %s tgt
            USING (SELECT CAST(? AS VARCHAR(255)) AS original_name,
                          CAST(? AS VARCHAR(255)) AS normalized_name,
                          CAST(? AS DOUBLE PRECISION) AS confidence,
                          CAST(? AS VARCHAR(16)) AS source,
                          CAST(? AS TIMESTAMP) AS last_used) src
            ON (tgt.original_name = src.original_name)
            WHEN MATCHED THEN
                UPDATE SET normalized_name = src.normalized_name, confidence = src.confidence,
                           source = src.source, usage_count = tgt.usage_count + 1, last_used = src.last_used
            WHEN NOT MATCHED THEN
                INSERT (original_name, normalized_name, confidence, source, usage_count, last_used)
                VALUES (src.original_name, src.normalized_name, src.confidence, src.source, 1, src.last_used)
            """.formatted(table);

        int written = 0;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            for (CacheMappingUpdate mapping : mappings) {
                String key = NormalizationCacheStore.key(mapping.originalName());
                if (key.isEmpty()) continue;

                ps.setString(1, key);
                ps.setString(2, mapping.normalizedName());
                ps.setDouble(3, mapping.confidence());
                ps.setString(4, mapping.source().name());
                ps.setTimestamp(5, Timestamp.from(clock.instant()));
                ps.executeUpdate();

                if (++written % chunkSize == 0) {
                    Thread.yield();
                }
            }
            log.debug("Merged {} row(s) into {}", written, table);
        } catch (SQLException e) {
            throw new XrfProcessingException("Failed to update " + table, e);
        }
    }

    private static CachedMapping mapRow(ResultSet rs) throws SQLException {
        Timestamp lastUsed = rs.getTimestamp("last_used");
        return new CachedMapping(
                rs.getString("normalized_name"),
                rs.getDouble("confidence"),
                NormalizationSource.valueOf(rs.getString("source")),
                rs.getLong("usage_count"),
                lastUsed != null ? lastUsed.toInstant() : null);
    }
}
