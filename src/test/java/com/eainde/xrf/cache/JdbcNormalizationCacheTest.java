package com.eainde.xrf.cache;

import com.eainde.xrf.exception.XrfProcessingException;
import com.eainde.xrf.normalize.NormalizationKind;
import com.eainde.xrf.normalize.NormalizationSource;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcNormalizationCacheTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private JdbcDataSource dataSource;
    private JdbcNormalizationCache cache;

    @BeforeEach
    void setUp() throws SQLException, IOException {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        runSchema(dataSource);
        cache = new JdbcNormalizationCache(dataSource, NormalizationKind.COMPONENT, 2, 10,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static void runSchema(JdbcDataSource dataSource) throws SQLException, IOException {
        String script;
        try (InputStream in = JdbcNormalizationCacheTest.class.getClassLoader().getResourceAsStream("schema.sql")) {
            assertThat(in).as("schema.sql on the classpath").isNotNull();
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) st.execute(sql);
            }
        }
    }

    @Test
    @DisplayName("inserts new names and looks them up in batches")
    void insertAndLookup() {
        cache.updateCache(List.of(
                new CacheMappingUpdate("Dr Jamb", "Door Jamb", 0.9, NormalizationSource.AI),
                new CacheMappingUpdate("sill", "Window Sill", 0.8, NormalizationSource.AI),
                new CacheMappingUpdate("wall", "Wall", 1.0, NormalizationSource.MANUAL)));

        Map<String, CachedMapping> hits = cache.getCachedMappings(List.of("DR JAMB", "sill", "wall", "unknown"));

        assertThat(hits).containsOnlyKeys("dr jamb", "sill", "wall");
        assertThat(hits.get("dr jamb")).isEqualTo(
                new CachedMapping("Door Jamb", 0.9, NormalizationSource.AI, 1, NOW));
        assertThat(hits.get("wall").source()).isEqualTo(NormalizationSource.MANUAL);
    }

    @Test
    @DisplayName("upsert overwrites the mapping and counts usage")
    void upsert() {
        cache.updateCache(List.of(new CacheMappingUpdate("sash", "Sash", 0.5, NormalizationSource.AI)));
        cache.updateCache(List.of(new CacheMappingUpdate("SASH ", "Window Sash", 0.9, NormalizationSource.AI)));

        CachedMapping mapping = cache.getCachedMappings(List.of("sash")).get("sash");

        assertThat(mapping.normalizedName()).isEqualTo("Window Sash");
        assertThat(mapping.confidence()).isEqualTo(0.9);
        assertThat(mapping.usageCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("a row inserted by another session just before the write is updated, not duplicated")
    void concurrentInsert() {
        AtomicBoolean inserted = new AtomicBoolean();
        DataSource racing = interceptingUpdates(() -> {
            if (inserted.compareAndSet(false, true)) {
                try (Connection other = dataSource.getConnection(); Statement st = other.createStatement()) {
                    st.executeUpdate("INSERT INTO xrf_component_cache VALUES"
                            + " ('door', 'Door', 0.4, 'AI', 3, TIMESTAMP '2024-01-01 00:00:00')");
                }
            }
        });
        JdbcNormalizationCache racingCache = new JdbcNormalizationCache(racing, NormalizationKind.COMPONENT, 50, 10,
                Clock.fixed(NOW, ZoneOffset.UTC));

        racingCache.updateCache(List.of(
                new CacheMappingUpdate("door", "Door Frame", 0.9, NormalizationSource.AI),
                new CacheMappingUpdate("sill", "Window Sill", 0.8, NormalizationSource.AI)));

        Map<String, CachedMapping> hits = cache.getCachedMappings(List.of("door", "sill"));
        assertThat(inserted).isTrue();
        assertThat(hits.get("door")).isEqualTo(
                new CachedMapping("Door Frame", 0.9, NormalizationSource.AI, 4, NOW));
        assertThat(hits.get("sill")).isEqualTo(
                new CachedMapping("Window Sill", 0.8, NormalizationSource.AI, 1, NOW));
    }

    /** Wraps the test DataSource so {@code beforeUpdate} runs ahead of every executeUpdate call. */
    private DataSource interceptingUpdates(SqlAction beforeUpdate) {
        return proxy(DataSource.class, dataSource, (method, result) ->
                result instanceof Connection conn ? proxy(Connection.class, conn, (m, r) ->
                        r instanceof PreparedStatement ps ? proxy(PreparedStatement.class, ps, null, beforeUpdate) : r,
                        null) : result, null);
    }

    @FunctionalInterface
    private interface SqlAction {
        void run() throws SQLException;
    }

    @FunctionalInterface
    private interface ResultWrapper {
        Object wrap(Method method, Object result);
    }

    private static <T> T proxy(Class<T> type, T target, ResultWrapper wrapper, SqlAction beforeUpdate) {
        InvocationHandler handler = (p, method, args) -> {
            if (beforeUpdate != null && method.getName().equals("executeUpdate")) {
                beforeUpdate.run();
            }
            Object result;
            try {
                result = method.invoke(target, args);
            } catch (InvocationTargetException e) {
                throw e.getCause();
            }
            return wrapper != null ? wrapper.wrap(method, result) : result;
        };
        return type.cast(Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type}, handler));
    }

    @Test
    @DisplayName("kinds use separate tables")
    void separateTables() {
        JdbcNormalizationCache substrates = new JdbcNormalizationCache(dataSource, NormalizationKind.SUBSTRATE, 50, 10);
        cache.updateCache(List.of(new CacheMappingUpdate("wood", "Wood", 1.0, NormalizationSource.AI)));

        assertThat(substrates.getCachedMappings(List.of("wood"))).isEmpty();
        assertThat(JdbcNormalizationCache.tableName(NormalizationKind.SUBSTRATE)).isEqualTo("xrf_substrate_cache");
    }

    @Test
    @DisplayName("SQL failures surface as XrfProcessingException")
    void sqlFailure() throws SQLException {
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            st.execute("DROP TABLE xrf_component_cache");
        }

        assertThatThrownBy(() -> cache.getCachedMappings(List.of("door")))
                .isInstanceOf(XrfProcessingException.class)
                .hasMessageContaining("xrf_component_cache");
    }
}
