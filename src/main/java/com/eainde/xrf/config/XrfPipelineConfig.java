package com.eainde.xrf.config;

import com.eainde.xrf.cache.InMemoryNormalizationCache;
import com.eainde.xrf.cache.JdbcNormalizationCache;
import com.eainde.xrf.cache.NormalizationCacheStore;
import com.eainde.xrf.hazard.HazardReference;
import com.eainde.xrf.normalize.NameGrouper;
import com.eainde.xrf.normalize.NameNormalizer;
import com.eainde.xrf.normalize.NormalizationKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Wiring of the deterministic pipeline pieces: alias table, caches and the two name
 * normalizers.
 *
 * <pre>
 * xrf:
 *   processing.chunk-size: 100        # rows / cache writes between yields
 *   cache:
 *     store: memory                   # memory | jdbc (jdbc needs a DataSource bean)
 *     filter-batch-size: 50           # names per cache lookup
 * </pre>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ColumnAliasProperties.class)
public class XrfPipelineConfig {

    static final String JDBC_STORE = "jdbc";

    @Value("${xrf.cache.store:memory}")
    private String cacheStore;

    @Value("${xrf.cache.filter-batch-size:50}")
    private int filterBatchSize;

    @Value("${xrf.processing.chunk-size:100}")
    private int chunkSize;

    @Bean
    public ColumnAliasTable columnAliasTable(ColumnAliasProperties properties) {
        ColumnAliasTable table = ColumnAliasTable.defaults().withExtraAliases(properties.extraAliases());
        if (!properties.extraAliases().isEmpty()) {
            log.info("Extra column aliases configured for {}", properties.extraAliases().keySet());
        }
        return table;
    }

    @Bean
    public HazardReference hazardReference(ObjectMapper objectMapper) {
        return HazardReference.load(objectMapper);
    }

    @Bean
    public NormalizationCacheStore componentNormalizationCache(ObjectProvider<DataSource> dataSource) {
        return cacheStore(NormalizationKind.COMPONENT, dataSource);
    }

    @Bean
    public NormalizationCacheStore substrateNormalizationCache(ObjectProvider<DataSource> dataSource) {
        return cacheStore(NormalizationKind.SUBSTRATE, dataSource);
    }

    @Bean
    public NameNormalizer componentNormalizer(
            @Qualifier("componentNormalizationCache") NormalizationCacheStore cache,
            @Qualifier("componentNameGrouper") NameGrouper grouper) {
        return new NameNormalizer(NormalizationKind.COMPONENT, cache, grouper, filterBatchSize);
    }

    @Bean
    public NameNormalizer substrateNormalizer(
            @Qualifier("substrateNormalizationCache") NormalizationCacheStore cache,
            @Qualifier("substrateNameGrouper") NameGrouper grouper) {
        return new NameNormalizer(NormalizationKind.SUBSTRATE, cache, grouper, filterBatchSize);
    }

    private NormalizationCacheStore cacheStore(NormalizationKind kind, ObjectProvider<DataSource> dataSource) {
        if (JDBC_STORE.equalsIgnoreCase(cacheStore)) {
            DataSource ds = dataSource.getIfAvailable();
            if (ds == null) {
                throw new IllegalStateException("xrf.cache.store=jdbc requires a DataSource bean");
            }
            log.info("Using JDBC {} normalization cache", kind.label());
            return new JdbcNormalizationCache(ds, kind, filterBatchSize, chunkSize);
        }
        return new InMemoryNormalizationCache(chunkSize);
    }
}
