package com.eainde.xrf.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Extra header spellings, e.g.
 * <pre>
 * xrf:
 *   columns:
 *     extra-aliases:
 *       component: [ "Bauteil" ]
 *       leadContent: [ "Pb mg/cm2" ]
 * </pre>
 */
@ConfigurationProperties(prefix = "xrf.columns")
public record ColumnAliasProperties(Map<String, List<String>> extraAliases) {

    public ColumnAliasProperties {
        extraAliases = extraAliases == null ? Map.of() : extraAliases;
    }
}
