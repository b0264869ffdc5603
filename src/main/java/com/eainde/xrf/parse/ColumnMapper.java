package com.eainde.xrf.parse;

import com.eainde.xrf.config.ColumnAliasTable;
import com.eainde.xrf.exception.MissingRequiredColumnsException;
import com.eainde.xrf.model.CanonicalField;
import com.eainde.xrf.model.ColumnMapping;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves which header holds each canonical field.
 *
 * <p>The alias table is tried first. When required fields are still missing and the
 * options allow it, the whole header list plus a few sample rows go to the
 * {@link AiColumnMapper}; its answers overlay the static result, but only for columns that
 * really exist in the file.</p>
 */
@Slf4j
public class ColumnMapper {

    static final int AI_SAMPLE_ROWS = 3;

    private final ColumnAliasTable aliasTable;
    private final AiColumnMapper aiColumnMapper;

    /**
     * @param aiColumnMapper may be {@code null}, equivalent to an unavailable mapper
     */
    public ColumnMapper(ColumnAliasTable aliasTable, AiColumnMapper aiColumnMapper) {
        this.aliasTable = aliasTable;
        this.aiColumnMapper = aiColumnMapper;
    }

    /**
     * @throws MissingRequiredColumnsException when a required field has no column after all
     *                                         strategies ran
     */
    public ColumnMappingResult resolve(List<String> headers, List<Map<String, Object>> sampleRows,
                                       ParseOptions options) {
        return resolve(headers, sampleRows, options, () -> { });
    }

    /**
     * @param beforeAiCall run just before the AI mapper is consulted
     */
    public ColumnMappingResult resolve(List<String> headers, List<Map<String, Object>> sampleRows,
                                       ParseOptions options, Runnable beforeAiCall) {
        List<String> warnings = new ArrayList<>();
        boolean aiAvailable = aiColumnMapper != null && aiColumnMapper.isAvailable();

        ColumnMapping mapping;
        List<String> unmapped;
        boolean usedAi = false;
        Double confidence = null;

        if (options.alwaysUseAi() && aiAvailable) {
            beforeAiCall.run();
            try {
                AiColumnMapping proposal = aiColumnMapper.mapColumns(headers, samples(sampleRows));
                mapping = acceptAiAssignments(proposal, headers);
                unmapped = proposal.unmapped();
                usedAi = true;
                confidence = proposal.confidence();
                warnings.add("Used AI to map columns (confidence: " + percent(proposal.confidence()) + ")");
            } catch (RuntimeException e) {
                log.warn("AI column mapping failed", e);
                warnings.add("AI column mapping failed: " + e.getMessage());
                mapping = ColumnMapping.empty();
                unmapped = List.copyOf(headers);
            }
        } else {
            mapping = staticMapping(headers);
            unmapped = aliasTable.unmappedHeaders(headers);
            if (!unmapped.isEmpty()) {
                warnings.add("Unmapped columns found: " + String.join(", ", unmapped));
            }

            if (!mapping.missingRequired().isEmpty() && options.useAiFallback() && aiAvailable) {
                warnings.add("Static column mapping incomplete. Using AI to map columns...");
                beforeAiCall.run();
                try {
                    AiColumnMapping proposal = aiColumnMapper.mapColumns(headers, samples(sampleRows));
                    mapping = mapping.overlay(acceptAiAssignments(proposal, headers));
                    unmapped = proposal.unmapped();
                    usedAi = true;
                    confidence = proposal.confidence();
                    warnings.add("AI mapping complete (confidence: " + percent(proposal.confidence()) + ")");
                } catch (RuntimeException e) {
                    log.warn("AI column mapping failed, keeping static mapping", e);
                    warnings.add("AI column mapping failed: " + e.getMessage());
                }
            }
        }

        List<CanonicalField> missing = mapping.missingRequired();
        if (!missing.isEmpty()) {
            throw new MissingRequiredColumnsException(missing, headers);
        }
        return new ColumnMappingResult(mapping, unmapped, usedAi, confidence, warnings);
    }

    /** Alias-table resolution only. Lead content prefers numeric columns over result columns. */
    public ColumnMapping staticMapping(List<String> headers) {
        Map<CanonicalField, String> columns = new EnumMap<>(CanonicalField.class);
        for (CanonicalField field : CanonicalField.values()) {
            String column = field == CanonicalField.LEAD_CONTENT
                    ? leadColumn(headers)
                    : ColumnAliasTable.findColumnMatch(headers, aliasTable.aliases(field));
            if (column != null) columns.put(field, column);
        }
        return ColumnMapping.of(columns);
    }

    private String leadColumn(List<String> headers) {
        String column = ColumnAliasTable.findColumnMatch(headers, ColumnAliasTable.CONCENTRATION_ALIASES);
        if (column == null) column = ColumnAliasTable.findColumnMatch(headers, ColumnAliasTable.RESULT_ALIASES);
        if (column == null) column = ColumnAliasTable.findColumnMatch(headers, aliasTable.aliases(CanonicalField.LEAD_CONTENT));
        return column;
    }

    private ColumnMapping acceptAiAssignments(AiColumnMapping proposal, List<String> headers) {
        Map<CanonicalField, String> accepted = new EnumMap<>(CanonicalField.class);
        proposal.assignments().forEach((key, column) -> {
            Optional<CanonicalField> field = CanonicalField.fromKey(key);
            Optional<String> header = originalHeader(headers, column);
            if (field.isPresent() && header.isPresent()) {
                accepted.put(field.get(), header.get());
            } else {
                log.debug("Discarding AI column assignment {} -> {}", key, column);
            }
        });
        return ColumnMapping.of(accepted);
    }

    private static Optional<String> originalHeader(List<String> headers, String column) {
        if (column == null || column.isBlank()) return Optional.empty();
        String wanted = column.trim().toLowerCase(Locale.ROOT);
        return headers.stream()
                .filter(h -> h.trim().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    private static List<Map<String, Object>> samples(List<Map<String, Object>> rows) {
        return rows.size() <= AI_SAMPLE_ROWS ? rows : rows.subList(0, AI_SAMPLE_ROWS);
    }

    private static String percent(double confidence) {
        return Math.round(confidence * 100) + "%";
    }
}
