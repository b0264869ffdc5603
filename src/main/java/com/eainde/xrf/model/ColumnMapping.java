package com.eainde.xrf.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical field → source column header. At most one column per field.
 */
public final class ColumnMapping {

    private final Map<CanonicalField, String> columns;

    private ColumnMapping(Map<CanonicalField, String> columns) {
        this.columns = Collections.unmodifiableMap(new EnumMap<>(columns));
    }

    public static ColumnMapping empty() {
        return new ColumnMapping(new EnumMap<>(CanonicalField.class));
    }

    public static ColumnMapping of(Map<CanonicalField, String> columns) {
        EnumMap<CanonicalField, String> copy = new EnumMap<>(CanonicalField.class);
        columns.forEach((field, column) -> {
            if (column != null && !column.isBlank()) copy.put(field, column);
        });
        return new ColumnMapping(copy);
    }

    public Optional<String> column(CanonicalField field) {
        return Optional.ofNullable(columns.get(field));
    }

    /** Overlays every assignment of {@code other} onto this mapping. */
    public ColumnMapping overlay(ColumnMapping other) {
        EnumMap<CanonicalField, String> copy = new EnumMap<>(CanonicalField.class);
        copy.putAll(columns);
        copy.putAll(other.columns);
        return new ColumnMapping(copy);
    }

    public List<CanonicalField> missingRequired() {
        return CanonicalField.requiredFields().stream()
                .filter(f -> !columns.containsKey(f))
                .toList();
    }

    public Map<CanonicalField, String> asMap() {
        return columns;
    }

    /** Field keys ("readingId", ...) to column header, in field declaration order. */
    public Map<String, String> asKeyMap() {
        Map<String, String> out = new LinkedHashMap<>();
        columns.forEach((field, column) -> out.put(field.key(), column));
        return out;
    }

    public int size() {
        return columns.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnMapping that)) return false;
        return columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "ColumnMapping" + asKeyMap();
    }
}
