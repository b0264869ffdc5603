package com.eainde.xrf.parse;

import com.eainde.xrf.model.CanonicalField;
import com.eainde.xrf.model.ColumnMapping;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One data row after column mapping: cells keyed by canonical field.
 *
 * <p>Only mapped fields are present as keys (a mapped field with a blank cell has a
 * {@code null} value). {@code original} keeps every header → cell pair of the source row.</p>
 */
public final class MappedRow {

    private final Map<CanonicalField, Object> values;
    private final Map<String, Object> original;

    private MappedRow(Map<CanonicalField, Object> values, Map<String, Object> original) {
        this.values = Collections.unmodifiableMap(values);
        this.original = Collections.unmodifiableMap(original);
    }

    /**
     * Projects a header-keyed source row onto the canonical fields of {@code mapping}.
     */
    public static MappedRow of(Map<String, Object> sourceRow, ColumnMapping mapping) {
        EnumMap<CanonicalField, Object> values = new EnumMap<>(CanonicalField.class);
        mapping.asMap().forEach((field, column) -> values.put(field, sourceRow.get(column)));
        return new MappedRow(values, new LinkedHashMap<>(sourceRow));
    }

    /** Builds a row directly from field values, used where no header row exists. */
    public static MappedRow ofFields(Map<CanonicalField, Object> fieldValues) {
        EnumMap<CanonicalField, Object> values = new EnumMap<>(CanonicalField.class);
        values.putAll(fieldValues);
        Map<String, Object> original = new LinkedHashMap<>();
        fieldValues.forEach((field, value) -> original.put(field.key(), value));
        return new MappedRow(values, original);
    }

    public boolean isMapped(CanonicalField field) {
        return values.containsKey(field);
    }

    public Object get(CanonicalField field) {
        return values.get(field);
    }

    /** Trimmed text of the field's cell, "" when unmapped or blank. */
    public String text(CanonicalField field) {
        return CellValues.text(values.get(field));
    }

    public Map<String, Object> original() {
        return original;
    }
}
