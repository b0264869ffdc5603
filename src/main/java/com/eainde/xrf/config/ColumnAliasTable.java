package com.eainde.xrf.config;

import com.eainde.xrf.model.CanonicalField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Header spellings observed in XRF analyzer exports, per canonical field.
 *
 * <p>Includes the truncated all-caps headers some devices write when the column is too
 * narrow ("COMPONE", "SUBSTRAT", "CONDITIO"). Extra spellings can be appended from
 * configuration through {@link #withExtraAliases(Map)}; defaults keep their priority.</p>
 */
public final class ColumnAliasTable {

    /** Headers and aliases both shorter than this never prefix-match each other. */
    static final int MIN_PREFIX_LENGTH = 4;

    /** Numeric concentration columns, preferred over pass/fail style result columns. */
    public static final List<String> CONCENTRATION_ALIASES = List.of(
            "Concentration", "Concentra", "Lead Content", "PbC", "PbC (mg/cm²)",
            "Lead (mg/cm²)", "mg/cm²", "mg/cm2");

    /** Result columns, which may hold TRUE/FALSE or Positive/Negative instead of a number. */
    public static final List<String> RESULT_ALIASES = List.of(
            "Result", "RESULT", "XRF Result", "Lead Result");

    private static final Map<CanonicalField, List<String>> DEFAULTS = new EnumMap<>(CanonicalField.class);

    static {
        DEFAULTS.put(CanonicalField.READING_ID, List.of(
                "Reading ID", "ReadingID", "Reading #", "Reading Number", "ID", "Rdg",
                "Reading", "Test ID", "Test #", "Sample ID"));
        DEFAULTS.put(CanonicalField.COMPONENT, List.of(
                "Component", "COMPONENT", "Components", "COMPONE", "COMPON", "Building Component",
                "Comp", "Component Type", "Testing Component", "Substrate Component",
                "Test Component", "Element"));
        DEFAULTS.put(CanonicalField.COLOR, List.of(
                "Color", "COLOR", "Paint Color", "Colour", "Surface Color", "Coating Color"));
        DEFAULTS.put(CanonicalField.LEAD_CONTENT, List.of(
                "PbC", "PbC (mg/cm²)", "PbC (mg/cm2)", "Lead Content", "Lead (mg/cm²)",
                "Lead (mg/cm2)", "Lead", "Pb", "Pb Content", "Lead Concentration",
                "Concentration", "Concentra", "mg/cm²", "mg/cm2", "Result", "RESULT",
                "XRF Result", "Lead Result", "Pb (mg/cm²)"));
        DEFAULTS.put(CanonicalField.LOCATION, List.of(
                "Location", "Full Location", "Test Location", "Unit/Room", "Room/Unit"));
        DEFAULTS.put(CanonicalField.UNIT_NUMBER, List.of(
                "Unit", "Unit #", "Unit Number", "Unit No", "Apt", "Apt #", "Apt No",
                "Apartment", "Apartment #", "Apartment Number", "Dwelling", "Dwelling Unit"));
        DEFAULTS.put(CanonicalField.ROOM_TYPE, List.of(
                "Room Type", "ROOM TY", "RoomType", "Room", "Room Name", "Area", "Area Type",
                "Space", "Space Type"));
        DEFAULTS.put(CanonicalField.ROOM_NUMBER, List.of(
                "Room Number", "Room #", "Room Num", "Room No", "Rm #", "Rm No", "Number", "#"));
        DEFAULTS.put(CanonicalField.SUBSTRATE, List.of(
                "Substrate", "SUBSTRAT", "Subtrate", "Surface", "Material", "Substrate Type",
                "Surface Type", "Base Material"));
        DEFAULTS.put(CanonicalField.SIDE, List.of(
                "Side", "SIDE", "Surface Side", "A/B", "Face"));
        DEFAULTS.put(CanonicalField.CONDITION, List.of(
                "Condition", "CONDITIO", "CONDITION", "Paint Condition", "Surface Condition",
                "Coating Condition"));
        DEFAULTS.put(CanonicalField.TIMESTAMP, List.of(
                "Date", "Time", "DateTime", "Timestamp", "Reading Date", "Test Date", "Date/Time"));
    }

    private static final ColumnAliasTable DEFAULT_TABLE = new ColumnAliasTable(DEFAULTS);

    private final Map<CanonicalField, List<String>> aliases;

    private ColumnAliasTable(Map<CanonicalField, List<String>> aliases) {
        EnumMap<CanonicalField, List<String>> copy = new EnumMap<>(CanonicalField.class);
        aliases.forEach((field, names) -> copy.put(field, List.copyOf(names)));
        this.aliases = Collections.unmodifiableMap(copy);
    }

    public static ColumnAliasTable defaults() {
        return DEFAULT_TABLE;
    }

    /**
     * Appends extra spellings keyed by field key ("component", "leadContent", ...).
     * Unknown keys are rejected so a typo in configuration does not pass silently.
     */
    public ColumnAliasTable withExtraAliases(Map<String, List<String>> extra) {
        if (extra == null || extra.isEmpty()) return this;
        EnumMap<CanonicalField, List<String>> merged = new EnumMap<>(aliases);
        extra.forEach((key, names) -> {
            CanonicalField field = CanonicalField.fromKey(key)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown column field in alias configuration: " + key));
            Set<String> combined = new LinkedHashSet<>(merged.getOrDefault(field, List.of()));
            combined.addAll(names);
            merged.put(field, new ArrayList<>(combined));
        });
        return new ColumnAliasTable(merged);
    }

    public List<String> aliases(CanonicalField field) {
        return aliases.getOrDefault(field, List.of());
    }

    /** True when {@code cellText} equals (trimmed, case-folded) any alias of {@code field}. */
    public boolean isExactAlias(CanonicalField field, String cellText) {
        if (cellText == null) return false;
        String value = fold(cellText);
        for (String alias : aliases(field)) {
            if (fold(alias).equals(value)) return true;
        }
        return false;
    }

    /**
     * Finds the header matching one of {@code possibleNames}.
     *
     * <p>Exact case-insensitive match first, in alias order. Then a prefix match in header
     * order, so truncated headers still resolve: the header may be a prefix of the alias or
     * the alias a prefix of the header, unless both are shorter than 4 characters.</p>
     *
     * @return the header as spelled in the file, or {@code null}
     */
    public static String findColumnMatch(List<String> headers, List<String> possibleNames) {
        List<String> folded = headers.stream().map(ColumnAliasTable::fold).toList();

        for (String name : possibleNames) {
            int index = folded.indexOf(fold(name));
            if (index >= 0) {
                return headers.get(index);
            }
        }

        for (int i = 0; i < folded.size(); i++) {
            String header = folded.get(i);
            if (header.isEmpty()) continue;
            for (String name : possibleNames) {
                String n = fold(name);
                if (header.length() < MIN_PREFIX_LENGTH && n.length() < MIN_PREFIX_LENGTH) continue;
                if (n.startsWith(header) || header.startsWith(n)) {
                    return headers.get(i);
                }
            }
        }
        return null;
    }

    /** Headers that are not an exact alias of any field. Useful to discover new device formats. */
    public List<String> unmappedHeaders(List<String> headers) {
        Set<String> known = new LinkedHashSet<>();
        aliases.values().forEach(names -> names.forEach(n -> known.add(fold(n))));
        return headers.stream()
                .filter(h -> !fold(h).isEmpty())
                .filter(h -> !known.contains(fold(h)))
                .toList();
    }

    static String fold(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }
}
