package com.eainde.xrf.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Canonical reading fields a spreadsheet column can be mapped onto.
 *
 * <p>The four required fields must all resolve to a column or the file is rejected.
 * Everything else is descriptive and may be absent.</p>
 */
public enum CanonicalField {

    READING_ID("readingId", true),
    COMPONENT("component", true),
    COLOR("color", true),
    LEAD_CONTENT("leadContent", true),
    LOCATION("location", false),
    UNIT_NUMBER("unitNumber", false),
    ROOM_TYPE("roomType", false),
    ROOM_NUMBER("roomNumber", false),
    SUBSTRATE("substrate", false),
    SIDE("side", false),
    CONDITION("condition", false),
    TIMESTAMP("timestamp", false);

    private final String key;
    private final boolean required;

    CanonicalField(String key, boolean required) {
        this.key = key;
        this.required = required;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean isRequired() {
        return required;
    }

    public static List<CanonicalField> requiredFields() {
        return Arrays.stream(values()).filter(CanonicalField::isRequired).toList();
    }

    /** Case-insensitive lookup by the camelCase key used in prompts and JSON. */
    public static Optional<CanonicalField> fromKey(String key) {
        if (key == null) return Optional.empty();
        String trimmed = key.trim();
        return Arrays.stream(values())
                .filter(f -> f.key.equalsIgnoreCase(trimmed))
                .findFirst();
    }

    @JsonCreator
    static CanonicalField fromJson(String key) {
        return fromKey(key).orElseThrow(() -> new IllegalArgumentException("Unknown field: " + key));
    }
}
