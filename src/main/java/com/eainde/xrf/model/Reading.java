package com.eainde.xrf.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One XRF shot at one building location.
 *
 * <p>Created once by the row classifier. The only state that changes afterwards are the two
 * normalized-name fields, each assigned exactly once through {@link #withNormalizedComponent}
 * and {@link #withNormalizedSubstrate}, which return a new instance.</p>
 *
 * <p>{@link #isPositive()} is always derived from {@code leadContent}; it is serialized for
 * readers of the summary but never read back.</p>
 *
 * @param id                  identifier unique within one parse batch
 * @param component           raw component text from the device (e.g. "dr jamb")
 * @param normalizedComponent canonical component name, {@code null} until normalized
 * @param color               paint color, "Unknown" when the cell was blank
 * @param leadContent         lead concentration in mg/cm², never negative
 * @param location            combined location text ("" when nothing is known)
 * @param sourceRow           textual copy of the original row cells, for traceability
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = {"isPositive"}, allowGetters = true)
public record Reading(
        @JsonProperty("id")                  String id,
        @JsonProperty("component")           String component,
        @JsonProperty("normalizedComponent") String normalizedComponent,
        @JsonProperty("color")               String color,
        @JsonProperty("leadContent")         double leadContent,
        @JsonProperty("location")            String location,
        @JsonProperty("unitNumber")          String unitNumber,
        @JsonProperty("roomType")            String roomType,
        @JsonProperty("roomNumber")          String roomNumber,
        @JsonProperty("substrate")           String substrate,
        @JsonProperty("normalizedSubstrate") String normalizedSubstrate,
        @JsonProperty("side")                String side,
        @JsonProperty("condition")           String condition,
        @JsonProperty("timestamp")           LocalDateTime timestamp,
        @JsonProperty("sourceRow")           Map<String, String> sourceRow
) {

    /** mg/cm² at or above which a reading is lead-positive (HUD/EPA). */
    public static final double POSITIVE_THRESHOLD = 1.0;

    public Reading {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Reading id is required");
        }
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("Reading component is required");
        }
        if (!Double.isFinite(leadContent) || leadContent < 0) {
            throw new IllegalArgumentException("Lead content must be a finite non-negative number: " + leadContent);
        }
        sourceRow = sourceRow == null ? Map.of() : Map.copyOf(sourceRow);
    }

    @JsonProperty("isPositive")
    public boolean isPositive() {
        return leadContent >= POSITIVE_THRESHOLD;
    }

    public Reading withNormalizedComponent(String name) {
        if (normalizedComponent != null) {
            throw new IllegalStateException("Component of reading " + id + " already normalized");
        }
        return toBuilder().normalizedComponent(name).build();
    }

    public Reading withNormalizedSubstrate(String name) {
        if (normalizedSubstrate != null) {
            throw new IllegalStateException("Substrate of reading " + id + " already normalized");
        }
        return toBuilder().normalizedSubstrate(name).build();
    }

    /** Component name used for grouping: the normalized one when present. */
    public String effectiveComponent() {
        return normalizedComponent != null && !normalizedComponent.isEmpty() ? normalizedComponent : component;
    }

    /** Substrate name used for grouping, {@code null} when the reading has none. */
    public String effectiveSubstrate() {
        if (normalizedSubstrate != null && !normalizedSubstrate.isEmpty()) return normalizedSubstrate;
        return substrate != null && !substrate.isEmpty() ? substrate : null;
    }
}
