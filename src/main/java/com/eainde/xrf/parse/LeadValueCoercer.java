package com.eainde.xrf.parse;

import com.eainde.xrf.model.Reading;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns whatever a device wrote in its lead column into mg/cm².
 *
 * <p>Handles numbers, TRUE/FALSE result cells, Positive/Negative style tokens and numeric
 * text decorated with units, comparison operators or thousands separators. Textual positives
 * map to {@link #POSITIVE_TOKEN_VALUE}, which is above the threshold and distinct from every
 * calibration check value.</p>
 */
public final class LeadValueCoercer {

    /** Value assigned to "positive" tokens and TRUE cells. Must not equal 1.0, 1.1 or 1.2. */
    public static final double POSITIVE_TOKEN_VALUE = Reading.POSITIVE_THRESHOLD + 0.05;

    private static final Set<String> POSITIVE_TOKENS = Set.of("pos", "positive", "assumed", "assumed positive");
    private static final Set<String> NEGATIVE_TOKENS = Set.of("neg", "negative", "n/a", "-");

    private static final Pattern UNITS = Pattern.compile("mg/cm[²2]|ppm", Pattern.CASE_INSENSITIVE);
    private static final Pattern OPERATORS_AND_SEPARATORS = Pattern.compile("[<>,]");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private LeadValueCoercer() {}

    /**
     * @return the lead concentration, empty when the cell carries no usable value
     */
    public static OptionalDouble coerce(Object cell) {
        if (cell == null) return OptionalDouble.empty();

        if (cell instanceof Number n) {
            double value = n.doubleValue();
            return Double.isFinite(value) ? OptionalDouble.of(clamp(value)) : OptionalDouble.empty();
        }

        if (cell instanceof Boolean b) {
            return OptionalDouble.of(b ? POSITIVE_TOKEN_VALUE : 0d);
        }

        if (cell instanceof String s) {
            return coerceText(s);
        }

        return OptionalDouble.empty();
    }

    private static OptionalDouble coerceText(String raw) {
        String token = raw.trim().toLowerCase(Locale.ROOT);
        if (POSITIVE_TOKENS.contains(token)) return OptionalDouble.of(POSITIVE_TOKEN_VALUE);
        if (NEGATIVE_TOKENS.contains(token)) return OptionalDouble.of(0d);

        String cleaned = UNITS.matcher(raw).replaceAll("");
        cleaned = OPERATORS_AND_SEPARATORS.matcher(cleaned).replaceAll("").trim();

        Matcher m = LEADING_NUMBER.matcher(cleaned);
        if (!m.find()) return OptionalDouble.empty();
        try {
            double value = Double.parseDouble(m.group());
            return Double.isFinite(value) ? OptionalDouble.of(clamp(value)) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    // Analyzers report small negative values around zero; they carry no lead.
    private static double clamp(double value) {
        return value < 0 ? 0d : value;
    }
}
