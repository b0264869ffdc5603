package com.eainde.xrf.parse;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Supplier;

/**
 * Conversions from untyped grid cells to text and timestamps.
 */
final class CellValues {

    /** Day zero of Excel's 1900 date system, shifted for its phantom 29-Feb-1900. */
    private static final LocalDateTime EXCEL_EPOCH = LocalDateTime.of(1899, 12, 30, 0, 0);

    private static final List<DateTimeFormatter> US_FORMATS = List.of(
            DateTimeFormatter.ofPattern("M/d/yyyy H:mm:ss"),
            DateTimeFormatter.ofPattern("M/d/yyyy H:mm"),
            DateTimeFormatter.ofPattern("M/d/yyyy h:mm:ss a"),
            DateTimeFormatter.ofPattern("M/d/yyyy h:mm a"));

    private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("M/d/yyyy");

    private CellValues() {}

    /**
     * Trimmed text of a cell. Integral numbers drop their ".0" so reading numbers stored as
     * numeric cells read "12", not "12.0".
     */
    static String text(Object cell) {
        if (cell == null) return "";
        if (cell instanceof String s) return s.trim();
        if (cell instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) return d.toString();
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (cell instanceof Number n) return n.toString();
        return cell.toString().trim();
    }

    static boolean isBlank(Object cell) {
        return text(cell).isEmpty();
    }

    /**
     * Timestamp from a date cell, an Excel serial number or a date string.
     *
     * @return the timestamp, or {@code null} when the cell holds nothing recognisable
     */
    static LocalDateTime timestamp(Object cell) {
        if (cell == null) return null;
        if (cell instanceof LocalDateTime dt) return dt;
        if (cell instanceof LocalDate d) return d.atStartOfDay();
        if (cell instanceof Number n) {
            double serial = n.doubleValue();
            if (serial <= 0 || Double.isNaN(serial) || Double.isInfinite(serial)) return null;
            try {
                return EXCEL_EPOCH.plus(Duration.ofMillis(Math.round(serial * 86_400_000d)));
            } catch (DateTimeException | ArithmeticException e) {
                return null;
            }
        }
        if (cell instanceof String s) {
            return parseTimestampText(s.trim());
        }
        return null;
    }

    private static LocalDateTime parseTimestampText(String value) {
        if (value.isEmpty()) return null;
        LocalDateTime parsed = attempt(() -> LocalDateTime.parse(value));
        if (parsed == null) parsed = attempt(() -> LocalDate.parse(value).atStartOfDay());
        for (int i = 0; parsed == null && i < US_FORMATS.size(); i++) {
            DateTimeFormatter format = US_FORMATS.get(i);
            parsed = attempt(() -> LocalDateTime.parse(value, format));
        }
        if (parsed == null) parsed = attempt(() -> LocalDate.parse(value, US_DATE).atStartOfDay());
        return parsed;
    }

    private static LocalDateTime attempt(Supplier<LocalDateTime> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
