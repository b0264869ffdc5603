package com.eainde.xrf.parse;

import com.eainde.xrf.model.CanonicalField;
import com.eainde.xrf.model.Reading;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Decides what a single mapped data row is, and builds the {@link Reading} when it is a
 * real measurement.
 *
 * <p>Checks run in a fixed order, first match wins:</p>
 * <ol>
 *   <li>calibration marker in component or reading id, or a blank component whose value is
 *       a calibration check value (1.0 / 1.1 / 1.2)</li>
 *   <li>blank component → junk ({@link JunkReason#NO_COMPONENT})</li>
 *   <li>no usable lead value → junk ({@link JunkReason#NO_LEAD_CONTENT})</li>
 *   <li>otherwise a reading</li>
 * </ol>
 */
@Slf4j
public class RowClassifier {

    static final String UNKNOWN_COLOR = "Unknown";
    static final String ORIGINAL_READING_ID_KEY = "originalReadingId";

    private static final List<String> CALIBRATION_SUBSTRINGS = List.of("calibrate", "calib", "standard");
    private static final Set<String> CALIBRATION_EXACT = Set.of("cal", "cal.");
    private static final List<String> CALIBRATION_ID_SUBSTRINGS = List.of("calibrate", "calib");
    private static final double[] CALIBRATION_CHECK_VALUES = {1.0, 1.1, 1.2};

    /**
     * @param row       the mapped cells
     * @param rowNumber 1-based line number in the source sheet, for error reporting
     * @param rowIndex  0-based position among the data rows, used to keep ids unique
     */
    public RowOutcome classify(MappedRow row, int rowNumber, int rowIndex) {
        try {
            String rawReadingId = row.text(CanonicalField.READING_ID);
            String rawComponent = row.text(CanonicalField.COMPONENT);
            Object leadCell = row.get(CanonicalField.LEAD_CONTENT);
            OptionalDouble leadContent = LeadValueCoercer.coerce(leadCell);

            if (isCalibration(rawComponent, rawReadingId, leadContent)) {
                return new RowOutcome.CalibrationSkip(rowNumber);
            }
            if (rawComponent.isEmpty()) {
                return new RowOutcome.JunkSkip(rowNumber, JunkReason.NO_COMPONENT);
            }
            if (leadContent.isEmpty()) {
                return new RowOutcome.JunkSkip(rowNumber, JunkReason.NO_LEAD_CONTENT);
            }

            return new RowOutcome.Accepted(buildReading(row, rawReadingId, rawComponent,
                    leadContent.getAsDouble(), rowIndex));
        } catch (RuntimeException e) {
            log.debug("Row {} failed to parse", rowNumber, e);
            return new RowOutcome.RowError(rowNumber, "Failed to parse row: " + e.getMessage());
        }
    }

    boolean isCalibration(String component, String readingId, OptionalDouble leadContent) {
        String comp = component.toLowerCase(Locale.ROOT);
        String id = readingId.toLowerCase(Locale.ROOT);

        if (CALIBRATION_EXACT.contains(comp)) return true;
        for (String marker : CALIBRATION_SUBSTRINGS) {
            if (comp.contains(marker)) return true;
        }
        for (String marker : CALIBRATION_ID_SUBSTRINGS) {
            if (id.contains(marker)) return true;
        }

        if (comp.isEmpty() && leadContent.isPresent()) {
            double value = leadContent.getAsDouble();
            for (double check : CALIBRATION_CHECK_VALUES) {
                if (value == check) return true;
            }
        }
        return false;
    }

    private Reading buildReading(MappedRow row, String rawReadingId, String component,
                                 double leadContent, int rowIndex) {
        String readingId = rawReadingId.isEmpty()
                ? "Row_" + rowIndex
                : rawReadingId + "_" + rowIndex;

        String unitNumber = blankToNull(row.text(CanonicalField.UNIT_NUMBER));
        String roomType = blankToNull(row.text(CanonicalField.ROOM_TYPE));
        String roomNumber = blankToNull(row.text(CanonicalField.ROOM_NUMBER));
        String color = row.text(CanonicalField.COLOR);

        String location = row.text(CanonicalField.LOCATION);
        if (location.isEmpty()) {
            location = composeLocation(unitNumber, roomType, roomNumber);
        }

        return Reading.builder()
                .id(readingId)
                .component(component)
                .color(color.isEmpty() ? UNKNOWN_COLOR : color)
                .leadContent(leadContent)
                .location(location)
                .unitNumber(unitNumber)
                .roomType(roomType)
                .roomNumber(roomNumber)
                .substrate(blankToNull(row.text(CanonicalField.SUBSTRATE)))
                .side(blankToNull(row.text(CanonicalField.SIDE)))
                .condition(blankToNull(row.text(CanonicalField.CONDITION)))
                .timestamp(row.isMapped(CanonicalField.TIMESTAMP)
                        ? CellValues.timestamp(row.get(CanonicalField.TIMESTAMP))
                        : null)
                .sourceRow(sourceRowText(row, rawReadingId))
                .build();
    }

    /** "Unit 101 - Bedroom 2", "Unit 101 - Room 3", "Kitchen", ... */
    static String composeLocation(String unitNumber, String roomType, String roomNumber) {
        List<String> parts = new ArrayList<>();
        if (unitNumber != null) parts.add("Unit " + unitNumber);
        if (roomType != null) {
            parts.add(roomNumber != null ? roomType + " " + roomNumber : roomType);
        } else if (roomNumber != null) {
            parts.add("Room " + roomNumber);
        }
        return String.join(" - ", parts);
    }

    private static Map<String, String> sourceRowText(MappedRow row, String rawReadingId) {
        Map<String, String> out = new LinkedHashMap<>();
        row.original().forEach((header, cell) -> {
            if (header != null && !header.isEmpty()) out.put(header, CellValues.text(cell));
        });
        out.put(ORIGINAL_READING_ID_KEY, rawReadingId);
        return out;
    }

    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
