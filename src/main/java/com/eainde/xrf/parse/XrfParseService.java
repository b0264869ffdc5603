package com.eainde.xrf.parse;

import com.eainde.xrf.config.ColumnAliasTable;
import com.eainde.xrf.exception.MissingRequiredColumnsException;
import com.eainde.xrf.model.RawGrid;
import com.eainde.xrf.model.Reading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a raw worksheet grid into validated readings.
 *
 * <pre>
 * parse(grid)
 *   ├── empty grid                         → failure "No data found in worksheet"
 *   ├── locate header row (HeaderLocator)
 *   ├── build header-keyed rows below it   → failure when none
 *   ├── resolve columns (ColumnMapper)     → failure when required columns are missing
 *   └── classify each row (RowClassifier)
 *         Accepted → reading, CalibrationSkip / JunkSkip → counted, RowError → error
 * </pre>
 *
 * Every non-empty data row ends up in exactly one bucket, so
 * {@code readings + errors + calibration + junk == totalRows}.
 */
@Slf4j
@Service
public class XrfParseService {

    static final String EMPTY_SHEET_MESSAGE = "No data found in worksheet";
    static final String NO_DATA_ROWS_MESSAGE = "No data rows found below headers";

    private final HeaderLocator headerLocator;
    private final ColumnMapper columnMapper;
    private final RowClassifier rowClassifier = new RowClassifier();
    private final int chunkSize;

    public XrfParseService(ColumnAliasTable aliasTable,
                           AiColumnMapper aiColumnMapper,
                           @Value("${xrf.processing.chunk-size:100}") int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("xrf.processing.chunk-size must be positive: " + chunkSize);
        }
        this.headerLocator = new HeaderLocator(aliasTable);
        this.columnMapper = new ColumnMapper(aliasTable, aiColumnMapper);
        this.chunkSize = chunkSize;
    }

    public ParseResult parse(RawGrid grid) {
        return parse(grid, ParseOptions.defaults(), ParseProgressListener.NONE);
    }

    public ParseResult parse(RawGrid grid, ParseOptions options, ParseProgressListener progress) {
        String sheetName = grid.sheetName();
        if (grid.isEmpty()) {
            return ParseResult.failure(List.of(ParseError.ofSheet(EMPTY_SHEET_MESSAGE)), List.of(),
                    ParseMetadata.empty(sheetName));
        }

        HeaderDetection header = headerLocator.locate(grid);
        List<String> warnings = new ArrayList<>(header.warnings());

        List<SourceRow> dataRows = dataRows(grid, header);
        if (dataRows.isEmpty()) {
            return ParseResult.failure(List.of(ParseError.ofSheet(NO_DATA_ROWS_MESSAGE)), warnings,
                    ParseMetadata.empty(sheetName));
        }

        ColumnMappingResult columns;
        try {
            int total = dataRows.size();
            columns = columnMapper.resolve(header.headers(),
                    dataRows.stream().map(SourceRow::cells).toList(), options,
                    () -> progress.onProgress(0, total, ParseStage.AI_MAPPING));
        } catch (MissingRequiredColumnsException e) {
            log.warn("Sheet '{}' rejected: {}", sheetName, e.getMessage());
            List<ParseError> errors = e.getMissingFields().stream()
                    .map(field -> ParseError.ofSheet("Required column not found: " + field.key()
                            + ". Available columns: " + String.join(", ", e.getAvailableHeaders())))
                    .toList();
            ParseMetadata metadata = new ParseMetadata(dataRows.size(), 0, dataRows.size(), sheetName,
                    Map.of(), List.of(), false, null, 0, 0, Map.of(), List.of());
            return ParseResult.failure(errors, warnings, metadata);
        }
        warnings.addAll(columns.warnings());

        progress.onProgress(0, dataRows.size(), ParseStage.PARSING);

        List<Reading> readings = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();
        Map<JunkReason, Integer> junkReasons = new EnumMap<>(JunkReason.class);
        List<SkippedJunkRow> junkRows = new ArrayList<>();
        int calibrationCount = 0;

        for (int i = 0; i < dataRows.size(); i++) {
            SourceRow row = dataRows.get(i);
            RowOutcome outcome = rowClassifier.classify(
                    MappedRow.of(row.cells(), columns.mapping()), row.rowNumber(), i);

            if (outcome instanceof RowOutcome.Accepted accepted) {
                readings.add(accepted.reading());
            } else if (outcome instanceof RowOutcome.CalibrationSkip) {
                calibrationCount++;
            } else if (outcome instanceof RowOutcome.JunkSkip junk) {
                junkReasons.merge(junk.reason(), 1, Integer::sum);
                junkRows.add(new SkippedJunkRow(junk.rowNumber(), junk.reason()));
            } else if (outcome instanceof RowOutcome.RowError error) {
                errors.add(new ParseError(error.rowNumber(), error.message()));
            }

            if ((i + 1) % chunkSize == 0) {
                progress.onProgress(i + 1, dataRows.size(), ParseStage.PARSING);
                Thread.yield();
            }
        }
        progress.onProgress(dataRows.size(), dataRows.size(), ParseStage.PARSING);

        int noComponent = junkReasons.getOrDefault(JunkReason.NO_COMPONENT, 0);
        int noLead = junkReasons.getOrDefault(JunkReason.NO_LEAD_CONTENT, 0);
        int junkCount = noComponent + noLead;
        if (calibrationCount > 0) {
            warnings.add("Filtered out " + calibrationCount + " calibration/non-component reading(s).");
        }
        if (junkCount > 0) {
            warnings.add("Skipped " + junkCount + " junk row(s): " + noComponent + " no component, "
                    + noLead + " no valid lead value.");
        }

        ParseMetadata metadata = new ParseMetadata(
                dataRows.size(),
                readings.size(),
                dataRows.size() - readings.size(),
                sheetName,
                columns.mapping().asKeyMap(),
                columns.unmappedColumns(),
                columns.usedAiMapping(),
                columns.aiMappingConfidence(),
                calibrationCount,
                junkCount,
                junkReasons,
                junkRows);

        ParsedBatch batch = new ParsedBatch(readings, errors, warnings, metadata);
        if (!batch.isBalanced()) {
            throw new IllegalStateException("Row accounting mismatch for sheet '" + sheetName + "': " + metadata);
        }
        log.info("Parsed sheet '{}': {} readings, {} errors, {} calibration, {} junk of {} rows",
                sheetName, readings.size(), errors.size(), calibrationCount, junkCount, dataRows.size());
        return ParseResult.success(batch);
    }

    /** Header-keyed rows under the header, skipping rows with no content under a named column. */
    private static List<SourceRow> dataRows(RawGrid grid, HeaderDetection header) {
        List<String> headers = header.headers();
        List<SourceRow> rows = new ArrayList<>();
        for (int r = header.headerRowIndex() + 1; r < grid.rowCount(); r++) {
            Map<String, Object> cells = new LinkedHashMap<>();
            boolean hasData = false;
            for (int c = 0; c < headers.size(); c++) {
                String name = headers.get(c);
                if (name.isEmpty() || cells.containsKey(name)) continue;
                Object cell = grid.cell(r, c);
                cells.put(name, cell);
                if (!CellValues.isBlank(cell)) hasData = true;
            }
            if (hasData) rows.add(new SourceRow(r + 1, cells));
        }
        return rows;
    }

    private record SourceRow(int rowNumber, Map<String, Object> cells) {}
}
