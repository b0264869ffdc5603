package com.eainde.xrf.parse;

import com.eainde.xrf.config.ColumnAliasTable;
import com.eainde.xrf.model.CanonicalField;
import com.eainde.xrf.model.RawGrid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds the header row in exports that put device metadata above the table.
 *
 * <p>Each of the first {@value #SCAN_WINDOW} rows is scored by how many of its text cells
 * are an exact alias of a key field (reading id, component, lead content, color). A row
 * needs {@value #MIN_MATCHES} matches to qualify; a later row must score strictly higher
 * to replace an earlier one.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class HeaderLocator {

    static final int SCAN_WINDOW = 25;
    static final int MIN_MATCHES = 2;

    /** Row index where banner-style device exports put their table header. */
    static final int DEVICE_BANNER_HEADER_ROW = 6;

    static final String FALLBACK_WARNING =
            "Could not clearly identify header row. Assuming first row contains headers.";

    private static final List<CanonicalField> KEY_FIELDS = List.of(
            CanonicalField.READING_ID, CanonicalField.COMPONENT,
            CanonicalField.LEAD_CONTENT, CanonicalField.COLOR);

    private static final List<String> DEVICE_BANNER_MARKERS = List.of(
            "company", "model", "viken", "pb200", "serial");

    private final ColumnAliasTable aliasTable;

    public HeaderDetection locate(RawGrid grid) {
        int limit = Math.min(SCAN_WINDOW, grid.rowCount());

        Candidate best = Candidate.NONE;
        for (int i = 0; i < limit; i++) {
            best = best.consider(i, scoreRow(grid.row(i)));
        }

        if (hasDeviceBanner(grid) && grid.rowCount() > DEVICE_BANNER_HEADER_ROW) {
            int bannerScore = scoreRow(grid.row(DEVICE_BANNER_HEADER_ROW));
            if (bannerScore >= MIN_MATCHES
                    && (best.index() < DEVICE_BANNER_HEADER_ROW || bannerScore >= best.score())) {
                best = new Candidate(DEVICE_BANNER_HEADER_ROW, bannerScore);
            }
        }

        List<String> warnings = new ArrayList<>();
        int headerRow;
        int matches;
        if (best == Candidate.NONE) {
            headerRow = 0;
            matches = grid.isEmpty() ? 0 : scoreRow(grid.row(0));
            warnings.add(FALLBACK_WARNING);
        } else {
            headerRow = best.index();
            matches = best.score();
            if (headerRow > 0) {
                warnings.add("Detected header row at row " + (headerRow + 1) + " (" + matches
                        + " columns matched, skipped " + headerRow + " row(s) above)");
            }
        }

        log.debug("Header row {} matched {} key column(s)", headerRow, matches);
        List<String> headers = grid.isEmpty() ? List.of() : headerTexts(grid.row(headerRow));
        return new HeaderDetection(headerRow, headers, matches, warnings);
    }

    /** Count of text cells in {@code row} that are exact aliases of a key field. */
    int scoreRow(List<Object> row) {
        int score = 0;
        for (Object cell : row) {
            if (!(cell instanceof String text)) continue;
            for (CanonicalField field : KEY_FIELDS) {
                if (aliasTable.isExactAlias(field, text)) {
                    score++;
                    break;
                }
            }
        }
        return score;
    }

    private static boolean hasDeviceBanner(RawGrid grid) {
        if (grid.isEmpty()) return false;
        Object first = grid.cell(0, 0);
        if (first == null) return false;
        String text = first.toString().toLowerCase(Locale.ROOT);
        return DEVICE_BANNER_MARKERS.stream().anyMatch(text::contains);
    }

    private static List<String> headerTexts(List<Object> row) {
        List<String> headers = new ArrayList<>(row.size());
        for (Object cell : row) {
            headers.add(cell == null ? "" : CellValues.text(cell));
        }
        return headers;
    }

    private record Candidate(int index, int score) {
        static final Candidate NONE = new Candidate(-1, MIN_MATCHES - 1);

        Candidate consider(int rowIndex, int rowScore) {
            return rowScore >= MIN_MATCHES && rowScore > score ? new Candidate(rowIndex, rowScore) : this;
        }
    }
}
