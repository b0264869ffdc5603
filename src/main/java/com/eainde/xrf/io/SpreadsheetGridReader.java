package com.eainde.xrf.io;

import com.eainde.xrf.exception.GridReadException;
import com.eainde.xrf.model.RawGrid;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads the first worksheet of an XLSX/XLS file, or a CSV file, into a {@link RawGrid}.
 *
 * <p>Workbook cells keep their type: text, {@code Double}, {@code Boolean}, or
 * {@code LocalDateTime} for date-formatted numbers. Formula cells contribute their cached
 * result. CSV cells are always text; empty cells of either format become {@code null}.</p>
 */
@Slf4j
@Component
public class SpreadsheetGridReader {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    public static boolean isCsvFileName(String fileName) {
        return fileName != null && fileName.trim().toLowerCase(Locale.ROOT).endsWith(".csv");
    }

    /**
     * Reads {@code content}, choosing CSV or workbook parsing from the file name.
     *
     * @throws GridReadException when the content is not a readable spreadsheet
     */
    public RawGrid read(String fileName, InputStream content) {
        log.debug("Reading grid from '{}'", fileName);
        return isCsvFileName(fileName) ? readCsv(fileName, content) : readWorkbook(content);
    }

    public RawGrid readWorkbook(InputStream content) {
        try (Workbook workbook = WorkbookFactory.create(content)) {
            if (workbook.getNumberOfSheets() == 0) {
                return new RawGrid(null, List.of());
            }
            Sheet sheet = workbook.getSheetAt(0);
            List<List<Object>> rows = new ArrayList<>();
            for (int r = 0; r <= sheet.getLastRowNum(); r++) {
                rows.add(readRow(sheet.getRow(r)));
            }
            return new RawGrid(sheet.getSheetName(), trimTrailingEmptyRows(rows));
        } catch (IOException | RuntimeException e) {
            throw new GridReadException("Failed to read workbook: " + e.getMessage(), e);
        }
    }

    public RawGrid readCsv(String fileName, InputStream content) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setIgnoreEmptyLines(false)
                .build();
        try (Reader reader = new InputStreamReader(content, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            List<List<Object>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                List<Object> row = new ArrayList<>(record.size());
                for (String value : record) {
                    row.add(value == null || value.isEmpty() ? null : value);
                }
                rows.add(row);
            }
            stripByteOrderMark(rows);
            return new RawGrid(sheetNameOf(fileName), trimTrailingEmptyRows(rows));
        } catch (IOException | RuntimeException e) {
            throw new GridReadException("Failed to read CSV: " + e.getMessage(), e);
        }
    }

    private static List<Object> readRow(Row row) {
        if (row == null || row.getLastCellNum() < 0) {
            return List.of();
        }
        List<Object> cells = new ArrayList<>(row.getLastCellNum());
        for (int c = 0; c < row.getLastCellNum(); c++) {
            cells.add(cellValue(row.getCell(c)));
        }
        return cells;
    }

    private static Object cellValue(Cell cell) {
        if (cell == null) return null;
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        switch (type) {
            case STRING:
                String text = cell.getStringCellValue();
                return text == null || text.isEmpty() ? null : text;
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                return cell.getNumericCellValue();
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }

    private static void stripByteOrderMark(List<List<Object>> rows) {
        if (rows.isEmpty() || rows.get(0).isEmpty()) return;
        if (rows.get(0).get(0) instanceof String first && !first.isEmpty() && first.charAt(0) == BYTE_ORDER_MARK) {
            String rest = first.substring(1);
            rows.get(0).set(0, rest.isEmpty() ? null : rest);
        }
    }

    private static List<List<Object>> trimTrailingEmptyRows(List<List<Object>> rows) {
        int end = rows.size();
        while (end > 0 && rows.get(end - 1).stream().allMatch(v -> v == null)) {
            end--;
        }
        return rows.subList(0, end);
    }

    private static String sheetNameOf(String fileName) {
        if (fileName == null || fileName.isBlank()) return "Sheet1";
        String name = fileName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
