package com.eainde.xrf.io;

import com.eainde.xrf.exception.GridReadException;
import com.eainde.xrf.model.RawGrid;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpreadsheetGridReaderTest {

    private final SpreadsheetGridReader reader = new SpreadsheetGridReader();

    @Test
    @DisplayName("isCsvFileName() looks at the extension only")
    void csvFileName() {
        assertThat(SpreadsheetGridReader.isCsvFileName("export.CSV")).isTrue();
        assertThat(SpreadsheetGridReader.isCsvFileName("export.xlsx")).isFalse();
        assertThat(SpreadsheetGridReader.isCsvFileName(null)).isFalse();
    }

    @Nested
    @DisplayName("CSV")
    class Csv {

        @Test
        @DisplayName("keeps cells as text, blank cells as null and drops the byte order mark")
        void textCells() {
            String csv = "\uFEFFReading #,Component,Color,PbC\r\n"
                    + "1,Door,White,0.4\r\n"
                    + "2,\"Window, Sill\",,<0.1\r\n"
                    + "\r\n";

            RawGrid grid = reader.read("uploads/job-17 units.csv", stream(csv));

            assertThat(grid.sheetName()).isEqualTo("job-17 units");
            assertThat(grid.rowCount()).isEqualTo(3);
            assertThat(grid.row(0)).containsExactly("Reading #", "Component", "Color", "PbC");
            assertThat(grid.row(1)).containsExactly("1", "Door", "White", "0.4");
            assertThat(grid.row(2)).containsExactly("2", "Window, Sill", null, "<0.1");
        }

        @Test
        @DisplayName("keeps blank lines between rows")
        void blankLines() {
            RawGrid grid = reader.read("a.csv", stream("Meta\n\nReading #,Component\n1,Door\n"));

            assertThat(grid.rowCount()).isEqualTo(4);
            assertThat(grid.row(1)).containsOnlyNulls();
        }
    }

    @Nested
    @DisplayName("workbook")
    class WorkbookFile {

        @Test
        @DisplayName("preserves numbers, booleans, dates and cached formula results")
        void cellTypes() throws IOException {
            byte[] bytes;
            try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
                Sheet sheet = workbook.createSheet("Readings");
                Row header = sheet.createRow(0);
                header.createCell(0).setCellValue("Reading #");
                header.createCell(1).setCellValue("Component");
                header.createCell(2).setCellValue("Result");
                header.createCell(3).setCellValue("Date");
                header.createCell(4).setCellValue("PbC");

                CellStyle dateStyle = workbook.createCellStyle();
                dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd hh:mm"));

                Row data = sheet.createRow(1);
                data.createCell(0).setCellValue(7);
                data.createCell(1).setCellValue("Door");
                data.createCell(2).setCellValue(true);
                data.createCell(3).setCellValue(LocalDateTime.of(2024, 5, 1, 9, 30));
                data.getCell(3).setCellStyle(dateStyle);
                data.createCell(4).setCellFormula("A2/10");

                workbook.getCreationHelper().createFormulaEvaluator().evaluateAll();
                workbook.write(out);
                bytes = out.toByteArray();
            }

            RawGrid grid = reader.read("job.xlsx", new ByteArrayInputStream(bytes));

            assertThat(grid.sheetName()).isEqualTo("Readings");
            assertThat(grid.rowCount()).isEqualTo(2);
            assertThat(grid.row(1)).containsExactly(7.0, "Door", true, LocalDateTime.of(2024, 5, 1, 9, 30), 0.7);
        }

        @Test
        @DisplayName("missing cells inside a row read as null")
        void sparseRow() throws IOException {
            byte[] bytes;
            try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
                Row row = workbook.createSheet().createRow(0);
                row.createCell(0).setCellValue("a");
                row.createCell(2).setCellValue("c");
                workbook.write(out);
                bytes = out.toByteArray();
            }

            RawGrid grid = reader.readWorkbook(new ByteArrayInputStream(bytes));

            assertThat(grid.row(0)).isEqualTo(Arrays.asList("a", null, "c"));
        }

        @Test
        @DisplayName("unreadable content is a GridReadException")
        void garbage() {
            assertThatThrownBy(() -> reader.read("job.xlsx", stream("not a workbook")))
                    .isInstanceOf(GridReadException.class)
                    .hasMessageStartingWith("Failed to read workbook");
        }
    }

    private static ByteArrayInputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
