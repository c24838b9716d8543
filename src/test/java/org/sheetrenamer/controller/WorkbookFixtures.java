package org.sheetrenamer.controller;

import static org.sheetrenamer.model.util.Constants.*;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Writes small workbooks for tests.  Cell values may be String, Number or
 * null (no cell at all).
 */
final class WorkbookFixtures {

    static final String[] STANDARD_HEADER = {
        ROW_COLUMN,
        CURRENT_FILENAME_COLUMN,
        PREFIX_COLUMN,
        NEW_FILENAME_COLUMN,
        NOTES_COLUMN,
    };

    private WorkbookFixtures() {
        // utility
    }

    /**
     * Write a workbook with a "Rename Index" sheet in the standard layout.
     * Each row gives Current_Filename, Prefix, New_Filename and Notes; the
     * Row column is filled in.
     */
    static Path renameIndex(Path dest, String[]... rows) throws IOException {
        Object[][] full = new Object[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            full[i] = new Object[rows[i].length + 1];
            full[i][0] = i + 1;
            System.arraycopy(rows[i], 0, full[i], 1, rows[i].length);
        }
        return workbook(dest, RENAME_SHEET_NAME, STANDARD_HEADER, full);
    }

    static Path workbook(Path dest, String sheetName, String[] header, Object[]... rows)
        throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(sheetName);
            Row headerRow = sheet.createRow(0);
            for (int c = 0; c < header.length; c++) {
                headerRow.createCell(c).setCellValue(header[c]);
            }
            for (int r = 0; r < rows.length; r++) {
                Object[] values = rows[r];
                if (values == null) {
                    continue;
                }
                Row row = sheet.createRow(r + 1);
                for (int c = 0; c < values.length; c++) {
                    set(row, c, values[c]);
                }
            }
            save(workbook, dest);
        }
        return dest;
    }

    /**
     * Write a workbook whose Prefix cell holds the number 1 shown as "001".
     */
    static Path zeroPaddedNumericPrefix(Path dest, String currentName)
        throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(RENAME_SHEET_NAME);
            Row header = sheet.createRow(0);
            for (int c = 0; c < STANDARD_HEADER.length; c++) {
                header.createCell(c).setCellValue(STANDARD_HEADER[c]);
            }
            CellStyle padded = workbook.createCellStyle();
            padded.setDataFormat(workbook.createDataFormat().getFormat("000"));

            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue(1);
            row.createCell(1).setCellValue(currentName);
            Cell prefix = row.createCell(2);
            prefix.setCellValue(1);
            prefix.setCellStyle(padded);
            row.createCell(3).setCellValue("Padded");
            save(workbook, dest);
        }
        return dest;
    }

    private static void set(Row row, int column, Object value) {
        if (value == null) {
            return;
        }
        Cell cell = row.createCell(column);
        if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else {
            cell.setCellValue(value.toString());
        }
    }

    private static void save(Workbook workbook, Path dest) throws IOException {
        Path parent = dest.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(dest)) {
            workbook.write(out);
        }
    }
}
