package org.sheetrenamer.controller;

import static org.sheetrenamer.model.util.Constants.*;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.sheetrenamer.controller.util.FileUtilities;
import org.sheetrenamer.model.FileEntry;

/**
 * Writes mapping workbooks for the user to fill in: one built from a scan
 * of the target folder, and a blank one with example rows.
 */
public class TemplateWriter {

    private static final Logger logger = Logger.getLogger(
        TemplateWriter.class.getName()
    );

    static final String[] HEADERS = {
        ROW_COLUMN,
        CURRENT_FILENAME_COLUMN,
        PREFIX_COLUMN,
        NEW_FILENAME_COLUMN,
        NOTES_COLUMN,
    };

    static final int MAX_COLUMN_CHARS = 50;

    private static final DateTimeFormatter NAME_DATE =
        DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter INSTRUCTION_DATE =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    /**
     * @param date the day the template is made
     * @return the suggested file name, e.g. "sheet-index-20261017.xlsx"
     */
    public static String defaultFileName(final LocalDate date) {
        return TEMPLATE_PREFIX + NAME_DATE.format(date) + TEMPLATE_SUFFIX;
    }

    /**
     * Write a template with one row per listed file.  Prefix is the row
     * number padded to three digits and New_Filename starts out as the
     * current stem, so running the template unedited in Prefix mode numbers
     * the files in listing order.
     *
     * @param dest      where to write the workbook
     * @param files     the listing of the target folder
     * @param extension the configured extension
     * @param when      the time of the scan, shown on the Instructions sheet
     * @throws IOException if the workbook cannot be written
     */
    public void writeScanTemplate(
        final Path dest,
        final List<FileEntry> files,
        final String extension,
        final LocalDateTime when
    ) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(RENAME_SHEET_NAME);
            writeHeader(sheet);
            int n = 1;
            for (FileEntry entry : files) {
                writeRow(
                    sheet,
                    n,
                    entry.baseName(),
                    String.format("%03d", n),
                    FileUtilities.stem(entry.baseName(), extension),
                    ""
                );
                n++;
            }
            fitColumns(sheet);

            writeInstructions(
                workbook,
                new String[] {
                    APPLICATION_NAME.toUpperCase(Locale.ROOT) + " - INSTRUCTIONS",
                    "",
                    "CRITICAL: Column B (" +
                        CURRENT_FILENAME_COLUMN +
                        ") is used to match files!",
                    "",
                    "HOW TO USE:",
                    "1. Edit columns C, D, E as needed",
                    "2. Column B: " +
                        CURRENT_FILENAME_COLUMN +
                        " (MUST match an existing file exactly)",
                    "3. Column C: " + PREFIX_COLUMN + " (used in Prefix mode)",
                    "4. Column D: " +
                        NEW_FILENAME_COLUMN +
                        " (primary rename value)",
                    "5. Column E: " + NOTES_COLUMN + " (written to the rename log)",
                    "",
                    "Do not change Column B unless the file was renamed outside this program.",
                    "",
                    "Prefix mode: <Prefix><Delimiter><New_Filename><ext>",
                    "Replace mode: <New_Filename><ext>",
                    "",
                    "Scanned: " + files.size() + " files",
                    "Extension: " + extension,
                    "Date: " + INSTRUCTION_DATE.format(when),
                }
            );
            save(workbook, dest);
        }
        logger.info(
            "wrote template with " + files.size() + " rows to " + dest
        );
    }

    /**
     * Write a template with three example rows.
     *
     * @param dest where to write the workbook
     * @throws IOException if the workbook cannot be written
     */
    public void writeBlankTemplate(final Path dest) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(RENAME_SHEET_NAME);
            writeHeader(sheet);
            String[] letters = { "A", "B", "C" };
            for (int n = 1; n <= letters.length; n++) {
                writeRow(
                    sheet,
                    n,
                    "example" + n + DEFAULT_EXTENSION,
                    String.format("%03d", n),
                    "Document-" + letters[n - 1],
                    ""
                );
            }
            fitColumns(sheet);

            writeInstructions(
                workbook,
                new String[] {
                    APPLICATION_NAME.toUpperCase(Locale.ROOT) + " - BLANK TEMPLATE",
                    "Fill Column B with exact filenames that exist in your folder!",
                }
            );
            save(workbook, dest);
        }
        logger.info("wrote blank template to " + dest);
    }

    private static void writeHeader(final Sheet sheet) {
        Row header = sheet.createRow(0);
        for (int i = 0; i < HEADERS.length; i++) {
            header.createCell(i).setCellValue(HEADERS[i]);
        }
    }

    private static void writeRow(
        final Sheet sheet,
        final int n,
        final String currentName,
        final String prefix,
        final String newName,
        final String note
    ) {
        Row row = sheet.createRow(n);
        row.createCell(0).setCellValue(n);
        row.createCell(1).setCellValue(currentName);
        // Text, so that "001" keeps its zeros.
        row.createCell(2).setCellValue(prefix);
        row.createCell(3).setCellValue(newName);
        row.createCell(4).setCellValue(note);
    }

    private static void fitColumns(final Sheet sheet) {
        int[] widest = new int[HEADERS.length];
        for (Row row : sheet) {
            for (Cell cell : row) {
                int col = cell.getColumnIndex();
                if (col < widest.length) {
                    int len = cellText(cell).length();
                    widest[col] = Math.max(widest[col], len);
                }
            }
        }
        for (int col = 0; col < widest.length; col++) {
            int chars = Math.min(widest[col] + 2, MAX_COLUMN_CHARS);
            // POI widths are in 1/256ths of a character.
            sheet.setColumnWidth(col, chars * 256);
        }
    }

    private static String cellText(final Cell cell) {
        switch (cell.getCellType()) {
            case NUMERIC:
                return Long.toString((long) cell.getNumericCellValue());
            case STRING:
                return cell.getStringCellValue();
            default:
                return "";
        }
    }

    private static void writeInstructions(
        final Workbook workbook,
        final String[] lines
    ) {
        Sheet sheet = workbook.createSheet(INSTRUCTIONS_SHEET_NAME);
        for (int i = 0; i < lines.length; i++) {
            sheet.createRow(i).createCell(0).setCellValue(lines[i]);
        }
        sheet.setColumnWidth(0, 90 * 256);
    }

    private static void save(final Workbook workbook, final Path dest)
        throws IOException {
        Path parent = dest.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(dest)) {
            workbook.write(out);
        }
    }
}
