package org.sheetrenamer.controller;

import static org.sheetrenamer.model.util.Constants.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.sheetrenamer.controller.util.FileUtilities;
import org.sheetrenamer.model.RenameIntent;

/**
 * Reads rename rows from the "Rename Index" sheet of a workbook.
 *
 * <p>Columns are found by their header text, so users may reorder them.
 * Current_Filename is required; Prefix, New_Filename and Notes may be
 * missing, in which case they read as empty.
 *
 * <p>The workbook is opened, read completely and closed inside every call
 * to {@link #readRows()}.  This object only remembers the path.
 */
public class SpreadsheetRowSource implements RowSource {

    private static final Logger logger = Logger.getLogger(
        SpreadsheetRowSource.class.getName()
    );

    private static final int NO_COLUMN = -1;

    private final Path workbookPath;

    public SpreadsheetRowSource(final Path workbookPath) {
        this.workbookPath = workbookPath;
    }

    @Override
    public List<RenameIntent> readRows() throws MappingSourceException {
        checkAvailable(workbookPath);

        try (
            InputStream in = Files.newInputStream(workbookPath);
            Workbook workbook = WorkbookFactory.create(in)
        ) {
            Sheet sheet = workbook.getSheet(RENAME_SHEET_NAME);
            if (sheet == null) {
                throw new MappingSourceException(
                    "The workbook must contain a sheet named '" +
                        RENAME_SHEET_NAME +
                        "': " +
                        workbookPath
                );
            }
            FormulaEvaluator evaluator = workbook
                .getCreationHelper()
                .createFormulaEvaluator();
            List<RenameIntent> rows = readSheet(sheet, evaluator);
            logger.fine(
                "read " + rows.size() + " rows from " + workbookPath
            );
            return rows;
        } catch (
            EncryptedDocumentException
            | POIXMLException
            | IllegalArgumentException e
        ) {
            throw new MappingSourceException(
                "Could not read the workbook " +
                    workbookPath +
                    ": " +
                    e.getMessage(),
                e
            );
        } catch (IOException ioe) {
            logger.log(Level.WARNING, "error reading " + workbookPath, ioe);
            throw new MappingSourceException(
                "Could not read the workbook " +
                    workbookPath +
                    ": " +
                    ioe.getMessage(),
                ioe
            );
        }
    }

    private static List<RenameIntent> readSheet(
        final Sheet sheet,
        final FormulaEvaluator evaluator
    ) throws MappingSourceException {
        DataFormatter formatter = new DataFormatter();
        int headerIndex = sheet.getFirstRowNum();
        Row header = (headerIndex < 0) ? null : sheet.getRow(headerIndex);
        if (header == null) {
            throw new MappingSourceException(
                "The '" + RENAME_SHEET_NAME + "' sheet has no header row"
            );
        }

        Map<String, Integer> columns = new HashMap<>();
        for (Cell cell : header) {
            String title = formatter.formatCellValue(cell, evaluator).trim();
            if (!title.isEmpty()) {
                columns.putIfAbsent(
                    title.toLowerCase(Locale.ROOT),
                    cell.getColumnIndex()
                );
            }
        }

        int keyColumn = column(columns, CURRENT_FILENAME_COLUMN);
        if (keyColumn == NO_COLUMN) {
            throw new MappingSourceException(
                "The '" +
                    RENAME_SHEET_NAME +
                    "' sheet has no '" +
                    CURRENT_FILENAME_COLUMN +
                    "' column"
            );
        }
        int prefixColumn = column(columns, PREFIX_COLUMN);
        int newNameColumn = column(columns, NEW_FILENAME_COLUMN);
        int notesColumn = column(columns, NOTES_COLUMN);

        List<RenameIntent> rows = new ArrayList<>();
        int lastNonBlank = 0;
        for (int r = headerIndex + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            String key = text(row, keyColumn, formatter, evaluator);
            String prefix = text(row, prefixColumn, formatter, evaluator);
            String newName = text(row, newNameColumn, formatter, evaluator);
            String note = text(row, notesColumn, formatter, evaluator);

            rows.add(
                new RenameIntent(r - headerIndex, key, prefix, newName, note)
            );
            if (
                !(key.isEmpty() &&
                    prefix.isEmpty() &&
                    newName.isEmpty() &&
                    note.isEmpty())
            ) {
                lastNonBlank = rows.size();
            }
        }

        // Blank rows in the middle stay (they are reported as skipped), but
        // formatting left below the data does not produce rows.
        return new ArrayList<>(rows.subList(0, lastNonBlank));
    }

    private static int column(final Map<String, Integer> columns, final String name) {
        Integer index = columns.get(name.toLowerCase(Locale.ROOT));
        return (index == null) ? NO_COLUMN : index;
    }

    private static String text(
        final Row row,
        final int column,
        final DataFormatter formatter,
        final FormulaEvaluator evaluator
    ) {
        if (row == null || column == NO_COLUMN) {
            return "";
        }
        Cell cell = row.getCell(column);
        if (cell == null) {
            return "";
        }
        return formatter.formatCellValue(cell, evaluator).trim();
    }

    /**
     * Make sure the workbook exists and no other program has it locked.
     *
     * @param path the workbook
     * @throws MappingSourceException if the file cannot be used right now
     */
    public static void checkAvailable(final Path path)
        throws MappingSourceException {
        if (path == null) {
            throw new MappingSourceException("No mapping file selected");
        }
        if (!FileUtilities.isLocalPath(path.toString())) {
            throw new MappingSourceException(
                "Invalid or unsafe mapping file path: " + path
            );
        }
        if (Files.notExists(path)) {
            throw new MappingSourceException(
                "Mapping file does not exist: " + path
            );
        }
        if (!Files.isRegularFile(path)) {
            throw new MappingSourceException(
                "Mapping file is not a regular file: " + path
            );
        }

        // Spreadsheet programs hold a write lock on open workbooks; opening
        // for writing is how we notice that.
        try (
            FileChannel channel = FileChannel.open(
                path,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE
            )
        ) {
            logger.finest("mapping file is available: " + channel.size());
        } catch (AccessDeniedException ade) {
            if (Files.isWritable(path) || !Files.isReadable(path)) {
                throw locked(path, ade);
            }
            // A read-only file is fine; we never write to it.
            logger.fine("mapping file is read-only: " + path);
        } catch (FileSystemException fse) {
            throw locked(path, fse);
        } catch (IOException ioe) {
            throw new MappingSourceException(
                "Cannot access mapping file " + path + ": " + ioe.getMessage(),
                ioe
            );
        }
    }

    private static MappingSourceException locked(
        final Path path,
        final IOException cause
    ) {
        return new MappingSourceException(
            "The mapping file is currently open in Excel or another program.\n\n" +
                "Please close the file and try again.\n(" +
                path +
                ")",
            cause
        );
    }

    /**
     * @param path a candidate workbook
     * @return true if the file can be opened and has a "Rename Index" sheet
     */
    public static boolean hasRenameSheet(final Path path) {
        try (
            InputStream in = Files.newInputStream(path);
            Workbook workbook = WorkbookFactory.create(in)
        ) {
            return workbook.getSheet(RENAME_SHEET_NAME) != null;
        } catch (
            IOException
            | EncryptedDocumentException
            | POIXMLException
            | IllegalArgumentException e
        ) {
            logger.fine("not a usable template: " + path + " (" + e + ")");
            return false;
        }
    }
}
