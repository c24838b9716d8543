package org.sheetrenamer.model.util;

import static org.sheetrenamer.model.util.Environment.*;

import java.nio.file.Path;
import java.nio.file.Paths;

public class Constants {

    public static final String APPLICATION_NAME = "SheetRenamer";
    public static final String VERSION_NUMBER = Environment.readVersionNumber();

    public static final String LOGGING_PROPERTIES = "/logging.properties";

    public static final Path CONFIGURATION_DIRECTORY = Paths.get(
        USER_HOME,
        ".sheetrenamer"
    );
    public static final Path PREFERENCES_FILE =
        CONFIGURATION_DIRECTORY.resolve("prefs.xml");

    // Workbook layout
    public static final String RENAME_SHEET_NAME = "Rename Index";
    public static final String INSTRUCTIONS_SHEET_NAME = "Instructions";
    public static final String ROW_COLUMN = "Row";
    public static final String CURRENT_FILENAME_COLUMN = "Current_Filename";
    public static final String PREFIX_COLUMN = "Prefix";
    public static final String NEW_FILENAME_COLUMN = "New_Filename";
    public static final String NOTES_COLUMN = "Notes";
    public static final String TEMPLATE_PREFIX = "sheet-index-";
    public static final String TEMPLATE_SUFFIX = ".xlsx";

    // Artifacts written into the target folder
    public static final String LOG_FILE_PREFIX = "rename_log_";
    public static final String LOG_FILE_SUFFIX = ".txt";
    public static final String BACKUP_DIR_PREFIX = "backup_";
    public static final String ARTIFACT_TIMESTAMP_PATTERN = "yyyyMMdd_HHmmss";

    // Defaults
    public static final String DEFAULT_EXTENSION = ".pdf";
    public static final String DEFAULT_DELIMITER = "-";
    public static final String[] DELIMITER_PRESETS = { "-", "_", " ", "" };

    // UI text
    public static final String ERROR_LABEL = "Error";
    public static final String SOURCE_LOCKED_TITLE = "Mapping File Unavailable";
    public static final String CONFIRM_RENAME_TITLE = "Confirm Rename";
    public static final String CONFIRM_RENAME_MESSAGE =
        "Are you sure you want to rename the files?\n\n" +
        "This cannot be undone unless you created a backup.";
    public static final String READY_STATUS =
        "Ready - drop a template or use Scan to create one";
    public static final String MAPPING_FILTER_NAMES = "Excel files";
    public static final String MAPPING_FILTER_EXTENSIONS =
        "*.xlsx;*.xls;*.xlsm";
}
