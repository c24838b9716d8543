package org.sheetrenamer.model;

public enum UserPreference {
    MAPPING_FILE,
    TARGET_FOLDER,
    EXTENSION,
    RENAME_MODE,
    DELIMITER,
    BACKUP,
    RECURSIVE,
    AUTO_PULL,

    // How proposed names are compared against names already on disk.
    NAME_COMPARISON,
}
