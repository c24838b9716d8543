package org.sheetrenamer.model;

/**
 * Classification of one row of a rename plan.
 */
public enum OperationStatus {
    RENAME("Rename"),
    NO_CHANGE("No change"),
    SKIP_EMPTY_KEY("Skipped: empty Current_Filename"),
    SKIP_NOT_FOUND("Skipped: file not found"),
    COLLISION("Collision: target exists"),
    INVALID_NAME("Error: invalid target name");

    private final String description;

    OperationStatus(String description) {
        this.description = description;
    }

    /**
     * @return text for the preview table
     */
    public String getDescription() {
        return description;
    }

    /**
     * @return true if the row never reached a file (empty key or not found)
     */
    public boolean isUnmatched() {
        return this == SKIP_EMPTY_KEY || this == SKIP_NOT_FOUND;
    }
}
