package org.sheetrenamer.controller;

/**
 * The mapping workbook cannot be used: it is missing, locked by another
 * program, unreadable, or lacks the expected sheet or columns.
 *
 * <p>Raised before any planning happens; the pass is abandoned.
 */
public class MappingSourceException extends Exception {

    private static final long serialVersionUID = 1L;

    public MappingSourceException(String message) {
        super(message);
    }

    public MappingSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
