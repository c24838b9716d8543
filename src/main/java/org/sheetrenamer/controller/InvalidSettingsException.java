package org.sheetrenamer.controller;

/**
 * The settings for a pass are unusable (no such target folder, bad
 * extension, non-local path).  Raised before any planning happens.
 */
public class InvalidSettingsException extends Exception {

    private static final long serialVersionUID = 1L;

    public InvalidSettingsException(String message) {
        super(message);
    }
}
