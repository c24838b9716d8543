package org.sheetrenamer.model;

import java.util.Locale;

/**
 * How the New_Filename and Prefix columns combine into the proposed name.
 *
 * <p>PREFIX builds {@code <Prefix><Delimiter><New_Filename><ext>}; REPLACE
 * builds {@code <New_Filename><ext>} and ignores the prefix column.
 */
public enum RenameMode {
    PREFIX("Prefix"),
    REPLACE("Replace");

    private final String label;

    RenameMode(String label) {
        this.label = label;
    }

    /**
     * @return human-readable label suitable for UI display and the audit log.
     */
    @Override
    public String toString() {
        return label;
    }

    /**
     * Parse a string value (case-insensitive) and return a matching RenameMode.
     *
     * @param value textual representation (e.g., "replace")
     * @return matching RenameMode, or null if no match is found
     */
    public static RenameMode fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        String upper = normalized.toUpperCase(Locale.ROOT);
        for (RenameMode mode : values()) {
            if (
                mode.name().equals(upper) ||
                mode.label.toUpperCase(Locale.ROOT).equals(upper)
            ) {
                return mode;
            }
        }
        return null;
    }
}
