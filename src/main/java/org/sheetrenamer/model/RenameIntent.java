package org.sheetrenamer.model;

/**
 * One data row of the mapping sheet.
 *
 * <p>{@code sourceKey} is the Current_Filename column and is the only thing
 * used to find the file to rename. Text fields are never null.
 *
 * @param rowNumber 1-based position of the data row in the sheet
 * @param sourceKey exact name of the existing file; may be empty
 * @param prefix    the Prefix column; may be empty
 * @param newBase   the New_Filename column; may be empty
 * @param note      the Notes column; may be empty
 */
public record RenameIntent(
    int rowNumber,
    String sourceKey,
    String prefix,
    String newBase,
    String note
) {
    public RenameIntent {
        if (rowNumber < 1) {
            throw new IllegalArgumentException(
                "row number must be positive: " + rowNumber
            );
        }
        sourceKey = clean(sourceKey);
        prefix = clean(prefix);
        newBase = clean(newBase);
        note = clean(note);
    }

    private static String clean(final String value) {
        return (value == null) ? "" : value.trim();
    }

    public boolean hasSourceKey() {
        return !sourceKey.isEmpty();
    }
}
