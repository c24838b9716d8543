package org.sheetrenamer.controller;

import org.sheetrenamer.controller.util.FileUtilities;
import org.sheetrenamer.model.RenameIntent;
import org.sheetrenamer.model.RenameMode;

/**
 * Computes the proposed file name for a matched row.  Pure: the result
 * depends on the arguments only.
 *
 * <ul>
 *   <li>PREFIX with a prefix: {@code prefix + delimiter + base}, where base is
 *       New_Filename, or the current stem if New_Filename is empty</li>
 *   <li>PREFIX without a prefix, and REPLACE: New_Filename, or the current
 *       stem if New_Filename is empty; the delimiter is not used</li>
 * </ul>
 *
 * The extension is appended unless the stem already ends with it.
 */
public final class NameGenerator {

    private NameGenerator() {
        // utility
    }

    /**
     * @param intent      the row
     * @param matchedName current name of the matched file, with extension
     * @param mode        PREFIX or REPLACE
     * @param extension   the configured extension, e.g. ".pdf"
     * @param delimiter   placed between prefix and base; "" concatenates directly
     * @return the proposed file name, with extension
     */
    public static String generate(
        final RenameIntent intent,
        final String matchedName,
        final RenameMode mode,
        final String extension,
        final String delimiter
    ) {
        final String currentStem = FileUtilities.stem(matchedName, extension);
        final String base = intent.newBase().isEmpty()
            ? currentStem
            : intent.newBase();

        final String stem;
        if (mode == RenameMode.PREFIX && !intent.prefix().isEmpty()) {
            stem = intent.prefix() + delimiter + base;
        } else {
            stem = base;
        }

        if (stem.endsWith(extension)) {
            return stem;
        }
        return stem + extension;
    }

    /**
     * A generated name must name an entry of the matched file's own folder:
     * no separators, no {@code .} or {@code ..}, no NUL.
     *
     * @param name a name returned by {@link #generate}
     * @return true if the name can be used as a sibling of the current file
     */
    public static boolean isPlainFileName(final String name) {
        if (name.isEmpty() || ".".equals(name) || "..".equals(name)) {
            return false;
        }
        return name.indexOf('/') < 0 &&
            name.indexOf('\\') < 0 &&
            name.indexOf('\0') < 0;
    }
}
