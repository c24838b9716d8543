package org.sheetrenamer.controller;

import static org.sheetrenamer.model.util.Constants.*;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds a mapping workbook in the target folder when the user has not
 * chosen one.
 *
 * <p>Templates written by Scan ("sheet-index-*.xlsx") are preferred; any
 * other workbook is a fallback.  Within each group the most recently
 * modified one that has a "Rename Index" sheet wins.
 */
public class TemplateLocator {

    private static final Logger logger = Logger.getLogger(
        TemplateLocator.class.getName()
    );

    // Excel leaves "~$name.xlsx" lock files next to open workbooks.
    private static final String OFFICE_LOCK_PREFIX = "~$";

    /**
     * @param folder the target folder
     * @return the workbook to use, or empty if there is none
     */
    public Optional<Path> findTemplate(final Path folder) {
        List<Path> workbooks = new ArrayList<>();
        try (
            DirectoryStream<Path> entries = Files.newDirectoryStream(
                folder,
                "*" + TEMPLATE_SUFFIX
            )
        ) {
            for (Path p : entries) {
                String name = p.getFileName().toString();
                if (Files.isRegularFile(p) && !name.startsWith(OFFICE_LOCK_PREFIX)) {
                    workbooks.add(p);
                }
            }
        } catch (IOException ioe) {
            logger.log(Level.WARNING, "could not look for templates in " + folder, ioe);
            return Optional.empty();
        }

        workbooks.sort(
            Comparator.comparing(TemplateLocator::modifiedTime).reversed()
        );

        Optional<Path> found = firstUsable(workbooks, true);
        if (found.isEmpty()) {
            found = firstUsable(workbooks, false);
        }
        found.ifPresent(p -> logger.info("using template found in folder: " + p));
        return found;
    }

    private static Optional<Path> firstUsable(
        final List<Path> newestFirst,
        final boolean scanTemplatesOnly
    ) {
        for (Path p : newestFirst) {
            boolean isScanTemplate = p
                .getFileName()
                .toString()
                .startsWith(TEMPLATE_PREFIX);
            if (scanTemplatesOnly && !isScanTemplate) {
                continue;
            }
            if (SpreadsheetRowSource.hasRenameSheet(p)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    private static FileTime modifiedTime(final Path p) {
        try {
            return Files.getLastModifiedTime(p);
        } catch (IOException ioe) {
            logger.fine("no modification time for " + p + ": " + ioe);
            return FileTime.fromMillis(0L);
        }
    }
}
