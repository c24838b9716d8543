package org.sheetrenamer.controller;

import static org.sheetrenamer.model.util.Constants.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.sheetrenamer.model.FileEntry;

/**
 * Lists the files in the target folder that carry the configured extension.
 *
 * <p>Every call reads the directory again; listings are never kept.
 */
public class FileLister {

    private static final Logger logger = Logger.getLogger(
        FileLister.class.getName()
    );

    private static final Pattern BACKUP_DIR_PATTERN = Pattern.compile(
        Pattern.quote(BACKUP_DIR_PREFIX) + "\\d{8}_\\d{6}(_\\d+)?"
    );

    /**
     * List regular files whose name ends with {@code extension}.
     *
     * <p>The suffix test is case-sensitive: ".pdf" does not pick up "A.PDF".
     *
     * @param folder    the target folder
     * @param extension the suffix to look for, e.g. ".pdf"
     * @param recursive whether to descend into sub-folders
     * @return the files, sorted by path
     * @throws IOException if the folder cannot be read
     */
    public List<FileEntry> listFiles(
        final Path folder,
        final String extension,
        final boolean recursive
    ) throws IOException {
        List<Path> found;
        if (recursive) {
            try (Stream<Path> walk = Files.walk(folder)) {
                found = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> hasExtension(p, extension))
                    .filter(p -> !isInsideBackup(folder, p))
                    .collect(Collectors.toList());
            } catch (UncheckedIOException uioe) {
                throw uioe.getCause();
            }
        } else {
            found = new ArrayList<>();
            try (DirectoryStream<Path> files = Files.newDirectoryStream(folder)) {
                for (Path p : files) {
                    if (Files.isRegularFile(p) && hasExtension(p, extension)) {
                        found.add(p);
                    }
                }
            }
        }

        found.sort(Comparator.comparing(Path::toString));
        List<FileEntry> entries = new ArrayList<>(found.size());
        for (Path p : found) {
            entries.add(FileEntry.of(p));
        }
        logger.fine(
            "listed " +
                entries.size() +
                " '" +
                extension +
                "' files in " +
                folder +
                (recursive ? " (recursive)" : "")
        );
        return entries;
    }

    /**
     * Backups this program made earlier live inside the target folder; a
     * recursive listing must not offer those copies up for renaming.
     */
    private static boolean isInsideBackup(final Path folder, final Path p) {
        Path relative = folder.relativize(p);
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (BACKUP_DIR_PATTERN.matcher(relative.getName(i).toString()).matches()) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasExtension(final Path p, final String extension) {
        Path name = p.getFileName();
        return name != null && name.toString().endsWith(extension);
    }
}
