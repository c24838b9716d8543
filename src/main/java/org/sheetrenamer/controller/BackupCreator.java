package org.sheetrenamer.controller;

import static org.sheetrenamer.model.util.Constants.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.sheetrenamer.controller.util.FileUtilities;
import org.sheetrenamer.model.FileEntry;

/**
 * Copies every listed file into a timestamped folder inside the target
 * folder before a live rename pass.
 *
 * <p>This is a best-effort safety net: a file that cannot be copied is
 * logged and counted, and the pass goes ahead anyway.
 */
public class BackupCreator {

    private static final Logger logger = Logger.getLogger(
        BackupCreator.class.getName()
    );

    private static final DateTimeFormatter STAMP =
        DateTimeFormatter.ofPattern(ARTIFACT_TIMESTAMP_PATTERN);

    /**
     * What a backup did.
     *
     * @param directory   the backup folder
     * @param copiedCount files copied
     * @param failedCount files that could not be copied
     */
    public record Result(Path directory, int copiedCount, int failedCount) {
        public boolean isComplete() {
            return failedCount == 0;
        }
    }

    /**
     * Copy the files.  A file in a sub-folder of {@code targetFolder} keeps
     * its relative path inside the backup folder.
     *
     * @param targetFolder the folder being renamed in
     * @param files        the listing for this pass
     * @param when         the time of the pass; names the backup folder
     * @return the backup folder and the counts
     * @throws IOException if the backup folder itself cannot be created
     */
    public Result createBackup(
        final Path targetFolder,
        final List<FileEntry> files,
        final LocalDateTime when
    ) throws IOException {
        Path backupDir = FileUtilities.unusedPath(
            targetFolder,
            BACKUP_DIR_PREFIX,
            STAMP.format(when),
            ""
        );
        Files.createDirectories(backupDir);
        logger.info("backing up " + files.size() + " files to " + backupDir);

        int copied = 0;
        int failed = 0;
        for (FileEntry entry : files) {
            Path dest = backupDir.resolve(relativeName(targetFolder, entry));
            try {
                FileUtilities.copyPreservingAttributes(entry.fullPath(), dest);
                copied++;
            } catch (IOException | SecurityException e) {
                failed++;
                logger.log(
                    Level.WARNING,
                    "could not back up " + entry.fullPath(),
                    e
                );
            }
        }

        if (failed > 0) {
            logger.warning(
                "backup incomplete: " + failed + " of " + files.size() + " failed"
            );
        }
        return new Result(backupDir, copied, failed);
    }

    private static Path relativeName(final Path targetFolder, final FileEntry entry) {
        Path file = entry.fullPath();
        if (file.startsWith(targetFolder)) {
            return targetFolder.relativize(file);
        }
        return file.getFileName();
    }
}
