package org.sheetrenamer.controller;

import static org.sheetrenamer.model.util.Constants.*;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.Logger;
import org.sheetrenamer.controller.util.FileUtilities;
import org.sheetrenamer.model.ExecutionResult;
import org.sheetrenamer.model.NameComparison;
import org.sheetrenamer.model.OperationOutcome;
import org.sheetrenamer.model.PlannedOperation;
import org.sheetrenamer.model.RenameSettings;

/**
 * Writes the plain-text record of one rename pass.
 *
 * <p>The log is the only lasting record of what a pass did, and other tools
 * read it, so the layout below must not drift:
 *
 * <pre>
 * SHEETRENAMER - Rename Log
 * ======================================================================
 * Timestamp: 2026-10-17 14:03:22
 *
 * Mapping: ...
 * Target: ...
 * Mode: Prefix | Delimiter: '-' | Extension: .pdf
 * Matching: Strict Current_Filename (Column B) matching
 * Name comparison: CASE_SENSITIVE
 * ======================================================================
 *
 * ...one line group per row...
 *
 * ======================================================================
 * SUMMARY
 * ======================================================================
 * Renamed: 1 | Errors: 1 | Skipped: 3
 * Total processed: 5
 * </pre>
 *
 * <p>Every line group is flushed as soon as it is written, so a pass that
 * dies part way through still leaves a usable log behind.
 */
public class AuditLogWriter implements Closeable {

    private static final Logger logger = Logger.getLogger(
        AuditLogWriter.class.getName()
    );

    static final String RULE = "=".repeat(70);
    static final String TITLE =
        APPLICATION_NAME.toUpperCase(Locale.ROOT) + " - Rename Log";
    static final String PREVIEW_SUFFIX = " (PREVIEW / DRY RUN)";
    static final String MATCHING_DESCRIPTION =
        "Strict " + CURRENT_FILENAME_COLUMN + " (Column B) matching";

    private static final DateTimeFormatter FILE_STAMP =
        DateTimeFormatter.ofPattern(ARTIFACT_TIMESTAMP_PATTERN);
    private static final DateTimeFormatter HEADER_STAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path file;
    private final BufferedWriter out;

    private AuditLogWriter(final Path file, final BufferedWriter out) {
        this.file = file;
        this.out = out;
    }

    /**
     * Create a new log file named after the time of the pass in the given
     * folder.  An existing file is never overwritten.
     *
     * @param targetFolder the folder the pass works in
     * @param when         the time of the pass
     * @return an open writer
     * @throws IOException if the file cannot be created
     */
    public static AuditLogWriter create(
        final Path targetFolder,
        final LocalDateTime when
    ) throws IOException {
        Path logFile = FileUtilities.unusedPath(
            targetFolder,
            LOG_FILE_PREFIX,
            FILE_STAMP.format(when),
            LOG_FILE_SUFFIX
        );
        BufferedWriter writer = Files.newBufferedWriter(
            logFile,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE_NEW,
            StandardOpenOption.WRITE
        );
        logger.fine("writing rename log " + logFile);
        return new AuditLogWriter(logFile, writer);
    }

    public Path getFile() {
        return file;
    }

    /**
     * Write the title and the run parameters.
     *
     * @param settings    the pass settings
     * @param mappingFile the workbook actually read; may differ from the
     *                    settings when it was found automatically
     * @param when        the time of the pass
     * @param backup      the backup made for the pass, or null
     * @throws IOException if writing fails
     */
    public void writeHeader(
        final RenameSettings settings,
        final Path mappingFile,
        final LocalDateTime when,
        final BackupCreator.Result backup
    ) throws IOException {
        line(TITLE + (settings.isDryRun() ? PREVIEW_SUFFIX : ""));
        line(RULE);
        line("Timestamp: " + HEADER_STAMP.format(when));
        line("");
        line("Mapping: " + mappingFile);
        line("Target: " + settings.getTargetFolder());
        line(
            "Mode: " +
                settings.getMode() +
                " | Delimiter: '" +
                settings.getDelimiter() +
                "' | Extension: " +
                settings.getExtension()
        );
        line("Matching: " + MATCHING_DESCRIPTION);
        line("Name comparison: " + describe(settings.getNameComparison()));
        if (backup != null) {
            line(
                "Backup: " +
                    backup.directory() +
                    " (copied " +
                    backup.copiedCount() +
                    ", failed " +
                    backup.failedCount() +
                    ")"
            );
        }
        line(RULE);
        line("");
        out.flush();
    }

    /**
     * Write the line group for one row.
     *
     * @param outcome what happened to the row
     * @throws IOException if writing fails
     */
    public void writeOutcome(final OperationOutcome outcome) throws IOException {
        PlannedOperation op = outcome.operation();
        switch (outcome.kind()) {
            case RENAMED:
            case WOULD_RENAME:
                line("✓ " + op.oldName());
                line("  → " + op.newName());
                if (op.hasNote()) {
                    line("  User Note: " + op.note());
                }
                line("");
                break;
            case ERROR:
                line("✗ " + op.oldName());
                line("  ERROR: " + outcome.detail());
                line("");
                break;
            case SKIPPED:
            default:
                writeSkip(op);
                break;
        }
        out.flush();
    }

    private void writeSkip(final PlannedOperation op) throws IOException {
        switch (op.status()) {
            case SKIP_EMPTY_KEY:
                line(
                    "⚠ Row " +
                        op.rowNumber() +
                        ": Empty " +
                        CURRENT_FILENAME_COLUMN +
                        " (skipped)"
                );
                break;
            case SKIP_NOT_FOUND:
                line(
                    "⚠ Row " +
                        op.rowNumber() +
                        ": File not found: '" +
                        op.sourceKey() +
                        "' (skipped)"
                );
                break;
            case NO_CHANGE:
            default:
                line("○ " + op.oldName() + " (no change)");
                break;
        }
    }

    /**
     * Write the closing counts.
     *
     * @param result the finished pass
     * @throws IOException if writing fails
     */
    public void writeSummary(final ExecutionResult result) throws IOException {
        line(RULE);
        line("SUMMARY");
        line(RULE);
        line(
            "Renamed: " +
                result.getRenamedCount() +
                " | Errors: " +
                result.getErrorCount() +
                " | Skipped: " +
                result.getSkippedCount()
        );
        line("Total processed: " + result.getTotalProcessed());
        if (result.isDryRun()) {
            line("Would rename: " + result.getWouldRenameCount());
        }
        out.flush();
    }

    private static String describe(final NameComparison comparison) {
        if (comparison == NameComparison.PLATFORM) {
            return comparison.name() + " (" + comparison.resolve().name() + ")";
        }
        return comparison.name();
    }

    private void line(final String text) throws IOException {
        out.write(text);
        out.newLine();
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
