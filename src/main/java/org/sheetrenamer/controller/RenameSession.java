package org.sheetrenamer.controller;

import static org.sheetrenamer.model.util.Constants.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;
import org.sheetrenamer.controller.util.FileUtilities;
import org.sheetrenamer.model.ExecutionResult;
import org.sheetrenamer.model.FileEntry;
import org.sheetrenamer.model.ProgressUpdater;
import org.sheetrenamer.model.RenameIntent;
import org.sheetrenamer.model.RenamePlan;
import org.sheetrenamer.model.RenameSettings;

/**
 * Runs one preview or rename pass from start to finish.
 *
 * <p>Every pass reads the workbook and lists the folder again, so edits the
 * user makes between passes (in the spreadsheet or in the folder) always
 * show up.  Nothing read during a pass outlives it.
 */
public class RenameSession {

    private static final Logger logger = Logger.getLogger(
        RenameSession.class.getName()
    );

    private final Function<Path, RowSource> rowSources;
    private final FileLister lister;
    private final TemplateLocator locator;
    private final BackupCreator backupCreator;
    private final Supplier<LocalDateTime> clock;

    public RenameSession() {
        this(
            SpreadsheetRowSource::new,
            new FileLister(),
            new TemplateLocator(),
            new BackupCreator(),
            LocalDateTime::now
        );
    }

    RenameSession(
        final Function<Path, RowSource> rowSources,
        final FileLister lister,
        final TemplateLocator locator,
        final BackupCreator backupCreator,
        final Supplier<LocalDateTime> clock
    ) {
        this.rowSources = rowSources;
        this.lister = lister;
        this.locator = locator;
        this.backupCreator = backupCreator;
        this.clock = clock;
    }

    /**
     * Check the parts of the settings that do not involve the workbook.
     *
     * @param settings the pass settings
     * @throws InvalidSettingsException if the pass cannot start
     */
    public static void validate(final RenameSettings settings)
        throws InvalidSettingsException {
        Path folder = settings.getTargetFolder();
        if (!FileUtilities.isLocalPath(folder.toString())) {
            throw new InvalidSettingsException(
                "Invalid or unsafe target folder path: " + folder
            );
        }
        if (!Files.isDirectory(folder)) {
            throw new InvalidSettingsException(
                "Target folder does not exist or is not a folder: " + folder
            );
        }
        String extension = settings.getExtension();
        if (
            extension.length() < 2 ||
            !extension.startsWith(".") ||
            extension.indexOf('/') >= 0 ||
            extension.indexOf('\\') >= 0
        ) {
            throw new InvalidSettingsException(
                "Extension must start with a dot, e.g. .pdf (got '" +
                    extension +
                    "')"
            );
        }
    }

    /**
     * Work out which workbook a pass reads: the chosen one, or, with
     * auto-pull on and nothing chosen, the newest template in the target
     * folder.
     *
     * @param settings the pass settings
     * @return the workbook path
     * @throws MappingSourceException if there is no workbook to use
     */
    public Path resolveMappingFile(final RenameSettings settings)
        throws MappingSourceException {
        Path chosen = settings.getMappingFile();
        if (chosen != null) {
            return chosen;
        }
        if (settings.isAutoPull()) {
            Optional<Path> found = locator.findTemplate(settings.getTargetFolder());
            if (found.isPresent()) {
                return found.get();
            }
            throw new MappingSourceException(
                "No mapping file selected, and no workbook with a '" +
                    RENAME_SHEET_NAME +
                    "' sheet was found in " +
                    settings.getTargetFolder()
            );
        }
        throw new MappingSourceException("No mapping file selected");
    }

    /**
     * Build the plan for the current state of the workbook and the folder.
     * Nothing is written anywhere.
     *
     * @param settings the pass settings
     * @return the plan
     * @throws InvalidSettingsException if the settings are unusable
     * @throws MappingSourceException if the workbook cannot be read
     * @throws IOException if the folder cannot be listed
     */
    public RenamePlan preview(final RenameSettings settings)
        throws InvalidSettingsException, MappingSourceException, IOException {
        validate(settings);
        Path mappingFile = resolveMappingFile(settings);
        return plan(settings, mappingFile, readFiles(settings));
    }

    /**
     * Run a pass: plan, back up (live runs only), rename, and write the
     * audit log.  With {@code settings.isDryRun()} nothing is renamed and
     * no backup is made, but the log is still written.
     *
     * @param settings the pass settings
     * @param updater  progress callback; may be null
     * @return the outcome of every row, with the log and backup locations
     * @throws InvalidSettingsException if the settings are unusable
     * @throws MappingSourceException if the workbook cannot be read
     * @throws IOException if the folder cannot be listed, or the backup
     *         folder or the audit log cannot be written
     */
    public ExecutionResult run(
        final RenameSettings settings,
        final ProgressUpdater updater
    ) throws InvalidSettingsException, MappingSourceException, IOException {
        validate(settings);
        final Path mappingFile = resolveMappingFile(settings);
        final List<FileEntry> files = readFiles(settings);
        final RenamePlan renamePlan = plan(settings, mappingFile, files);
        final LocalDateTime when = clock.get();

        BackupCreator.Result backup = null;
        if (settings.isBackup() && !settings.isDryRun()) {
            backup = backupCreator.createBackup(
                settings.getTargetFolder(),
                files,
                when
            );
        }

        try (
            AuditLogWriter auditLog = AuditLogWriter.create(
                settings.getTargetFolder(),
                when
            )
        ) {
            auditLog.writeHeader(settings, mappingFile, when, backup);
            RenameExecutor executor = new RenameExecutor(updater, auditLog);
            ExecutionResult result = executor.execute(
                renamePlan,
                settings.isDryRun()
            );
            auditLog.writeSummary(result);
            return result.withArtifacts(
                auditLog.getFile(),
                (backup == null) ? null : backup.directory()
            );
        }
    }

    /**
     * Write a template listing the files currently in the target folder.
     *
     * @param settings the folder, extension and recursion to scan with
     * @param dest     where to write the workbook
     * @return how many files the template lists
     * @throws InvalidSettingsException if the settings are unusable
     * @throws IOException if the folder cannot be listed or the workbook
     *         cannot be written
     */
    public int writeScanTemplate(final RenameSettings settings, final Path dest)
        throws InvalidSettingsException, IOException {
        validate(settings);
        List<FileEntry> files = readFiles(settings);
        if (!files.isEmpty()) {
            new TemplateWriter().writeScanTemplate(
                dest,
                files,
                settings.getExtension(),
                clock.get()
            );
        }
        return files.size();
    }

    private List<FileEntry> readFiles(final RenameSettings settings)
        throws IOException {
        return lister.listFiles(
            settings.getTargetFolder(),
            settings.getExtension(),
            settings.isRecursive()
        );
    }

    private RenamePlan plan(
        final RenameSettings settings,
        final Path mappingFile,
        final List<FileEntry> files
    ) throws MappingSourceException {
        List<RenameIntent> intents = rowSources.apply(mappingFile).readRows();
        RenamePlan renamePlan = PlanBuilder.build(intents, files, settings);
        logger.info(
            "planned " +
                intents.size() +
                " rows against " +
                files.size() +
                " files from " +
                mappingFile +
                ": " +
                renamePlan.getCounts()
        );
        return renamePlan;
    }
}
