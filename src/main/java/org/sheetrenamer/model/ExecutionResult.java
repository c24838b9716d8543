package org.sheetrenamer.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything a rename pass did, row by row, plus the summary counts.
 */
public final class ExecutionResult {

    private final List<OperationOutcome> outcomes;
    private final boolean dryRun;
    private final Path logFile;
    private final Path backupDirectory;
    private final int renamedCount;
    private final int wouldRenameCount;
    private final int errorCount;
    private final int skippedCount;

    public ExecutionResult(
        final List<OperationOutcome> outcomes,
        final boolean dryRun,
        final Path logFile,
        final Path backupDirectory
    ) {
        this.outcomes = List.copyOf(outcomes);
        this.dryRun = dryRun;
        this.logFile = logFile;
        this.backupDirectory = backupDirectory;

        int renamed = 0;
        int wouldRename = 0;
        int errors = 0;
        int skipped = 0;
        for (OperationOutcome outcome : this.outcomes) {
            switch (outcome.kind()) {
                case RENAMED:
                    renamed++;
                    break;
                case WOULD_RENAME:
                    wouldRename++;
                    break;
                case ERROR:
                    errors++;
                    break;
                case SKIPPED:
                default:
                    skipped++;
                    break;
            }
        }
        this.renamedCount = renamed;
        this.wouldRenameCount = wouldRename;
        this.errorCount = errors;
        this.skippedCount = skipped;
    }

    public List<OperationOutcome> getOutcomes() {
        return outcomes;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /**
     * @return the audit log written for this pass, or null if none was written
     */
    public Path getLogFile() {
        return logFile;
    }

    /**
     * @return the backup directory, or null if no backup was made
     */
    public Path getBackupDirectory() {
        return backupDirectory;
    }

    /**
     * @return files actually renamed; always 0 for a dry run
     */
    public int getRenamedCount() {
        return renamedCount;
    }

    /**
     * @return renames a dry run would have performed
     */
    public int getWouldRenameCount() {
        return wouldRenameCount;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public int getSkippedCount() {
        return skippedCount;
    }

    public int getTotalProcessed() {
        return outcomes.size();
    }

    /**
     * Return a copy of this result that points at the audit log and backup.
     *
     * @param log    the audit log
     * @param backup the backup directory, may be null
     * @return a new result with the same outcomes
     */
    public ExecutionResult withArtifacts(final Path log, final Path backup) {
        return new ExecutionResult(outcomes, dryRun, log, backup);
    }

    @Override
    public String toString() {
        return (
            "ExecutionResult [renamed=" +
            renamedCount +
            ", wouldRename=" +
            wouldRenameCount +
            ", errors=" +
            errorCount +
            ", skipped=" +
            skippedCount +
            ", dryRun=" +
            dryRun +
            "]"
        );
    }
}
