package org.sheetrenamer.controller;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.sheetrenamer.controller.util.FileUtilities;
import org.sheetrenamer.model.ExecutionResult;
import org.sheetrenamer.model.OperationOutcome;
import org.sheetrenamer.model.PlannedOperation;
import org.sheetrenamer.model.ProgressUpdater;
import org.sheetrenamer.model.RenamePlan;

/**
 * Applies a {@link RenamePlan} to the filesystem, one operation at a time,
 * in plan order.
 *
 * <p>A failure on one row is recorded against that row and the pass moves
 * on.  Only a failure to write the audit log ends a pass early.
 */
public class RenameExecutor {

    private static final Logger logger = Logger.getLogger(
        RenameExecutor.class.getName()
    );

    static final String TARGET_EXISTS = "Target exists: ";
    static final String INVALID_TARGET = "Invalid target name: ";

    private final ProgressUpdater updater;
    private final AuditLogWriter auditLog;

    // planned path -> where the file really is now
    private final Map<Path, Path> remapped = new HashMap<>();

    /**
     * @param updater  told about progress after every operation that touches
     *                 the filesystem; may be null
     * @param auditLog receives one entry per row as soon as the row is done;
     *                 may be null
     */
    public RenameExecutor(
        final ProgressUpdater updater,
        final AuditLogWriter auditLog
    ) {
        this.updater = updater;
        this.auditLog = auditLog;
    }

    /**
     * Run the plan.
     *
     * <p>In a dry run nothing on disk changes: each RENAME row is reported
     * as WOULD_RENAME and the renamed count stays at zero.  Every other row
     * is classified exactly as in a live run.
     *
     * @param plan   the plan, built from a fresh listing
     * @param dryRun true to only report what would happen
     * @return the outcome of every row, in plan order
     * @throws IOException if the audit log cannot be written
     */
    public ExecutionResult execute(final RenamePlan plan, final boolean dryRun)
        throws IOException {
        final List<OperationOutcome> outcomes = new ArrayList<>(
            plan.getOperations().size()
        );
        final int total = plan.getActionableCount();
        int remaining = total;
        remapped.clear();

        try {
            for (PlannedOperation op : plan.getOperations()) {
                final OperationOutcome outcome;
                switch (op.status()) {
                    case RENAME:
                        outcome = dryRun ? wouldRename(op) : rename(op);
                        remaining--;
                        reportProgress(total, remaining);
                        break;
                    case COLLISION:
                        outcome = OperationOutcome.error(
                            op,
                            TARGET_EXISTS + op.newName()
                        );
                        remaining--;
                        reportProgress(total, remaining);
                        break;
                    case INVALID_NAME:
                        outcome = OperationOutcome.error(
                            op,
                            INVALID_TARGET + op.newName()
                        );
                        remaining--;
                        reportProgress(total, remaining);
                        break;
                    case NO_CHANGE:
                    case SKIP_EMPTY_KEY:
                    case SKIP_NOT_FOUND:
                    default:
                        outcome = OperationOutcome.skipped(op);
                        break;
                }
                outcomes.add(outcome);
                if (auditLog != null) {
                    auditLog.writeOutcome(outcome);
                }
            }
        } finally {
            if (updater != null) {
                updater.finish();
            }
        }

        ExecutionResult result = new ExecutionResult(outcomes, dryRun, null, null);
        logger.info((dryRun ? "dry run finished: " : "rename finished: ") + result);
        return result;
    }

    private static OperationOutcome wouldRename(final PlannedOperation op) {
        return new OperationOutcome(
            op,
            OperationOutcome.Kind.WOULD_RENAME,
            "",
            null
        );
    }

    private OperationOutcome rename(final PlannedOperation op) {
        // An earlier row may have renamed this very file; follow it.
        final Path source = remapped.getOrDefault(op.oldPath(), op.oldPath());
        try {
            Path actual = FileUtilities.renameFile(source, op.newPath());
            remapped.put(op.newPath(), actual);
            logger.fine("renamed " + source + " to " + actual);
            return new OperationOutcome(
                op,
                OperationOutcome.Kind.RENAMED,
                "",
                actual
            );
        } catch (IOException | SecurityException e) {
            String reason = describeFailure(op, e);
            logger.warning("row " + op.rowNumber() + ": " + reason);
            return OperationOutcome.error(op, reason);
        }
    }

    static String describeFailure(final PlannedOperation op, final Exception e) {
        if (e instanceof FileAlreadyExistsException) {
            return TARGET_EXISTS + op.newName();
        }
        if (e instanceof NoSuchFileException) {
            return "File not found: " + op.oldName();
        }
        if (e instanceof AccessDeniedException || e instanceof SecurityException) {
            return "Permission denied: " + op.oldName();
        }
        if (e instanceof AtomicMoveNotSupportedException) {
            return "Cannot rename across devices: " + op.newName();
        }
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            message = e.getClass().getSimpleName();
        }
        return message;
    }

    private void reportProgress(final int total, final int remaining) {
        if (updater != null) {
            updater.setProgress(total, remaining);
        }
    }
}
