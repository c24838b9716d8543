package org.sheetrenamer.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * What the executor did with one planned operation.
 *
 * @param operation  the planned operation
 * @param kind       the result
 * @param detail     error text for ERROR outcomes; empty otherwise
 * @param actualPath where the file ended up after a live rename; null otherwise
 */
public record OperationOutcome(
    PlannedOperation operation,
    Kind kind,
    String detail,
    Path actualPath
) {
    public enum Kind {
        RENAMED,
        // dry run: the rename was planned but not performed
        WOULD_RENAME,
        SKIPPED,
        ERROR,
    }

    public OperationOutcome {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(kind, "kind");
        detail = (detail == null) ? "" : detail;
    }

    public static OperationOutcome skipped(final PlannedOperation op) {
        return new OperationOutcome(op, Kind.SKIPPED, "", null);
    }

    public static OperationOutcome error(
        final PlannedOperation op,
        final String detail
    ) {
        return new OperationOutcome(op, Kind.ERROR, detail, null);
    }
}
