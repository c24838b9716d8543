package org.sheetrenamer.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * The decision made for one {@link RenameIntent} by the plan builder.
 *
 * <p>For the two "skip" statuses no file was matched, so {@code oldName},
 * {@code oldPath}, {@code newName} and {@code newPath} are null and
 * {@code sourceKey} carries whatever the row asked for.
 */
public record PlannedOperation(
    int rowNumber,
    String sourceKey,
    String oldName,
    String newName,
    Path oldPath,
    Path newPath,
    OperationStatus status,
    String note
) {
    public PlannedOperation {
        Objects.requireNonNull(status, "status");
        sourceKey = (sourceKey == null) ? "" : sourceKey;
        note = (note == null) ? "" : note;
    }

    public static PlannedOperation unmatched(
        final RenameIntent intent,
        final OperationStatus status
    ) {
        if (!status.isUnmatched()) {
            throw new IllegalArgumentException(
                "not an unmatched status: " + status
            );
        }
        return new PlannedOperation(
            intent.rowNumber(),
            intent.sourceKey(),
            null,
            null,
            null,
            null,
            status,
            intent.note()
        );
    }

    public static PlannedOperation matched(
        final RenameIntent intent,
        final FileEntry source,
        final String newName,
        final Path newPath,
        final OperationStatus status
    ) {
        if (status.isUnmatched()) {
            throw new IllegalArgumentException("not a matched status: " + status);
        }
        return new PlannedOperation(
            intent.rowNumber(),
            intent.sourceKey(),
            source.baseName(),
            newName,
            source.fullPath(),
            newPath,
            status,
            intent.note()
        );
    }

    public boolean hasNote() {
        return !note.isEmpty();
    }
}
