package org.sheetrenamer.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The ordered list of planned operations for one pass, in sheet row order.
 */
public final class RenamePlan {

    private final List<PlannedOperation> operations;
    private final int listedFileCount;
    private final Map<OperationStatus, Integer> counts = new EnumMap<>(
        OperationStatus.class
    );

    public RenamePlan(
        final List<PlannedOperation> operations,
        final int listedFileCount
    ) {
        this.operations = List.copyOf(operations);
        this.listedFileCount = listedFileCount;
        for (OperationStatus status : OperationStatus.values()) {
            counts.put(status, 0);
        }
        for (PlannedOperation op : this.operations) {
            counts.merge(op.status(), 1, Integer::sum);
        }
    }

    public List<PlannedOperation> getOperations() {
        return operations;
    }

    /**
     * @return how many files the listing used for this plan contained
     */
    public int getListedFileCount() {
        return listedFileCount;
    }

    public int count(final OperationStatus status) {
        return counts.get(status);
    }

    /**
     * @return rows with an empty key or no matching file
     */
    public int getUnmatchedCount() {
        return count(OperationStatus.SKIP_EMPTY_KEY) +
            count(OperationStatus.SKIP_NOT_FOUND);
    }

    /**
     * @return operations that will touch, or try to touch, the filesystem;
     *         used as the length of the progress bar
     */
    public int getActionableCount() {
        return count(OperationStatus.RENAME) +
            count(OperationStatus.COLLISION) +
            count(OperationStatus.INVALID_NAME);
    }

    public Map<OperationStatus, Integer> getCounts() {
        return Collections.unmodifiableMap(counts);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }
}
