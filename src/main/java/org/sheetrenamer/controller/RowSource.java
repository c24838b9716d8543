package org.sheetrenamer.controller;

import java.util.List;
import org.sheetrenamer.model.RenameIntent;

/**
 * Supplies the rename rows, in sheet order.
 *
 * <p>Implementations must not hold the backing resource open between calls
 * and must not cache rows: every call reads the source afresh, so edits made
 * by another program between passes are always seen.
 */
public interface RowSource {
    /**
     * @return the rows, in order; never null
     * @throws MappingSourceException if the source cannot be read
     */
    List<RenameIntent> readRows() throws MappingSourceException;
}
