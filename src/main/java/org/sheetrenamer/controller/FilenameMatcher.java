package org.sheetrenamer.controller;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;
import org.sheetrenamer.model.FileEntry;
import org.sheetrenamer.model.MatchResult;
import org.sheetrenamer.model.RenameIntent;

/**
 * Pairs a rename row with a file by exact, case-sensitive name equality.
 *
 * <p>There is deliberately no fallback to the row's position in the sheet:
 * a reused template whose rows no longer line up with the folder must
 * produce "not found", never a rename of some other file.
 */
public final class FilenameMatcher {

    private static final Logger logger = Logger.getLogger(
        FilenameMatcher.class.getName()
    );

    private FilenameMatcher() {
        // utility
    }

    /**
     * Index a listing by base name.
     *
     * <p>A flat listing cannot contain a name twice.  A recursive one can;
     * then the first entry in listing order keeps the name and the others
     * can never be matched.
     *
     * @param entries the listing, in path order
     * @return a mutable map from base name to entry, in listing order
     */
    public static Map<String, FileEntry> index(final Collection<FileEntry> entries) {
        Map<String, FileEntry> byName = new LinkedHashMap<>();
        for (FileEntry entry : entries) {
            FileEntry previous = byName.putIfAbsent(entry.baseName(), entry);
            if (previous != null) {
                logger.warning(
                    "'" +
                        entry.baseName() +
                        "' found more than once; rows naming it will use " +
                        previous.fullPath() +
                        ", not " +
                        entry.fullPath()
                );
            }
        }
        return byName;
    }

    /**
     * @param byName the current listing, indexed by {@link #index}
     * @param intent the row to match
     * @return MATCHED with the file, EMPTY_KEY, or NOT_FOUND
     */
    public static MatchResult match(
        final Map<String, FileEntry> byName,
        final RenameIntent intent
    ) {
        if (!intent.hasSourceKey()) {
            return MatchResult.emptyKey();
        }
        FileEntry entry = byName.get(intent.sourceKey());
        if (entry == null) {
            return MatchResult.notFound();
        }
        return MatchResult.matched(entry);
    }
}
