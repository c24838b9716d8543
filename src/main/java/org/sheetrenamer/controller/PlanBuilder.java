package org.sheetrenamer.controller;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.sheetrenamer.controller.util.FileUtilities;
import org.sheetrenamer.model.FileEntry;
import org.sheetrenamer.model.MatchResult;
import org.sheetrenamer.model.NameComparison;
import org.sheetrenamer.model.OperationStatus;
import org.sheetrenamer.model.PlannedOperation;
import org.sheetrenamer.model.RenameIntent;
import org.sheetrenamer.model.RenameMode;
import org.sheetrenamer.model.RenamePlan;
import org.sheetrenamer.model.RenameSettings;

/**
 * Turns rename rows plus a fresh folder listing into an ordered plan.
 *
 * <p>Rows are processed strictly in sheet order, and each decision sees the
 * folder as it will be after every earlier RENAME in the plan: the earlier
 * target names are taken, the earlier source names are free, and a renamed
 * file can be matched again by its new name.  The executor applies the plan
 * in the same order, so a preview and a live run classify every row alike,
 * and when two rows want the same name the first one wins.
 *
 * <p>The filesystem is only read, never modified.
 */
public final class PlanBuilder {

    private static final Logger logger = Logger.getLogger(
        PlanBuilder.class.getName()
    );

    private final RenameMode mode;
    private final String extension;
    private final String delimiter;
    private final NameComparison comparison;

    // Working state for one build; see build().
    private Map<String, FileEntry> byName;
    private final Map<Path, Set<String>> occupied = new HashMap<>();
    private final Set<Path> vacated = new HashSet<>();

    private PlanBuilder(
        final RenameMode mode,
        final String extension,
        final String delimiter,
        final NameComparison comparison
    ) {
        this.mode = mode;
        this.extension = extension;
        this.delimiter = delimiter;
        this.comparison = comparison.resolve();
    }

    /**
     * Build a plan using the naming options of the given settings.
     *
     * @param intents the rows, in sheet order
     * @param files   the listing, freshly read for this pass
     * @param settings the pass settings
     * @return the plan
     */
    public static RenamePlan build(
        final List<RenameIntent> intents,
        final List<FileEntry> files,
        final RenameSettings settings
    ) {
        return build(
            intents,
            files,
            settings.getMode(),
            settings.getExtension(),
            settings.getDelimiter(),
            settings.getNameComparison()
        );
    }

    /**
     * Build a plan.
     *
     * @param intents    the rows, in sheet order
     * @param files      the listing, freshly read for this pass
     * @param mode       PREFIX or REPLACE
     * @param extension  the configured extension
     * @param delimiter  prefix delimiter; may be empty
     * @param comparison how names are compared when looking for collisions
     * @return the plan, one operation per row, in row order
     */
    public static RenamePlan build(
        final List<RenameIntent> intents,
        final List<FileEntry> files,
        final RenameMode mode,
        final String extension,
        final String delimiter,
        final NameComparison comparison
    ) {
        PlanBuilder builder = new PlanBuilder(
            mode,
            extension,
            delimiter,
            comparison
        );
        return builder.run(intents, files);
    }

    private RenamePlan run(
        final List<RenameIntent> intents,
        final List<FileEntry> files
    ) {
        byName = FilenameMatcher.index(files);
        List<PlannedOperation> operations = new ArrayList<>(intents.size());
        for (RenameIntent intent : intents) {
            operations.add(plan(intent));
        }
        RenamePlan renamePlan = new RenamePlan(operations, files.size());
        logger.fine("built plan: " + renamePlan.getCounts());
        return renamePlan;
    }

    private PlannedOperation plan(final RenameIntent intent) {
        MatchResult match = FilenameMatcher.match(byName, intent);
        switch (match.getKind()) {
            case EMPTY_KEY:
                return PlannedOperation.unmatched(
                    intent,
                    OperationStatus.SKIP_EMPTY_KEY
                );
            case NOT_FOUND:
                return PlannedOperation.unmatched(
                    intent,
                    OperationStatus.SKIP_NOT_FOUND
                );
            case MATCHED:
            default:
                break;
        }

        final FileEntry source = match.getEntry();
        final String newName = NameGenerator.generate(
            intent,
            source.baseName(),
            mode,
            extension,
            delimiter
        );
        final Path directory = parentOf(source.fullPath());
        final Path newPath = siblingOrNull(directory, newName);
        if (newPath == null) {
            logger.fine(
                "row " + intent.rowNumber() + ": refusing target name " + newName
            );
            return PlannedOperation.matched(
                intent,
                source,
                newName,
                null,
                OperationStatus.INVALID_NAME
            );
        }

        if (newName.equals(source.baseName())) {
            return PlannedOperation.matched(
                intent,
                source,
                newName,
                newPath,
                OperationStatus.NO_CHANGE
            );
        }

        if (isTaken(directory, source, newName, newPath)) {
            logger.fine(
                "row " + intent.rowNumber() + ": " + newName + " is taken"
            );
            return PlannedOperation.matched(
                intent,
                source,
                newName,
                newPath,
                OperationStatus.COLLISION
            );
        }

        claim(directory, source, newName, newPath);
        return PlannedOperation.matched(
            intent,
            source,
            newName,
            newPath,
            OperationStatus.RENAME
        );
    }

    /**
     * A target is taken if another entry of the directory, as it stands
     * after the earlier renames of this plan, has that name.  The file being
     * renamed never blocks itself: neither by a name equal under the
     * comparison policy, nor through a second link to the same file.
     * A name equal under the policy may still belong to a different file on
     * a filesystem that tells the two apart, and then it is taken.
     */
    private boolean isTaken(
        final Path directory,
        final FileEntry source,
        final String newName,
        final Path newPath
    ) {
        final String targetKey = comparison.key(newName);
        if (targetKey.equals(comparison.key(source.baseName()))) {
            return heldByAnotherFile(source, newPath);
        }
        if (!occupiedNames(directory).contains(targetKey)) {
            return false;
        }
        // A file renamed earlier in this plan is not on disk under its
        // planned path yet, so it cannot be a second link to anything.
        if (Files.notExists(source.fullPath())) {
            return true;
        }
        return !FileUtilities.isSameFile(source.fullPath(), newPath);
    }

    private boolean heldByAnotherFile(final FileEntry source, final Path newPath) {
        if (vacated.contains(newPath)) {
            return false;
        }
        if (Files.notExists(newPath, LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        if (Files.notExists(source.fullPath())) {
            return true;
        }
        return !FileUtilities.isSameFile(source.fullPath(), newPath);
    }

    private void claim(
        final Path directory,
        final FileEntry source,
        final String newName,
        final Path newPath
    ) {
        Set<String> names = occupiedNames(directory);
        names.remove(comparison.key(source.baseName()));
        names.add(comparison.key(newName));
        vacated.add(source.fullPath());
        vacated.remove(newPath);

        // Later rows may name the file by its new name.
        byName.remove(source.baseName(), source);
        byName.putIfAbsent(newName, new FileEntry(newPath, newName));
    }

    private Set<String> occupiedNames(final Path directory) {
        return occupied.computeIfAbsent(directory, dir -> {
            Set<String> keys = new HashSet<>();
            for (String name : FileUtilities.entryNames(dir)) {
                keys.add(comparison.key(name));
            }
            return keys;
        });
    }

    /**
     * Resolve a generated name inside the folder of the file it renames.
     *
     * @return the target path, or null if the name would leave the folder
     */
    private static Path siblingOrNull(final Path directory, final String newName) {
        if (!NameGenerator.isPlainFileName(newName)) {
            return null;
        }
        final Path newPath;
        try {
            newPath = directory.resolve(newName);
        } catch (InvalidPathException ipe) {
            return null;
        }
        if (!directory.equals(newPath.getParent())) {
            return null;
        }
        return newPath;
    }

    private static Path parentOf(final Path file) {
        Path parent = file.getParent();
        if (parent == null) {
            parent = file.toAbsolutePath().getParent();
        }
        return parent;
    }
}
