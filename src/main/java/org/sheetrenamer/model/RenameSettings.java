package org.sheetrenamer.model;

import static org.sheetrenamer.model.util.Constants.*;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable configuration for one preview or rename pass.
 *
 * <p>The window builds a fresh instance from its controls every time the
 * user presses Preview or Run; nothing downstream keeps a reference to the
 * window state.
 */
public final class RenameSettings {

    private final Path mappingFile;
    private final Path targetFolder;
    private final String extension;
    private final RenameMode mode;
    private final String delimiter;
    private final boolean recursive;
    private final boolean backup;
    private final boolean dryRun;
    private final boolean autoPull;
    private final NameComparison nameComparison;

    private RenameSettings(final Builder builder) {
        this.mappingFile = builder.mappingFile;
        this.targetFolder = Objects.requireNonNull(
            builder.targetFolder,
            "targetFolder"
        );
        this.extension = Objects.requireNonNull(builder.extension, "extension");
        this.mode = Objects.requireNonNull(builder.mode, "mode");
        // The empty string is a valid delimiter; only null is rejected.
        this.delimiter = Objects.requireNonNull(builder.delimiter, "delimiter");
        this.recursive = builder.recursive;
        this.backup = builder.backup;
        this.dryRun = builder.dryRun;
        this.autoPull = builder.autoPull;
        this.nameComparison = Objects.requireNonNull(
            builder.nameComparison,
            "nameComparison"
        );
    }

    /**
     * @return the mapping workbook, or null if none was chosen (auto-pull
     *         may still find one)
     */
    public Path getMappingFile() {
        return mappingFile;
    }

    public Path getTargetFolder() {
        return targetFolder;
    }

    public String getExtension() {
        return extension;
    }

    public RenameMode getMode() {
        return mode;
    }

    public String getDelimiter() {
        return delimiter;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public boolean isBackup() {
        return backup;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isAutoPull() {
        return autoPull;
    }

    public NameComparison getNameComparison() {
        return nameComparison;
    }

    /**
     * @param file the mapping workbook to use instead
     * @return a copy of these settings with a different mapping file
     */
    public RenameSettings withMappingFile(final Path file) {
        return toBuilder().mappingFile(file).build();
    }

    /**
     * @param dry whether the pass should leave the files untouched
     * @return a copy of these settings with the dry-run flag replaced
     */
    public RenameSettings withDryRun(final boolean dry) {
        return toBuilder().dryRun(dry).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .mappingFile(mappingFile)
            .targetFolder(targetFolder)
            .extension(extension)
            .mode(mode)
            .delimiter(delimiter)
            .recursive(recursive)
            .backup(backup)
            .dryRun(dryRun)
            .autoPull(autoPull)
            .nameComparison(nameComparison);
    }

    @Override
    public String toString() {
        return (
            "RenameSettings [mappingFile=" +
            mappingFile +
            ", targetFolder=" +
            targetFolder +
            ", extension=" +
            extension +
            ", mode=" +
            mode +
            ", delimiter='" +
            delimiter +
            "', recursive=" +
            recursive +
            ", backup=" +
            backup +
            ", dryRun=" +
            dryRun +
            ", autoPull=" +
            autoPull +
            ", nameComparison=" +
            nameComparison.name() +
            "]"
        );
    }

    public static class Builder {

        private Path mappingFile;
        private Path targetFolder;
        private String extension = DEFAULT_EXTENSION;
        private RenameMode mode = RenameMode.PREFIX;
        private String delimiter = DEFAULT_DELIMITER;
        private boolean recursive = false;
        private boolean backup = true;
        private boolean dryRun = false;
        private boolean autoPull = true;
        private NameComparison nameComparison = NameComparison.PLATFORM;

        public Builder mappingFile(Path val) {
            mappingFile = val;
            return this;
        }

        public Builder targetFolder(Path val) {
            targetFolder = val;
            return this;
        }

        public Builder extension(String val) {
            extension = (val == null) ? null : val.trim();
            return this;
        }

        public Builder mode(RenameMode val) {
            mode = val;
            return this;
        }

        public Builder delimiter(String val) {
            delimiter = val;
            return this;
        }

        public Builder recursive(boolean val) {
            recursive = val;
            return this;
        }

        public Builder backup(boolean val) {
            backup = val;
            return this;
        }

        public Builder dryRun(boolean val) {
            dryRun = val;
            return this;
        }

        public Builder autoPull(boolean val) {
            autoPull = val;
            return this;
        }

        public Builder nameComparison(NameComparison val) {
            nameComparison = val;
            return this;
        }

        public RenameSettings build() {
            return new RenameSettings(this);
        }
    }
}
