package org.sheetrenamer.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file found in the target folder during one listing.
 *
 * @param fullPath the file's path
 * @param baseName the last element of the path, including extension
 */
public record FileEntry(Path fullPath, String baseName) {
    public FileEntry {
        Objects.requireNonNull(fullPath, "fullPath");
        Objects.requireNonNull(baseName, "baseName");
    }

    public static FileEntry of(final Path path) {
        Path name = path.getFileName();
        if (name == null) {
            throw new IllegalArgumentException("path has no file name: " + path);
        }
        return new FileEntry(path, name.toString());
    }
}
