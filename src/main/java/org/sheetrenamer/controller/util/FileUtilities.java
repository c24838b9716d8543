package org.sheetrenamer.controller.util;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Filesystem helpers shared by the lister, planner, executor and backup.
 */
public class FileUtilities {

    private static final Logger logger = Logger.getLogger(
        FileUtilities.class.getName()
    );

    private FileUtilities() {
        // utility class
    }

    /**
     * Returns a safe string representation of a Path, handling null gracefully.
     *
     * @param p the path to convert (may be null)
     * @return the path as a string, or "&lt;null&gt;" if the path is null
     */
    public static String safePath(Path p) {
        return (p == null) ? "<null>" : p.toString();
    }

    /**
     * Return the part of a file name before its extension.
     *
     * <p>If the name ends with {@code extension}, exactly that suffix is
     * removed; this keeps names like "report.final.pdf" intact apart from
     * ".pdf".  Otherwise the last ".suffix" is removed, unless the only dot
     * is the first character.
     *
     * @param filename  a file name, without directory
     * @param extension the configured extension, such as ".pdf"; may be null
     * @return the stem of the name
     */
    public static String stem(final String filename, final String extension) {
        if (filename == null) {
            return "";
        }
        if (
            extension != null &&
            !extension.isEmpty() &&
            filename.endsWith(extension) &&
            filename.length() > extension.length()
        ) {
            return filename.substring(0, filename.length() - extension.length());
        }
        int dot = filename.lastIndexOf('.');
        if (dot <= 0) {
            return filename;
        }
        return filename.substring(0, dot);
    }

    /**
     * Rename the given file to the given destination, never overwriting.
     *
     * <p>The destination must be a non-existent path in the same directory
     * (or at least on the same file store) as the source; this does not fall
     * back to copy-and-delete.
     *
     * <p>Unlike a bare Files.move(), failures come back as exceptions with a
     * message fit for the audit log.
     *
     * @param srcFile
     *    the file to be renamed
     * @param destFile
     *    the full destination path, including the new file name
     * @return
     *    the path the file now has
     * @throws IOException
     *    if the file could not be renamed; the file is then left in place
     */
    public static Path renameFile(final Path srcFile, final Path destFile)
        throws IOException {
        if (srcFile == null || destFile == null) {
            throw new IllegalArgumentException(
                "cannot rename file: src/dest is null\n  src=" +
                    safePath(srcFile) +
                    "\n  dest=" +
                    safePath(destFile)
            );
        }
        if (Files.notExists(srcFile)) {
            logger.warning("cannot rename file, does not exist: " + srcFile);
            throw new NoSuchFileException(
                srcFile.toString(),
                null,
                "source file no longer exists"
            );
        }
        if (Files.exists(destFile) && !isSameFile(srcFile, destFile)) {
            logger.warning("will not overwrite existing file: " + destFile);
            throw new FileAlreadyExistsException(
                destFile.toString(),
                null,
                "Target exists"
            );
        }

        Path actualDest;
        try {
            // ATOMIC_MOVE keeps each rename all-or-nothing, and refuses to
            // copy across devices.
            actualDest = Files.move(
                srcFile,
                destFile,
                StandardCopyOption.ATOMIC_MOVE
            );
        } catch (AccessDeniedException ade) {
            logger.warning(
                "Could not rename file \"" + srcFile + "\"; access denied"
            );
            throw ade;
        } catch (IOException ioe) {
            logger.log(Level.WARNING, "Error renaming file " + srcFile, ioe);
            throw ioe;
        }

        if (actualDest == null || Files.notExists(actualDest)) {
            throw new IOException(
                "rename of " + srcFile + " reported success but " +
                    safePath(actualDest) + " does not exist"
            );
        }
        return actualDest;
    }

    /**
     * Return true if the given arguments refer to the same actual, existing file on
     * the file system.  On file systems that support symbolic links, two Paths could
     * be the same file even if their locations appear completely different.
     *
     * @param path1
     *    first Path to compare; it is expected that this Path exists
     * @param path2
     *    second Path to compare; this may or may not exist
     * @return
     *    true if the paths refer to the same file, false if they don't;
     *    logs an exception if one occurs while trying to check, including
     *    if path1 does not exist; but does not log one if path2 doesn't
     */
    public static boolean isSameFile(final Path path1, final Path path2) {
        try {
            //noinspection SimplifiableIfStatement
            if (Files.notExists(path2)) {
                return false;
            }
            return Files.isSameFile(path1, path2);
        } catch (IOException ioe) {
            logger.log(
                Level.WARNING,
                "exception checking files " + path1 + " and " + path2,
                ioe
            );
            return false;
        }
    }

    /**
     * Copy a file, keeping its timestamps and other copyable attributes.
     *
     * @param source the file to copy
     * @param dest   where the copy goes; its parent is created if needed
     * @throws IOException if the copy could not be made
     */
    public static void copyPreservingAttributes(
        final Path source,
        final Path dest
    ) throws IOException {
        Path parent = dest.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.copy(
            source,
            dest,
            StandardCopyOption.COPY_ATTRIBUTES,
            StandardCopyOption.REPLACE_EXISTING
        );
    }

    /**
     * List the names of every entry (files and directories) directly in a
     * directory.
     *
     * @param dir the directory to read
     * @return the entry names; empty if the directory cannot be read
     */
    public static List<String> entryNames(final Path dir) {
        List<String> names = new ArrayList<>();
        if (dir == null || !Files.isDirectory(dir)) {
            return names;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path p : entries) {
                Path name = p.getFileName();
                if (name != null) {
                    names.add(name.toString());
                }
            }
        } catch (IOException ioe) {
            logger.log(Level.WARNING, "exception listing directory " + dir, ioe);
        }
        return names;
    }

    /**
     * Pick a path for a new artifact (log file, backup directory) in a
     * folder, named {@code prefix + stamp + suffix}.  If that name is in use,
     * "_2", "_3" and so on are appended to the stamp.
     *
     * @param dir    the folder the artifact goes in
     * @param prefix the start of the name, e.g. "rename_log_"
     * @param stamp  the formatted timestamp
     * @param suffix the end of the name, e.g. ".txt"; may be empty
     * @return a path that did not exist when this method looked
     */
    public static Path unusedPath(
        final Path dir,
        final String prefix,
        final String stamp,
        final String suffix
    ) {
        Path candidate = dir.resolve(prefix + stamp + suffix);
        int attempt = 2;
        while (Files.exists(candidate)) {
            candidate = dir.resolve(prefix + stamp + "_" + attempt + suffix);
            attempt++;
        }
        return candidate;
    }

    /**
     * Decide whether a path the user supplied is a plain local path.
     *
     * <p>Network shares ({@code \\host\share}, {@code //host/share}) and
     * paths that climb with ".." are refused.
     *
     * @param path the path as typed or dropped by the user
     * @return true if the path may be used
     */
    public static boolean isLocalPath(final String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        String trimmed = path.trim();
        if (trimmed.startsWith("\\\\") || trimmed.startsWith("//")) {
            return false;
        }
        for (String segment : trimmed.split("[/\\\\]")) {
            if ("..".equals(segment)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Takes a Path which is a directory that the user wants to write into.  Makes sure
     * that the directory exists (or creates it if it doesn't).  If the directory cannot
     * be created, or is not a directory, this method fails.
     *
     * @param destDir
     *    the Path that the caller will want to write into
     * @return true if, upon completion of this method, the desired Path exists and is a
     *         directory.  False otherwise.
     */
    public static boolean ensureWritableDirectory(final Path destDir) {
        if (Files.notExists(destDir)) {
            try {
                Files.createDirectories(destDir);
            } catch (IOException ioe) {
                logger.log(
                    Level.SEVERE,
                    "Unable to create directory " + destDir,
                    ioe
                );
                return false;
            }
        }
        if (!Files.exists(destDir)) {
            logger.warning("could not create directory " + destDir);
            return false;
        }
        if (!Files.isDirectory(destDir)) {
            logger.warning(
                "cannot use " + destDir + " because it is not a directory"
            );
            return false;
        }
        return true;
    }
}
