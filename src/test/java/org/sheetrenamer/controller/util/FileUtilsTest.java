package org.sheetrenamer.controller.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.sheetrenamer.controller.util.FileUtilities.*;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sheetrenamer.model.util.Environment;

public class FileUtilsTest {

    @TempDir
    Path tempFolder;

    @Test
    public void testStem() {
        assertEquals("report", stem("report.pdf", ".pdf"));
        assertEquals(
            "report.final",
            stem("report.final.pdf", ".pdf"),
            "only the configured extension should be removed"
        );
        assertEquals(
            "notes",
            stem("notes.txt", ".pdf"),
            "a different extension should still be split at the last dot"
        );
        assertEquals(".hidden", stem(".hidden", ".pdf"));
        assertEquals("README", stem("README", ".pdf"));
        assertEquals(
            ".pdf",
            stem(".pdf", ".pdf"),
            "a name that is only the extension has nothing to strip"
        );
        assertEquals("", stem(null, ".pdf"));
        assertEquals("archive.tar", stem("archive.tar.gz", null));
    }

    @Test
    public void testIsLocalPath() {
        assertTrue(isLocalPath("/home/user/scans"));
        assertTrue(isLocalPath("C:\\Users\\me\\Documents"));
        assertTrue(isLocalPath("relative/folder"));
        assertTrue(
            isLocalPath("/data/file..name"),
            "dots inside a name are not a parent reference"
        );

        assertFalse(isLocalPath(null));
        assertFalse(isLocalPath("   "));
        assertFalse(isLocalPath("\\\\server\\share\\docs"), "UNC path accepted");
        assertFalse(isLocalPath("//server/share/docs"), "network path accepted");
        assertFalse(isLocalPath("/home/user/../other"), "parent reference accepted");
        assertFalse(isLocalPath("C:\\docs\\..\\secret"), "parent reference accepted");
    }

    @Test
    public void testRenameFile() throws IOException {
        Path src = Files.writeString(tempFolder.resolve("a.pdf"), "alpha");
        Path dest = tempFolder.resolve("001-a.pdf");

        Path actual = renameFile(src, dest);

        assertEquals(dest, actual, "renameFile returned an unexpected path");
        assertFalse(Files.exists(src), "source still exists after rename");
        assertEquals("alpha", Files.readString(dest), "content changed by rename");
    }

    @Test
    public void testRenameFileRefusesToOverwrite() throws IOException {
        Path src = Files.writeString(tempFolder.resolve("a.pdf"), "alpha");
        Path dest = Files.writeString(tempFolder.resolve("b.pdf"), "bravo");

        assertThrows(FileAlreadyExistsException.class, () -> renameFile(src, dest));

        assertEquals("alpha", Files.readString(src), "source modified");
        assertEquals("bravo", Files.readString(dest), "existing target overwritten");
    }

    @Test
    public void testRenameFileMissingSource() {
        Path src = tempFolder.resolve("gone.pdf");
        Path dest = tempFolder.resolve("new.pdf");

        assertThrows(NoSuchFileException.class, () -> renameFile(src, dest));
        assertFalse(Files.exists(dest), "target created for a missing source");
    }

    @Test
    public void testRenameFileNullArguments() {
        assertThrows(
            IllegalArgumentException.class,
            () -> renameFile(null, tempFolder.resolve("x.pdf"))
        );
    }

    @Test
    public void testIsSameFile() throws IOException {
        Path file = Files.writeString(tempFolder.resolve("one.pdf"), "1");
        Path other = Files.writeString(tempFolder.resolve("two.pdf"), "2");

        assertTrue(isSameFile(file, file));
        assertTrue(
            isSameFile(file, tempFolder.resolve(".").resolve("one.pdf")),
            "same file through a different path not recognized"
        );
        assertFalse(isSameFile(file, other));
        assertFalse(
            isSameFile(file, tempFolder.resolve("missing.pdf")),
            "nonexistent second path reported as the same file"
        );
    }

    @Test
    public void testIsSameFileHardLink() throws IOException {
        if (Environment.IS_WINDOWS) {
            return;
        }
        Path file = Files.writeString(tempFolder.resolve("one.pdf"), "1");
        Path link = tempFolder.resolve("link.pdf");
        try {
            Files.createLink(link, file);
        } catch (UnsupportedOperationException | IOException x) {
            // Some file systems have no hard links; nothing to check then.
            return;
        }
        assertTrue(isSameFile(file, link), "hard link not seen as the same file");
    }

    @Test
    public void testCopyPreservingAttributes() throws IOException {
        Path src = Files.writeString(tempFolder.resolve("a.pdf"), "alpha");
        Path dest = tempFolder.resolve("copies").resolve("nested").resolve("a.pdf");

        copyPreservingAttributes(src, dest);

        assertTrue(Files.exists(src), "copy removed the source");
        assertEquals("alpha", Files.readString(dest));
        // The copy keeps only the precision the platform can set.
        assertEquals(
            Files.getLastModifiedTime(src).toMillis(),
            Files.getLastModifiedTime(dest).toMillis(),
            "modification time not preserved"
        );
    }

    @Test
    public void testEntryNames() throws IOException {
        Files.writeString(tempFolder.resolve("a.pdf"), "a");
        Files.writeString(tempFolder.resolve("b.txt"), "b");
        Files.createDirectory(tempFolder.resolve("sub"));

        List<String> names = entryNames(tempFolder);

        assertEquals(3, names.size(), "unexpected entries: " + names);
        assertTrue(names.contains("a.pdf"));
        assertTrue(names.contains("b.txt"));
        assertTrue(names.contains("sub"), "directories must be listed too");

        assertTrue(entryNames(tempFolder.resolve("missing")).isEmpty());
        assertTrue(entryNames(null).isEmpty());
    }

    @Test
    public void testUnusedPath() throws IOException {
        Path first = unusedPath(tempFolder, "rename_log_", "20240102_030405", ".txt");
        assertEquals(tempFolder.resolve("rename_log_20240102_030405.txt"), first);

        Files.createFile(first);
        Path second = unusedPath(tempFolder, "rename_log_", "20240102_030405", ".txt");
        assertEquals(
            tempFolder.resolve("rename_log_20240102_030405_2.txt"),
            second,
            "taken name should get a numeric suffix"
        );

        Files.createFile(second);
        Path third = unusedPath(tempFolder, "rename_log_", "20240102_030405", ".txt");
        assertEquals(tempFolder.resolve("rename_log_20240102_030405_3.txt"), third);

        Files.createDirectory(tempFolder.resolve("backup_20240102_030405"));
        assertEquals(
            tempFolder.resolve("backup_20240102_030405_2"),
            unusedPath(tempFolder, "backup_", "20240102_030405", "")
        );
    }

    @Test
    public void testEnsureWritableDirectory() {
        final String dirname = "folder";

        final Path sandbox = tempFolder;

        final Path dirpath = sandbox.resolve(dirname);
        assertFalse(
            Files.exists(dirpath),
            "cannot test ensureWritableDirectory because target already exists"
        );

        assertTrue(
            ensureWritableDirectory(dirpath),
            "ensureWritableDirectory returned false"
        );
        assertTrue(
            Files.exists(dirpath),
            "dir from ensureWritableDirectory not found"
        );
        assertTrue(
            Files.isDirectory(dirpath),
            "dir from ensureWritableDirectory not a directory"
        );

    }

    @Test
    public void testEnsureWritableDirectoryAlreadyExists() {
        final Path dirpath = tempFolder;

        assertTrue(
            Files.exists(dirpath),
            "cannot test ensureWritableDirectory because sandbox does not exist"
        );

        assertTrue(
            ensureWritableDirectory(dirpath),
            "ensureWritableDirectory returned false"
        );
        assertTrue(
            Files.exists(dirpath),
            "dir from ensureWritableDirectory not found"
        );
        assertTrue(
            Files.isDirectory(dirpath),
            "dir from ensureWritableDirectory not a directory"
        );
    }

    @Test
    public void testEnsureWritableDirectoryFileInTheWay() {
        final String dirname = "file";
        final Path dirpath = tempFolder.resolve(dirname);

        try {
            Files.createFile(dirpath);
        } catch (IOException ioe) {
            fail("cannot test ensureWritableDirectory because can't create file");
        }
        assertTrue(
            Files.exists(dirpath),
            "cannot test ensureWritableDirectory because file does not exist"
        );

        assertFalse(
            ensureWritableDirectory(dirpath),
            "ensureWritableDirectory returned true when file was in the way"
        );
        assertTrue(Files.isRegularFile(dirpath), "file in the way was replaced");
    }

    @Test
    public void testSafePath() {
        assertEquals("<null>", safePath(null));
        assertEquals(tempFolder.toString(), safePath(tempFolder));
    }
}
