package org.sheetrenamer.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sheetrenamer.model.FileEntry;

public class BackupCreatorTest {

    private static final LocalDateTime WHEN = LocalDateTime.of(2024, 5, 6, 7, 8, 9);

    @TempDir
    Path tempFolder;

    private List<FileEntry> create(String... names) throws IOException {
        for (String name : names) {
            Path file = tempFolder.resolve(name);
            Files.createDirectories(file.getParent());
            Files.writeString(file, "content of " + name);
        }
        return new FileLister().listFiles(tempFolder, ".pdf", true);
    }

    @Test
    public void testBackupCopiesEveryFile() throws IOException {
        List<FileEntry> files = create("a.pdf", "b.pdf");

        BackupCreator.Result result = new BackupCreator().createBackup(tempFolder, files, WHEN);

        assertEquals(tempFolder.resolve("backup_20240506_070809"), result.directory());
        assertEquals(2, result.copiedCount());
        assertEquals(0, result.failedCount());
        assertTrue(result.isComplete());
        assertEquals(
            "content of a.pdf",
            Files.readString(result.directory().resolve("a.pdf"))
        );
        assertTrue(Files.exists(tempFolder.resolve("a.pdf")), "backup moved the original");
    }

    @Test
    public void testBackupKeepsSubfolders() throws IOException {
        List<FileEntry> files = create("top.pdf", "one/same.pdf", "two/same.pdf");

        BackupCreator.Result result = new BackupCreator().createBackup(tempFolder, files, WHEN);

        assertEquals(3, result.copiedCount());
        assertEquals(
            "content of one/same.pdf",
            Files.readString(result.directory().resolve("one").resolve("same.pdf"))
        );
        assertEquals(
            "content of two/same.pdf",
            Files.readString(result.directory().resolve("two").resolve("same.pdf"))
        );
    }

    @Test
    public void testSecondBackupInSameSecondGetsItsOwnFolder() throws IOException {
        List<FileEntry> files = create("a.pdf");
        BackupCreator creator = new BackupCreator();

        Path first = creator.createBackup(tempFolder, files, WHEN).directory();
        Path second = creator.createBackup(tempFolder, files, WHEN).directory();

        assertEquals(tempFolder.resolve("backup_20240506_070809_2"), second);
        assertTrue(Files.exists(first.resolve("a.pdf")));
        assertTrue(Files.exists(second.resolve("a.pdf")));
    }

    @Test
    public void testMissingFileCountsAsFailure() throws IOException {
        List<FileEntry> files = create("a.pdf", "b.pdf");
        Files.delete(tempFolder.resolve("a.pdf"));

        BackupCreator.Result result = new BackupCreator().createBackup(tempFolder, files, WHEN);

        assertEquals(1, result.copiedCount());
        assertEquals(1, result.failedCount());
        assertFalse(result.isComplete());
        assertTrue(Files.exists(result.directory().resolve("b.pdf")));
    }

    @Test
    public void testEmptyListingStillMakesFolder() throws IOException {
        BackupCreator.Result result = new BackupCreator().createBackup(
            tempFolder,
            List.of(),
            WHEN
        );

        assertTrue(Files.isDirectory(result.directory()));
        assertEquals(0, result.copiedCount());
    }
}
