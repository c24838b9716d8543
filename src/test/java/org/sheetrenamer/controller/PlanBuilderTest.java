package org.sheetrenamer.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sheetrenamer.model.FileEntry;
import org.sheetrenamer.model.NameComparison;
import org.sheetrenamer.model.OperationStatus;
import org.sheetrenamer.model.PlannedOperation;
import org.sheetrenamer.model.RenameIntent;
import org.sheetrenamer.model.RenameMode;
import org.sheetrenamer.model.RenamePlan;

public class PlanBuilderTest {

    @TempDir
    Path tempFolder;

    private final List<RenameIntent> rows = new ArrayList<>();

    private void row(String key, String prefix, String newBase) {
        rows.add(new RenameIntent(rows.size() + 1, key, prefix, newBase, ""));
    }

    private List<FileEntry> files(String... names) throws IOException {
        for (String name : names) {
            Path file = tempFolder.resolve(name);
            Files.createDirectories(file.getParent());
            Files.writeString(file, name);
        }
        return new FileLister().listFiles(tempFolder, ".pdf", true);
    }

    private RenamePlan prefixPlan(List<FileEntry> listing) {
        return PlanBuilder.build(
            rows,
            listing,
            RenameMode.PREFIX,
            ".pdf",
            "-",
            NameComparison.CASE_SENSITIVE
        );
    }

    private RenamePlan replacePlan(List<FileEntry> listing, NameComparison comparison) {
        return PlanBuilder.build(rows, listing, RenameMode.REPLACE, ".pdf", "-", comparison);
    }

    private static OperationStatus status(RenamePlan plan, int row) {
        return plan.getOperations().get(row - 1).status();
    }

    @Test
    @DisplayName("Rows without a usable key are skipped and carry no paths")
    public void testSkips() throws IOException {
        List<FileEntry> listing = files("a.pdf");
        row("", "001", "First");
        row("missing.pdf", "002", "Second");

        RenamePlan plan = prefixPlan(listing);

        assertEquals(OperationStatus.SKIP_EMPTY_KEY, status(plan, 1));
        assertEquals(OperationStatus.SKIP_NOT_FOUND, status(plan, 2));
        PlannedOperation notFound = plan.getOperations().get(1);
        assertEquals("missing.pdf", notFound.sourceKey());
        assertNull(notFound.oldPath());
        assertNull(notFound.newName());
        assertEquals(2, plan.getUnmatchedCount());
        assertEquals(0, plan.getActionableCount());
    }

    @Test
    @DisplayName("Matched rows get their new name and path in the file's own folder")
    public void testRename() throws IOException {
        List<FileEntry> listing = files("a.pdf", "b.pdf");
        row("a.pdf", "001", "Alpha");
        row("b.pdf", "002", "");

        RenamePlan plan = prefixPlan(listing);

        PlannedOperation first = plan.getOperations().get(0);
        assertEquals(OperationStatus.RENAME, first.status());
        assertEquals("a.pdf", first.oldName());
        assertEquals("001-Alpha.pdf", first.newName());
        assertEquals(tempFolder.resolve("a.pdf"), first.oldPath());
        assertEquals(tempFolder.resolve("001-Alpha.pdf"), first.newPath());

        assertEquals("002-b.pdf", plan.getOperations().get(1).newName());
        assertEquals(2, plan.count(OperationStatus.RENAME));
        assertEquals(2, plan.getListedFileCount());
    }

    @Test
    @DisplayName("A row whose new name equals the current name is NO_CHANGE")
    public void testNoChange() throws IOException {
        List<FileEntry> listing = files("a.pdf");
        row("a.pdf", "", "");

        RenamePlan plan = prefixPlan(listing);

        assertEquals(OperationStatus.NO_CHANGE, status(plan, 1));
        assertEquals(0, plan.getActionableCount());
    }

    @Test
    @DisplayName("A name held by a file that stays put is a collision")
    public void testCollisionWithExistingFile() throws IOException {
        List<FileEntry> listing = files("a.pdf", "b.pdf");
        row("a.pdf", "", "b");

        RenamePlan plan = replacePlan(listing, NameComparison.CASE_SENSITIVE);

        assertEquals(OperationStatus.COLLISION, status(plan, 1));
        assertEquals("b.pdf", plan.getOperations().get(0).newName());
    }

    @Test
    @DisplayName("Entries outside the listing, such as folders, also block a name")
    public void testCollisionWithUnlistedEntry() throws IOException {
        List<FileEntry> listing = files("a.pdf");
        Files.createDirectory(tempFolder.resolve("taken.pdf"));
        row("a.pdf", "", "taken");

        RenamePlan plan = replacePlan(listing, NameComparison.CASE_SENSITIVE);

        assertEquals(OperationStatus.COLLISION, status(plan, 1));
    }

    @Test
    @DisplayName("When two rows want the same name the earlier row wins")
    public void testFirstClaimWins() throws IOException {
        List<FileEntry> listing = files("a.pdf", "b.pdf");
        row("a.pdf", "", "Same");
        row("b.pdf", "", "Same");

        RenamePlan plan = replacePlan(listing, NameComparison.CASE_SENSITIVE);

        assertEquals(OperationStatus.RENAME, status(plan, 1));
        assertEquals(OperationStatus.COLLISION, status(plan, 2));
    }

    @Test
    @DisplayName("A name vacated by an earlier row is free for later rows")
    public void testVacatedName() throws IOException {
        List<FileEntry> listing = files("a.pdf", "b.pdf");
        row("b.pdf", "", "c");
        row("a.pdf", "", "b");

        RenamePlan plan = replacePlan(listing, NameComparison.CASE_SENSITIVE);

        assertEquals(OperationStatus.RENAME, status(plan, 1));
        assertEquals(OperationStatus.RENAME, status(plan, 2));
    }

    @Test
    @DisplayName("A name vacated only by a later row is still taken")
    public void testNameVacatedLater() throws IOException {
        List<FileEntry> listing = files("a.pdf", "b.pdf");
        row("a.pdf", "", "b");
        row("b.pdf", "", "c");

        RenamePlan plan = replacePlan(listing, NameComparison.CASE_SENSITIVE);

        assertEquals(OperationStatus.COLLISION, status(plan, 1));
        assertEquals(OperationStatus.RENAME, status(plan, 2));
    }

    @Test
    @DisplayName("Swapping two names is refused for both rows")
    public void testSwap() throws IOException {
        List<FileEntry> listing = files("a.pdf", "b.pdf");
        row("a.pdf", "", "b");
        row("b.pdf", "", "a");

        RenamePlan plan = replacePlan(listing, NameComparison.CASE_SENSITIVE);

        assertEquals(OperationStatus.COLLISION, status(plan, 1));
        assertEquals(OperationStatus.COLLISION, status(plan, 2));
    }

    @Test
    @DisplayName("A later row can match a file by the name an earlier row gave it")
    public void testChain() throws IOException {
        List<FileEntry> listing = files("a.pdf");
        row("a.pdf", "", "b");
        row("b.pdf", "", "c");

        RenamePlan plan = replacePlan(listing, NameComparison.CASE_SENSITIVE);

        assertEquals(OperationStatus.RENAME, status(plan, 1));
        assertEquals(OperationStatus.RENAME, status(plan, 2));
        PlannedOperation second = plan.getOperations().get(1);
        assertEquals(tempFolder.resolve("b.pdf"), second.oldPath());
        assertEquals(tempFolder.resolve("c.pdf"), second.newPath());
    }

    @Test
    @DisplayName("Once renamed, a file can no longer be matched by its old name")
    public void testOldNameGone() throws IOException {
        List<FileEntry> listing = files("a.pdf");
        row("a.pdf", "", "b");
        row("a.pdf", "", "c");

        RenamePlan plan = replacePlan(listing, NameComparison.CASE_SENSITIVE);

        assertEquals(OperationStatus.RENAME, status(plan, 1));
        assertEquals(OperationStatus.SKIP_NOT_FOUND, status(plan, 2));
    }

    @Test
    @DisplayName("Case-insensitive comparison treats names differing by case as taken")
    public void testCaseInsensitiveCollision() throws IOException {
        List<FileEntry> listing = files("a.pdf", "B.pdf");
        row("a.pdf", "", "b");

        assertEquals(
            OperationStatus.COLLISION,
            status(replacePlan(listing, NameComparison.CASE_INSENSITIVE), 1)
        );
    }

    @Test
    @DisplayName("Case-sensitive comparison lets names differing by case coexist")
    public void testCaseSensitiveNoCollision() throws IOException {
        List<FileEntry> listing = files("a.pdf", "B.pdf");
        row("a.pdf", "", "b");

        assertEquals(
            OperationStatus.RENAME,
            status(replacePlan(listing, NameComparison.CASE_SENSITIVE), 1)
        );
    }

    @Test
    @DisplayName("Changing only the case of a name never collides with the file itself")
    public void testCaseOnlyRename() throws IOException {
        List<FileEntry> listing = files("report.pdf");
        row("report.pdf", "", "REPORT");

        RenamePlan plan = replacePlan(listing, NameComparison.CASE_INSENSITIVE);

        assertEquals(OperationStatus.RENAME, status(plan, 1));
        assertEquals("REPORT.pdf", plan.getOperations().get(0).newName());
    }

    @Test
    @DisplayName("Changing only the case is a collision when a different file has that name")
    public void testCaseOnlyRenameOntoDifferentFile() throws IOException {
        List<FileEntry> listing = files("a.pdf", "A.pdf");
        assumeTrue(listing.size() == 2, "filesystem folds case");
        row("a.pdf", "", "A");

        RenamePlan plan = replacePlan(listing, NameComparison.CASE_INSENSITIVE);

        assertEquals(OperationStatus.COLLISION, status(plan, 1));
    }

    @Test
    @DisplayName("A case-only rename may take a name an earlier row vacated")
    public void testCaseOnlyRenameOntoVacatedName() throws IOException {
        List<FileEntry> listing = files("a.pdf", "A.pdf");
        assumeTrue(listing.size() == 2, "filesystem folds case");
        row("A.pdf", "", "Moved");
        row("a.pdf", "", "A");

        RenamePlan plan = replacePlan(listing, NameComparison.CASE_INSENSITIVE);

        assertEquals(OperationStatus.RENAME, status(plan, 1));
        assertEquals(OperationStatus.RENAME, status(plan, 2));
    }

    @Test
    @DisplayName("New names that would leave the file's folder are refused")
    public void testTargetNameOutsideFolder() throws IOException {
        List<FileEntry> listing = files("a.pdf", "b.pdf", "c.pdf", "d.pdf");
        row("a.pdf", "", "../escaped");
        row("b.pdf", "", "sub/inner");
        row("c.pdf", "", "sub\\inner");
        row("d.pdf", "", "Fine");

        RenamePlan plan = replacePlan(listing, NameComparison.CASE_SENSITIVE);

        assertEquals(OperationStatus.INVALID_NAME, status(plan, 1));
        assertEquals(OperationStatus.INVALID_NAME, status(plan, 2));
        assertEquals(OperationStatus.INVALID_NAME, status(plan, 3));
        assertEquals(OperationStatus.RENAME, status(plan, 4));
        PlannedOperation escaped = plan.getOperations().get(0);
        assertEquals("../escaped.pdf", escaped.newName());
        assertNull(escaped.newPath(), "refused row has a target path");
        assertEquals(4, plan.getActionableCount());
    }

    @Test
    @DisplayName("A refused name does not claim or vacate anything")
    public void testRefusedNameClaimsNothing() throws IOException {
        List<FileEntry> listing = files("a.pdf", "b.pdf");
        row("a.pdf", "", "../b");
        row("b.pdf", "", "a");

        RenamePlan plan = replacePlan(listing, NameComparison.CASE_SENSITIVE);

        assertEquals(OperationStatus.INVALID_NAME, status(plan, 1));
        assertEquals(OperationStatus.COLLISION, status(plan, 2), "a.pdf was still there");
    }

    @Test
    @DisplayName("Files in different folders may take the same name")
    public void testClaimsArePerFolder() throws IOException {
        List<FileEntry> listing = files("one/a.pdf", "two/b.pdf");
        row("a.pdf", "", "Same");
        row("b.pdf", "", "Same");

        RenamePlan plan = replacePlan(listing, NameComparison.CASE_SENSITIVE);

        assertEquals(OperationStatus.RENAME, status(plan, 1));
        assertEquals(OperationStatus.RENAME, status(plan, 2));
        assertEquals(
            tempFolder.resolve("two").resolve("Same.pdf"),
            plan.getOperations().get(1).newPath()
        );
    }

    @Test
    @DisplayName("Building a plan does not touch the files")
    public void testReadOnly() throws IOException {
        List<FileEntry> listing = files("a.pdf", "b.pdf");
        row("a.pdf", "001", "Alpha");
        row("b.pdf", "002", "Bravo");

        RenamePlan plan = prefixPlan(listing);

        assertEquals(2, plan.count(OperationStatus.RENAME));
        assertTrue(Files.exists(tempFolder.resolve("a.pdf")));
        assertTrue(Files.exists(tempFolder.resolve("b.pdf")));
        assertEquals(2, new FileLister().listFiles(tempFolder, ".pdf", false).size());
    }

    @Test
    @DisplayName("Operations come back in row order with row numbers and notes")
    public void testOrderAndNotes() throws IOException {
        List<FileEntry> listing = files("a.pdf", "b.pdf");
        rows.add(new RenameIntent(1, "b.pdf", "1", "", "first"));
        rows.add(new RenameIntent(2, "", "", "", ""));
        rows.add(new RenameIntent(3, "a.pdf", "3", "", "third"));

        RenamePlan plan = prefixPlan(listing);

        assertEquals(3, plan.getOperations().size());
        for (int i = 0; i < 3; i++) {
            assertEquals(i + 1, plan.getOperations().get(i).rowNumber());
        }
        assertEquals("first", plan.getOperations().get(0).note());
        assertEquals("third", plan.getOperations().get(2).note());
        assertTrue(plan.getOperations().get(2).hasNote());
    }
}
