package org.sheetrenamer.view;

import static org.sheetrenamer.model.util.Constants.*;

import org.eclipse.swt.SWT;
import org.eclipse.swt.layout.GridData;
import org.eclipse.swt.layout.GridLayout;
import org.eclipse.swt.widgets.Button;
import org.eclipse.swt.widgets.Dialog;
import org.eclipse.swt.widgets.Shell;
import org.eclipse.swt.widgets.Text;

/**
 * Read-only help text: how matching works, the workflow, and what the
 * common error messages mean.
 */
public final class HelpDialog extends Dialog {

    private static final int WIDTH = 700;
    private static final int HEIGHT = 600;

    static final String HELP_TEXT =
        APPLICATION_NAME + " - Help\n" +
        "\n" +
        "HOW FILE MATCHING WORKS\n" +
        "Column B (" + CURRENT_FILENAME_COLUMN + ") must contain the EXACT file name.\n" +
        "- Files are found by their " + CURRENT_FILENAME_COLUMN + " value only; row position never matters.\n" +
        "- If " + CURRENT_FILENAME_COLUMN + " is empty or matches no file, that row is skipped.\n" +
        "- Matching is case-sensitive: \"Report.pdf\" does not match \"report.pdf\".\n" +
        "\n" +
        "WORKFLOW\n" +
        "1. Choose the target folder and press \"Scan Folder\" to create a template.\n" +
        "2. Edit the " + PREFIX_COLUMN + ", " + NEW_FILENAME_COLUMN + " and " + NOTES_COLUMN + " columns.\n" +
        "3. Save and close the workbook.\n" +
        "4. Press Preview and check the plan.\n" +
        "5. Press Run.\n" +
        "\n" +
        "The workbook is read again on every Preview and Run, so you can edit it\n" +
        "and try again without restarting.\n" +
        "\n" +
        "RENAME MODES\n" +
        "- Prefix: <" + PREFIX_COLUMN + "><Delimiter><" + NEW_FILENAME_COLUMN + "><ext>\n" +
        "  With an empty " + PREFIX_COLUMN + " the delimiter is left out.\n" +
        "- Replace: <" + NEW_FILENAME_COLUMN + "><ext>\n" +
        "An empty " + NEW_FILENAME_COLUMN + " keeps the current name.\n" +
        "\n" +
        "COLLISIONS\n" +
        "A row is refused, never overwritten, when its new name is already used by\n" +
        "another file or by an earlier row. The first row to claim a name wins.\n" +
        "A new name containing / or \\, or equal to . or .., is refused too:\n" +
        "files are only ever renamed inside their own folder.\n" +
        "\n" +
        "SAFETY\n" +
        "- Backup copies every listed file into a backup_<timestamp> folder first.\n" +
        "- Dry run writes the log but renames nothing.\n" +
        "- Every run writes rename_log_<timestamp>.txt into the target folder.\n" +
        "- Only local folders are accepted; nothing is sent anywhere.\n" +
        "\n" +
        "TROUBLESHOOTING\n" +
        "\"currently open in Excel\": close the workbook and try again.\n" +
        "\"File not found\": check that column B holds the exact file name.\n";

    private final Shell parent;

    public HelpDialog(final Shell parent) {
        super(parent, SWT.DIALOG_TRIM | SWT.APPLICATION_MODAL | SWT.RESIZE);
        this.parent = parent;
    }

    public void open() {
        Shell dialogShell = new Shell(parent, getStyle());
        dialogShell.setText("Help - " + APPLICATION_NAME);
        dialogShell.setLayout(new GridLayout(1, false));

        Text text = new Text(
            dialogShell,
            SWT.MULTI | SWT.READ_ONLY | SWT.WRAP | SWT.V_SCROLL | SWT.BORDER
        );
        text.setText(HELP_TEXT);
        text.setLayoutData(new GridData(SWT.FILL, SWT.FILL, true, true));

        Button closeButton = new Button(dialogShell, SWT.PUSH);
        closeButton.setText("Close");
        closeButton.setLayoutData(new GridData(SWT.CENTER, SWT.CENTER, false, false));
        closeButton.addListener(SWT.Selection, e -> dialogShell.close());
        dialogShell.setDefaultButton(closeButton);

        dialogShell.setSize(WIDTH, HEIGHT);
        DialogHelper.centerOver(dialogShell, parent);
        dialogShell.open();
        DialogHelper.runModalLoop(dialogShell);
    }
}
