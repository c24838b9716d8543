package org.sheetrenamer.view;

import static org.sheetrenamer.model.util.Constants.*;

import java.nio.file.Path;
import org.eclipse.swt.SWT;
import org.eclipse.swt.graphics.Color;
import org.eclipse.swt.layout.GridData;
import org.eclipse.swt.layout.GridLayout;
import org.eclipse.swt.widgets.Button;
import org.eclipse.swt.widgets.Dialog;
import org.eclipse.swt.widgets.Label;
import org.eclipse.swt.widgets.Shell;
import org.eclipse.swt.widgets.Table;
import org.eclipse.swt.widgets.TableColumn;
import org.eclipse.swt.widgets.TableItem;
import org.sheetrenamer.model.OperationStatus;
import org.sheetrenamer.model.PlannedOperation;
import org.sheetrenamer.model.RenamePlan;

/**
 * Modal dialog listing every row of a plan: what it matched, what the file
 * would be called, and why a row will be skipped or refused.
 *
 * <p>Nothing is renamed from here; the user closes the dialog and presses
 * Run if the plan looks right.
 */
public final class PreviewDialog extends Dialog {

    private static final String TITLE = "Preview";
    private static final int MIN_WIDTH = 760;
    private static final int MIN_HEIGHT = 420;

    private static final int WIDTH_ROW = 50;
    private static final int WIDTH_CURRENT = 260;
    private static final int WIDTH_NEW = 260;
    private static final int WIDTH_STATUS = 200;

    private final Shell parent;
    private final RenamePlan plan;
    private final Path mappingFile;

    private Shell dialogShell;

    /**
     * @param parent      the main window
     * @param plan        the plan to show
     * @param mappingFile the workbook the plan was read from
     */
    public PreviewDialog(
        final Shell parent,
        final RenamePlan plan,
        final Path mappingFile
    ) {
        super(parent, SWT.DIALOG_TRIM | SWT.APPLICATION_MODAL | SWT.RESIZE);
        this.parent = parent;
        this.plan = plan;
        this.mappingFile = mappingFile;
    }

    /**
     * Open the dialog and block until the user closes it.
     */
    public void open() {
        dialogShell = new Shell(parent, getStyle());
        dialogShell.setText(TITLE + " - " + APPLICATION_NAME);
        dialogShell.setMinimumSize(MIN_WIDTH, MIN_HEIGHT);

        createContents();

        dialogShell.pack();
        dialogShell.setSize(
            Math.max(dialogShell.getSize().x, MIN_WIDTH),
            Math.max(dialogShell.getSize().y, MIN_HEIGHT)
        );
        DialogHelper.centerOver(dialogShell, parent);
        dialogShell.open();
        DialogHelper.runModalLoop(dialogShell);
    }

    private void createContents() {
        dialogShell.setLayout(new GridLayout(1, false));

        Label sourceLabel = new Label(dialogShell, SWT.WRAP);
        sourceLabel.setText("Mapping: " + mappingFile);
        sourceLabel.setLayoutData(new GridData(SWT.FILL, SWT.TOP, true, false));

        Table table = new Table(
            dialogShell,
            SWT.BORDER | SWT.FULL_SELECTION | SWT.V_SCROLL | SWT.H_SCROLL
        );
        table.setHeaderVisible(true);
        table.setLinesVisible(true);
        GridData tableData = new GridData(SWT.FILL, SWT.FILL, true, true);
        tableData.heightHint = 300;
        table.setLayoutData(tableData);

        addColumn(table, ROW_COLUMN, WIDTH_ROW);
        addColumn(table, CURRENT_FILENAME_COLUMN, WIDTH_CURRENT);
        addColumn(table, "New name", WIDTH_NEW);
        addColumn(table, "Status", WIDTH_STATUS);

        for (PlannedOperation op : plan.getOperations()) {
            TableItem item = new TableItem(table, SWT.NONE);
            item.setText(
                new String[] {
                    Integer.toString(op.rowNumber()),
                    op.sourceKey(),
                    (op.newName() == null) ? "" : op.newName(),
                    op.status().getDescription(),
                }
            );
            Color color = colorFor(op.status());
            if (color != null) {
                item.setForeground(color);
            }
        }

        Label summaryLabel = new Label(dialogShell, SWT.NONE);
        summaryLabel.setText(summaryText(plan));
        summaryLabel.setLayoutData(new GridData(SWT.FILL, SWT.CENTER, true, false));

        Button closeButton = new Button(dialogShell, SWT.PUSH);
        closeButton.setText("Close");
        closeButton.setLayoutData(new GridData(SWT.END, SWT.CENTER, false, false));
        closeButton.addListener(SWT.Selection, e -> dialogShell.close());
        dialogShell.setDefaultButton(closeButton);
    }

    private Color colorFor(final OperationStatus status) {
        switch (status) {
            case COLLISION:
            case INVALID_NAME:
                return dialogShell.getDisplay().getSystemColor(SWT.COLOR_DARK_RED);
            case SKIP_EMPTY_KEY:
            case SKIP_NOT_FOUND:
                return dialogShell.getDisplay().getSystemColor(SWT.COLOR_DARK_YELLOW);
            default:
                return null;
        }
    }

    private static void addColumn(final Table table, final String title, final int width) {
        TableColumn column = new TableColumn(table, SWT.LEFT);
        column.setText(title);
        column.setWidth(width);
    }

    static String summaryText(final RenamePlan plan) {
        return (
            "Files found: " +
            plan.getListedFileCount() +
            " | Rename: " +
            plan.count(OperationStatus.RENAME) +
            " | No change: " +
            plan.count(OperationStatus.NO_CHANGE) +
            " | Skipped: " +
            plan.getUnmatchedCount() +
            " | Collisions: " +
            plan.count(OperationStatus.COLLISION) +
            " | Invalid names: " +
            plan.count(OperationStatus.INVALID_NAME)
        );
    }
}
