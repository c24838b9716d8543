package org.sheetrenamer.view;

import static org.sheetrenamer.model.util.Constants.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.eclipse.swt.SWT;
import org.eclipse.swt.dnd.DND;
import org.eclipse.swt.dnd.DropTarget;
import org.eclipse.swt.dnd.DropTargetAdapter;
import org.eclipse.swt.dnd.DropTargetEvent;
import org.eclipse.swt.dnd.FileTransfer;
import org.eclipse.swt.dnd.Transfer;
import org.eclipse.swt.events.SelectionAdapter;
import org.eclipse.swt.events.SelectionEvent;
import org.eclipse.swt.layout.GridData;
import org.eclipse.swt.layout.GridLayout;
import org.eclipse.swt.layout.RowLayout;
import org.eclipse.swt.widgets.Button;
import org.eclipse.swt.widgets.Combo;
import org.eclipse.swt.widgets.Composite;
import org.eclipse.swt.widgets.Control;
import org.eclipse.swt.widgets.DirectoryDialog;
import org.eclipse.swt.widgets.Display;
import org.eclipse.swt.widgets.FileDialog;
import org.eclipse.swt.widgets.Label;
import org.eclipse.swt.widgets.ProgressBar;
import org.eclipse.swt.widgets.Shell;
import org.eclipse.swt.widgets.TaskBar;
import org.eclipse.swt.widgets.TaskItem;
import org.eclipse.swt.widgets.Text;
import org.sheetrenamer.controller.InvalidSettingsException;
import org.sheetrenamer.controller.MappingSourceException;
import org.sheetrenamer.controller.RenameSession;
import org.sheetrenamer.controller.TemplateLocator;
import org.sheetrenamer.controller.TemplateWriter;
import org.sheetrenamer.model.ExecutionResult;
import org.sheetrenamer.model.NameComparison;
import org.sheetrenamer.model.RenameMode;
import org.sheetrenamer.model.RenamePlan;
import org.sheetrenamer.model.RenameSettings;
import org.sheetrenamer.model.UserPreference;
import org.sheetrenamer.model.UserPreferences;

/**
 * The main window: where the workbook and the folder are chosen, the naming
 * options set, and Preview and Run started.
 *
 * <p>The window holds no mapping rows and no file listings.  Each Preview or
 * Run turns the current control values into a fresh {@link RenameSettings}
 * and hands it to a {@link RenameSession}, which reads everything anew.
 */
public final class RenamerWindow implements java.beans.PropertyChangeListener {

    private static final Logger logger = Logger.getLogger(
        RenamerWindow.class.getName()
    );
    // load preferences
    private static final UserPreferences prefs = UserPreferences.getInstance();

    // Labels for the delimiter presets that would otherwise be invisible.
    static final String SPACE_LABEL = "(space)";
    static final String NONE_LABEL = "(none)";

    private static final int PATH_TEXT_WIDTH = 420;

    private final UIStarter ui;
    private final Shell shell;
    private final Display display;
    private final RenameSession session = new RenameSession();

    private Text mappingText;
    private Text folderText;
    private Text extensionText;
    private Combo modeCombo;
    private Combo delimiterCombo;
    private Combo comparisonCombo;
    private Button backupCheckbox;
    private Button recursiveCheckbox;
    private Button dryRunCheckbox;
    private Button autoPullCheckbox;
    private Button blankTemplateButton;
    private Button previewButton;
    private Button runButton;
    private Label statusLabel;
    private ProgressBar progressBar;
    private TaskItem taskItem = null;

    // A scanned template in this session makes the blank one pointless.
    private boolean scanTemplateCreated = false;

    RenamerWindow(final UIStarter ui) {
        logger.fine("=== RenamerWindow constructor begin ===");
        this.ui = ui;
        this.shell = ui.shell;
        this.display = ui.display;

        setupTemplateButtons();
        setupPathFields();
        setupOptions();
        setupBottomComposite();
        setupDragDrop();
        loadPreferences();

        TaskBar taskBar = display.getSystemTaskBar();
        if (taskBar != null) {
            taskItem = taskBar.getItem(shell);
            if (taskItem == null) {
                taskItem = taskBar.getItem(null);
            }
        }
        logger.fine("RenamerWindow constructor complete.");
    }

    void ready() {
        prefs.addPropertyChangeListener(this);
        shell.addListener(SWT.Dispose, e -> prefs.removePropertyChangeListener(this));
        updateStatus();
    }

    ProgressBar getProgressBar() {
        return progressBar;
    }

    TaskItem getTaskItem() {
        return taskItem;
    }

    /*
     * Widgets
     */

    private void setupTemplateButtons() {
        final Composite topButtons = new Composite(shell, SWT.NONE);
        topButtons.setLayout(new RowLayout());
        topButtons.setLayoutData(
            new GridData(SWT.FILL, SWT.CENTER, true, false, 3, 1)
        );

        final Button scanButton = new Button(topButtons, SWT.PUSH);
        scanButton.setText("Scan Folder → Template");
        scanButton.setToolTipText(
            "List the files in the target folder into a new workbook"
        );
        scanButton.addSelectionListener(
            new SelectionAdapter() {
                @Override
                public void widgetSelected(SelectionEvent e) {
                    scanFolder();
                }
            }
        );

        blankTemplateButton = new Button(topButtons, SWT.PUSH);
        blankTemplateButton.setText("Blank Template");
        blankTemplateButton.addSelectionListener(
            new SelectionAdapter() {
                @Override
                public void widgetSelected(SelectionEvent e) {
                    saveBlankTemplate();
                }
            }
        );
    }

    private void setupPathFields() {
        new Label(shell, SWT.NONE).setText("Mapping file:");
        mappingText = pathText();
        mappingText.setMessage("Drop a workbook here, or leave empty to auto-pull");
        mappingText.addModifyListener(e -> prefs.setMappingFile(mappingText.getText().trim()));
        final Button mappingBrowse = new Button(shell, SWT.PUSH);
        mappingBrowse.setText("Browse...");
        mappingBrowse.addSelectionListener(
            new SelectionAdapter() {
                @Override
                public void widgetSelected(SelectionEvent e) {
                    FileDialog fd = new FileDialog(shell, SWT.OPEN);
                    fd.setFilterNames(new String[] { MAPPING_FILTER_NAMES });
                    fd.setFilterExtensions(new String[] { MAPPING_FILTER_EXTENSIONS });
                    String chosen = fd.open();
                    if (chosen != null) {
                        mappingText.setText(chosen);
                    }
                }
            }
        );

        new Label(shell, SWT.NONE).setText("Target folder:");
        folderText = pathText();
        folderText.addModifyListener(e -> prefs.setTargetFolder(folderText.getText().trim()));
        final Button folderBrowse = new Button(shell, SWT.PUSH);
        folderBrowse.setText("Browse...");
        folderBrowse.addSelectionListener(
            new SelectionAdapter() {
                @Override
                public void widgetSelected(SelectionEvent e) {
                    DirectoryDialog dd = new DirectoryDialog(shell, SWT.SINGLE);
                    String chosen = dd.open();
                    if (chosen != null) {
                        folderText.setText(chosen);
                    }
                }
            }
        );
    }

    private Text pathText() {
        Text text = new Text(shell, SWT.SINGLE | SWT.BORDER);
        GridData data = new GridData(SWT.FILL, SWT.CENTER, true, false);
        data.widthHint = PATH_TEXT_WIDTH;
        text.setLayoutData(data);
        return text;
    }

    private void setupOptions() {
        new Label(shell, SWT.NONE).setText("Extension:");
        extensionText = new Text(shell, SWT.SINGLE | SWT.BORDER);
        GridData extData = new GridData(SWT.BEGINNING, SWT.CENTER, false, false, 2, 1);
        extData.widthHint = 80;
        extensionText.setLayoutData(extData);
        extensionText.addModifyListener(e -> {
            String ext = extensionText.getText().trim();
            if (ext.startsWith(".") && ext.length() > 1) {
                prefs.setExtension(ext);
            }
        });

        new Label(shell, SWT.NONE).setText("Mode:");
        modeCombo = new Combo(shell, SWT.DROP_DOWN | SWT.READ_ONLY);
        for (RenameMode mode : RenameMode.values()) {
            modeCombo.add(mode.toString());
        }
        modeCombo.setLayoutData(new GridData(SWT.BEGINNING, SWT.CENTER, false, false, 2, 1));
        modeCombo.addListener(SWT.Selection, e -> {
            prefs.setRenameMode(RenameMode.fromString(modeCombo.getText()));
            delimiterCombo.setEnabled(prefs.getRenameMode() == RenameMode.PREFIX);
        });

        new Label(shell, SWT.NONE).setText("Delimiter:");
        delimiterCombo = new Combo(shell, SWT.DROP_DOWN);
        for (String preset : DELIMITER_PRESETS) {
            delimiterCombo.add(delimiterLabel(preset));
        }
        GridData delimData = new GridData(SWT.BEGINNING, SWT.CENTER, false, false, 2, 1);
        delimData.widthHint = 100;
        delimiterCombo.setLayoutData(delimData);
        delimiterCombo.addModifyListener(
            e -> prefs.setDelimiter(delimiterValue(delimiterCombo.getText()))
        );

        new Label(shell, SWT.NONE).setText("Name comparison:");
        comparisonCombo = new Combo(shell, SWT.DROP_DOWN | SWT.READ_ONLY);
        for (NameComparison policy : NameComparison.values()) {
            comparisonCombo.add(policy.toString());
        }
        comparisonCombo.setLayoutData(new GridData(SWT.BEGINNING, SWT.CENTER, false, false, 2, 1));
        comparisonCombo.setToolTipText(
            "How new names are checked against names already in the folder"
        );
        comparisonCombo.addListener(SWT.Selection, e -> {
            int index = comparisonCombo.getSelectionIndex();
            if (index >= 0) {
                prefs.setNameComparison(NameComparison.values()[index]);
            }
        });

        final Composite checkboxes = new Composite(shell, SWT.NONE);
        checkboxes.setLayout(new RowLayout());
        checkboxes.setLayoutData(new GridData(SWT.FILL, SWT.CENTER, true, false, 3, 1));

        backupCheckbox = checkbox(checkboxes, "Create backup");
        backupCheckbox.addListener(
            SWT.Selection,
            e -> prefs.setBackupSelected(backupCheckbox.getSelection())
        );
        recursiveCheckbox = checkbox(checkboxes, "Include sub-folders");
        recursiveCheckbox.addListener(
            SWT.Selection,
            e -> prefs.setRecursive(recursiveCheckbox.getSelection())
        );
        autoPullCheckbox = checkbox(checkboxes, "Auto-pull template from folder");
        autoPullCheckbox.addListener(
            SWT.Selection,
            e -> prefs.setAutoPull(autoPullCheckbox.getSelection())
        );
        // Session only; never saved.
        dryRunCheckbox = checkbox(checkboxes, "Dry run");
    }

    private static Button checkbox(final Composite parent, final String label) {
        Button b = new Button(parent, SWT.CHECK);
        b.setText(label);
        return b;
    }

    private void setupBottomComposite() {
        progressBar = new ProgressBar(shell, SWT.SMOOTH);
        progressBar.setMaximum(100);
        progressBar.setLayoutData(new GridData(SWT.FILL, SWT.CENTER, true, false, 3, 1));

        statusLabel = new Label(shell, SWT.NONE);
        statusLabel.setLayoutData(new GridData(SWT.FILL, SWT.CENTER, true, false, 3, 1));

        final Composite bottomButtons = new Composite(shell, SWT.NONE);
        bottomButtons.setLayout(new GridLayout(4, false));
        bottomButtons.setLayoutData(new GridData(SWT.END, SWT.CENTER, true, false, 3, 1));

        previewButton = new Button(bottomButtons, SWT.PUSH);
        previewButton.setText("Preview");
        previewButton.addListener(SWT.Selection, e -> previewRenames());

        final Button helpButton = new Button(bottomButtons, SWT.PUSH);
        helpButton.setText("Help");
        helpButton.addListener(SWT.Selection, e -> new HelpDialog(shell).open());

        runButton = new Button(bottomButtons, SWT.PUSH);
        runButton.setText("Run Rename");
        runButton.addListener(SWT.Selection, e -> runRenames());

        final Button exitButton = new Button(bottomButtons, SWT.PUSH);
        exitButton.setText("Exit");
        exitButton.addListener(SWT.Selection, e -> shell.close());
    }

    private void setupDragDrop() {
        dropTarget(shell);
        dropTarget(mappingText);
        dropTarget(folderText);
    }

    private void dropTarget(final Control control) {
        DropTarget dt = new DropTarget(control, DND.DROP_DEFAULT | DND.DROP_COPY);
        dt.setTransfer(new Transfer[] { FileTransfer.getInstance() });
        dt.addDropListener(
            new DropTargetAdapter() {
                @Override
                public void drop(DropTargetEvent e) {
                    FileTransfer ft = FileTransfer.getInstance();
                    if (ft.isSupportedType(e.currentDataType) && e.data != null) {
                        for (String dropped : (String[]) e.data) {
                            acceptDroppedPath(dropped);
                        }
                    }
                }
            }
        );
    }

    /**
     * A dropped folder becomes the target folder; a dropped workbook becomes
     * the mapping file.  Anything else is ignored.
     */
    private void acceptDroppedPath(final String dropped) {
        Path path;
        try {
            path = Paths.get(dropped);
        } catch (InvalidPathException ipe) {
            logger.fine("ignoring dropped path " + dropped + ": " + ipe.getMessage());
            return;
        }
        if (Files.isDirectory(path)) {
            folderText.setText(dropped);
        } else if (isWorkbookName(dropped)) {
            mappingText.setText(dropped);
        } else {
            logger.fine("ignoring dropped file " + dropped);
        }
    }

    static boolean isWorkbookName(final String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".xlsx") || lower.endsWith(".xls") || lower.endsWith(".xlsm");
    }

    /*
     * Preferences
     */

    private void loadPreferences() {
        mappingText.setText(prefs.getMappingFile());
        folderText.setText(prefs.getTargetFolder());
        extensionText.setText(prefs.getExtension());
        modeCombo.select(prefs.getRenameMode().ordinal());
        delimiterCombo.setText(delimiterLabel(prefs.getDelimiter()));
        delimiterCombo.setEnabled(prefs.getRenameMode() == RenameMode.PREFIX);
        comparisonCombo.select(prefs.getNameComparison().ordinal());
        backupCheckbox.setSelection(prefs.isBackupSelected());
        recursiveCheckbox.setSelection(prefs.isRecursive());
        autoPullCheckbox.setSelection(prefs.isAutoPull());
        dryRunCheckbox.setSelection(false);
    }

    static String delimiterLabel(final String delimiter) {
        if (" ".equals(delimiter)) {
            return SPACE_LABEL;
        }
        if (delimiter.isEmpty()) {
            return NONE_LABEL;
        }
        return delimiter;
    }

    static String delimiterValue(final String label) {
        if (SPACE_LABEL.equals(label)) {
            return " ";
        }
        if (NONE_LABEL.equals(label)) {
            return "";
        }
        return label;
    }

    @Override
    public void propertyChange(java.beans.PropertyChangeEvent evt) {
        if ("preference".equals(evt.getPropertyName())) {
            UserPreference which = (UserPreference) evt.getNewValue();
            switch (which) {
                case MAPPING_FILE:
                case TARGET_FOLDER:
                case AUTO_PULL:
                    updateStatus();
                    break;
                default:
                    break;
            }
        }
    }

    /**
     * Tell the user which workbook a pass would read.
     */
    private void updateStatus() {
        if (statusLabel == null || statusLabel.isDisposed()) {
            return;
        }
        String status = READY_STATUS;
        if (prefs.getMappingFile().isEmpty() && prefs.isAutoPull()) {
            Path folder = folderOrNull();
            if (folder != null && Files.isDirectory(folder)) {
                Optional<Path> found = new TemplateLocator().findTemplate(folder);
                if (found.isPresent()) {
                    status = "Auto-pull will use " + found.get().getFileName();
                }
            }
        }
        statusLabel.setText(status);
    }

    private Path folderOrNull() {
        String text = folderText.getText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Paths.get(text);
        } catch (InvalidPathException ipe) {
            return null;
        }
    }

    /*
     * Actions
     */

    /**
     * Build settings from the controls.
     *
     * @return the settings, or null after telling the user what is wrong
     */
    private RenameSettings currentSettings() {
        String folder = folderText.getText().trim();
        if (folder.isEmpty()) {
            ui.showMessageBox(SWTMessageBoxType.DLG_ERR, ERROR_LABEL, "Please choose a target folder.");
            return null;
        }
        String mapping = mappingText.getText().trim();
        try {
            return new RenameSettings.Builder()
                .mappingFile(mapping.isEmpty() ? null : Paths.get(mapping))
                .targetFolder(Paths.get(folder))
                .extension(extensionText.getText())
                .mode(RenameMode.fromString(modeCombo.getText()))
                .delimiter(delimiterValue(delimiterCombo.getText()))
                .recursive(recursiveCheckbox.getSelection())
                .backup(backupCheckbox.getSelection())
                .dryRun(dryRunCheckbox.getSelection())
                .autoPull(autoPullCheckbox.getSelection())
                .nameComparison(prefs.getNameComparison())
                .build();
        } catch (InvalidPathException e) {
            ui.showMessageBox(SWTMessageBoxType.DLG_ERR, ERROR_LABEL, "Invalid settings: " + e.getMessage());
            return null;
        }
    }

    private void previewRenames() {
        RenameSettings settings = currentSettings();
        if (settings == null) {
            return;
        }
        setBusy(true);
        try {
            Path mappingFile = session.resolveMappingFile(settings);
            RenamePlan plan = session.preview(settings.withMappingFile(mappingFile));
            statusLabel.setText(PreviewDialog.summaryText(plan));
            setBusy(false);
            new PreviewDialog(shell, plan, mappingFile).open();
        } catch (MappingSourceException mse) {
            showPassError(SOURCE_LOCKED_TITLE, mse);
        } catch (InvalidSettingsException ise) {
            showPassError(ERROR_LABEL, ise);
        } catch (IOException | RuntimeException e) {
            logger.log(Level.SEVERE, "preview failed", e);
            showPassError(ERROR_LABEL, e);
        } finally {
            setBusy(false);
        }
    }

    private void runRenames() {
        RenameSettings settings = currentSettings();
        if (settings == null) {
            return;
        }
        UserPreferences.store(prefs);
        if (!settings.isDryRun() && !ui.confirm(CONFIRM_RENAME_TITLE, CONFIRM_RENAME_MESSAGE)) {
            return;
        }

        setBusy(true);
        try {
            ExecutionResult result = session.run(settings, new ProgressBarUpdater(this));
            reportResult(result);
        } catch (MappingSourceException mse) {
            showPassError(SOURCE_LOCKED_TITLE, mse);
        } catch (InvalidSettingsException ise) {
            showPassError(ERROR_LABEL, ise);
        } catch (IOException | RuntimeException e) {
            // Whatever was renamed, logged or backed up so far stays as it is.
            logger.log(Level.SEVERE, "rename pass failed", e);
            showPassError(ERROR_LABEL, e);
        } finally {
            setBusy(false);
        }
    }

    private void reportResult(final ExecutionResult result) {
        StringBuilder message = new StringBuilder();
        if (result.isDryRun()) {
            message
                .append("Dry run complete - nothing was renamed.\n\nWould rename: ")
                .append(result.getWouldRenameCount());
        } else {
            message.append("Renamed: ").append(result.getRenamedCount());
        }
        message
            .append("\nErrors: ")
            .append(result.getErrorCount())
            .append("\nSkipped: ")
            .append(result.getSkippedCount())
            .append("\n\nLog: ")
            .append(result.getLogFile());
        if (result.getBackupDirectory() != null) {
            message.append("\nBackup: ").append(result.getBackupDirectory());
        }

        statusLabel.setText(
            (result.isDryRun() ? "Dry run: would rename " + result.getWouldRenameCount()
                : "Renamed " + result.getRenamedCount()) +
                ", errors " + result.getErrorCount() +
                ", skipped " + result.getSkippedCount()
        );
        ui.showMessageBox(
            (result.getErrorCount() > 0) ? SWTMessageBoxType.DLG_WARN : SWTMessageBoxType.DLG_OK,
            result.isDryRun() ? "Dry Run Complete" : "Rename Complete",
            message.toString()
        );
    }

    private void scanFolder() {
        RenameSettings settings = currentSettings();
        if (settings == null) {
            return;
        }
        try {
            RenameSession.validate(settings);
        } catch (InvalidSettingsException ise) {
            showPassError(ERROR_LABEL, ise);
            return;
        }
        Path dest = askSavePath(settings.getTargetFolder(), "Save Template");
        if (dest == null) {
            return;
        }
        setBusy(true);
        try {
            int count = session.writeScanTemplate(settings, dest);
            if (count == 0) {
                ui.showMessageBox(
                    SWTMessageBoxType.DLG_WARN,
                    "No Files Found",
                    "No " + settings.getExtension() + " files found in the selected folder."
                );
                return;
            }
            mappingText.setText(dest.toString());
            scanTemplateCreated = true;
            blankTemplateButton.setEnabled(false);
            statusLabel.setText("Template created with " + count + " files");
            ui.showMessageBox(
                SWTMessageBoxType.DLG_OK,
                "Template Created",
                "Template created:\n" + dest +
                    "\n\nColumn B (" + CURRENT_FILENAME_COLUMN + ") must match existing files!"
            );
        } catch (InvalidSettingsException | IOException e) {
            logger.log(Level.WARNING, "could not create template " + dest, e);
            showPassError(ERROR_LABEL, e);
        } finally {
            setBusy(false);
        }
    }

    private void saveBlankTemplate() {
        if (scanTemplateCreated) {
            return;
        }
        Path dest = askSavePath(folderOrNull(), "Save Blank Template");
        if (dest == null) {
            return;
        }
        try {
            new TemplateWriter().writeBlankTemplate(dest);
            statusLabel.setText("Blank template created");
            ui.showMessageBox(SWTMessageBoxType.DLG_OK, "Template Created", "Blank template saved:\n" + dest);
        } catch (IOException ioe) {
            logger.log(Level.WARNING, "could not save blank template " + dest, ioe);
            showPassError(ERROR_LABEL, ioe);
        }
    }

    private Path askSavePath(final Path initialDir, final String title) {
        FileDialog fd = new FileDialog(shell, SWT.SAVE);
        fd.setText(title);
        fd.setOverwrite(true);
        fd.setFilterNames(new String[] { MAPPING_FILTER_NAMES });
        fd.setFilterExtensions(new String[] { "*" + TEMPLATE_SUFFIX });
        fd.setFileName(TemplateWriter.defaultFileName(LocalDate.now()));
        if (initialDir != null) {
            fd.setFilterPath(initialDir.toString());
        }
        String chosen = fd.open();
        if (chosen == null) {
            return null;
        }
        if (!chosen.toLowerCase(Locale.ROOT).endsWith(TEMPLATE_SUFFIX)) {
            chosen = chosen + TEMPLATE_SUFFIX;
        }
        return Paths.get(chosen);
    }

    private void showPassError(final String title, final Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            message = e.getClass().getSimpleName();
        }
        statusLabel.setText(ERROR_LABEL + ": " + message.lines().findFirst().orElse(""));
        ui.showMessageBox(SWTMessageBoxType.DLG_ERR, title, message);
    }

    private void setBusy(final boolean busy) {
        if (shell.isDisposed()) {
            return;
        }
        previewButton.setEnabled(!busy);
        runButton.setEnabled(!busy);
        shell.setCursor(busy ? display.getSystemCursor(SWT.CURSOR_WAIT) : null);
    }

    /**
     * Called by the progress updater when a pass is over.
     */
    void finishPass() {
        if (!progressBar.isDisposed()) {
            progressBar.setSelection(0);
        }
    }
}
