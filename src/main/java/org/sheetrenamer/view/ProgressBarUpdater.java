package org.sheetrenamer.view;

import org.eclipse.swt.SWT;
import org.eclipse.swt.widgets.ProgressBar;
import org.eclipse.swt.widgets.TaskItem;
import org.sheetrenamer.model.ProgressUpdater;

/**
 * Drives the main window's progress bar, and the taskbar entry where the
 * platform has one, during a rename pass.
 *
 * <p>Passes run on the UI thread, so the bar is updated directly and
 * repainted immediately rather than via {@code asyncExec}.
 */
public class ProgressBarUpdater implements ProgressUpdater {

    private final RenamerWindow ui;
    private final TaskItem taskItem;
    private final ProgressBar progressBar;
    private final int barMax;

    /**
     * Constructs a ProgressBarUpdater for the given window.
     *
     * @param ui
     *    the window whose progress bar this updates
     */
    public ProgressBarUpdater(RenamerWindow ui) {
        this.ui = ui;
        this.taskItem = ui.getTaskItem();
        this.progressBar = ui.getProgressBar();

        if (progressBar != null && !progressBar.isDisposed()) {
            this.barMax = Math.max(1, progressBar.getMaximum());
            progressBar.setSelection(0);
        } else {
            this.barMax = 0;
        }

        if (taskItem != null && !taskItem.isDisposed()) {
            taskItem.setProgressState(SWT.NORMAL);
        }
    }

    /**
     * Resets the progress bar and the task item once the pass is over.
     */
    @Override
    public void finish() {
        if (progressBar != null && !progressBar.isDisposed()) {
            progressBar.setSelection(0);
        }
        if (taskItem != null && !taskItem.isDisposed()) {
            taskItem.setProgressState(SWT.DEFAULT);
            taskItem.setProgress(0);
        }
        ui.finishPass();
    }

    /**
     * Updates the progress bar by operation count.
     *
     * @param totalNumFiles
     *            the number of operations that touch the filesystem
     * @param nRemaining
     *            how many of them are left
     */
    @Override
    public void setProgress(final int totalNumFiles, final int nRemaining) {
        if (totalNumFiles <= 0 || barMax <= 0) {
            return;
        }
        if (progressBar == null || progressBar.isDisposed()) {
            return;
        }

        final int completed = Math.max(0, totalNumFiles - nRemaining);
        final float progress = (float) completed / (float) totalNumFiles;

        progressBar.setSelection(Math.round(progress * barMax));
        progressBar.update();

        if (taskItem != null && !taskItem.isDisposed()) {
            taskItem.setProgress(Math.round(progress * 100));
        }
    }
}
