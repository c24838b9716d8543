package org.sheetrenamer.model;

public interface ProgressUpdater {
    /**
     * Update the progress of a rename pass.
     *
     * @param totalNumFiles the number of operations that touch the filesystem
     * @param nRemaining    how many of them are still to do
     */
    void setProgress(int totalNumFiles, int nRemaining);

    /**
     * Called once the pass is over, successful or not.
     */
    void finish();
}
