package org.sheetrenamer.view;

import org.eclipse.swt.graphics.Rectangle;
import org.eclipse.swt.widgets.Display;
import org.eclipse.swt.widgets.Shell;

/**
 * Shared helper for the app's own dialog shells.
 */
public final class DialogHelper {

    private DialogHelper() {
        // utility class
    }

    /**
     * Center {@code dialogShell} over {@code parentShell}, kept on the
     * parent's monitor.  Call after {@code pack()} and before {@code open()}.
     *
     * @param dialogShell the dialog shell to position
     * @param parentShell the main window
     */
    public static void centerOver(final Shell dialogShell, final Shell parentShell) {
        if (parentShell == null || parentShell.isDisposed()) {
            return;
        }
        Rectangle parent = parentShell.getBounds();
        Rectangle dialog = dialogShell.getBounds();
        Rectangle workArea = parentShell.getMonitor().getClientArea();

        int x = parent.x + (parent.width - dialog.width) / 2;
        int y = parent.y + (parent.height - dialog.height) / 2;

        // Keep the dialog on screen.
        x = clamp(x, workArea.x, workArea.x + Math.max(0, workArea.width - dialog.width));
        y = clamp(y, workArea.y, workArea.y + Math.max(0, workArea.height - dialog.height));
        dialogShell.setLocation(x, y);
    }

    /**
     * Run a modal event loop that blocks until the given shell is disposed.
     *
     * @param dialogShell the dialog shell to run the loop for
     */
    public static void runModalLoop(final Shell dialogShell) {
        Display display = dialogShell.getDisplay();
        while (!dialogShell.isDisposed()) {
            if (!display.readAndDispatch()) {
                display.sleep();
            }
        }
    }

    private static int clamp(final int v, final int min, final int max) {
        if (v < min) {
            return min;
        }
        if (v > max) {
            return max;
        }
        return v;
    }
}
