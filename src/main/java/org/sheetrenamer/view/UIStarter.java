package org.sheetrenamer.view;

import static org.sheetrenamer.model.util.Constants.*;

import java.util.logging.Logger;
import org.eclipse.swt.SWT;
import org.eclipse.swt.layout.GridLayout;
import org.eclipse.swt.widgets.Display;
import org.eclipse.swt.widgets.MessageBox;
import org.eclipse.swt.widgets.Shell;
import org.sheetrenamer.model.UserPreferences;

/**
 * Creates the display and the main shell, and runs the SWT event loop.
 */
public final class UIStarter {

    private static final Logger logger = Logger.getLogger(
        UIStarter.class.getName()
    );

    private static final int MIN_WIDTH = 720;
    private static final int MIN_HEIGHT = 420;

    final Display display;
    final Shell shell;
    private final RenamerWindow window;

    public UIStarter() {
        Display.setAppName(APPLICATION_NAME);
        display = new Display();

        shell = new Shell(display);
        shell.setText(APPLICATION_NAME + " " + VERSION_NUMBER);
        shell.setLayout(new GridLayout(3, false));

        window = new RenamerWindow(this);

        shell.addListener(SWT.Close, e -> {
            logger.fine("main window closing; saving preferences");
            UserPreferences.store(UserPreferences.getInstance());
        });
    }

    /**
     * Show a modal message box over the main window.
     *
     * @param type    the kind of box (sets the icon)
     * @param title   the window title
     * @param message the text
     */
    void showMessageBox(
        final SWTMessageBoxType type,
        final String title,
        final String message
    ) {
        if (shell.isDisposed()) {
            logger.warning("message box after shutdown: " + title + ": " + message);
            return;
        }
        MessageBox msgBox = new MessageBox(shell, type.swtIconValue | SWT.OK);
        msgBox.setText(title);
        msgBox.setMessage(message);
        msgBox.open();
    }

    /**
     * Ask a yes/no question.
     *
     * @return true if the user answered yes
     */
    boolean confirm(final String title, final String message) {
        MessageBox msgBox = new MessageBox(
            shell,
            SWT.ICON_QUESTION | SWT.YES | SWT.NO
        );
        msgBox.setText(title);
        msgBox.setMessage(message);
        return msgBox.open() == SWT.YES;
    }

    /**
     * Open the main window and process events until it is closed.
     *
     * @return the process exit status
     */
    public int run() {
        shell.pack();
        shell.setMinimumSize(MIN_WIDTH, MIN_HEIGHT);
        shell.setSize(
            Math.max(shell.getSize().x, MIN_WIDTH),
            Math.max(shell.getSize().y, MIN_HEIGHT)
        );
        shell.open();
        window.ready();

        while (!shell.isDisposed()) {
            if (!display.readAndDispatch()) {
                display.sleep();
            }
        }
        display.dispose();
        return 0;
    }
}
