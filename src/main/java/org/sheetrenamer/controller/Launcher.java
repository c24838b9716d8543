package org.sheetrenamer.controller;

import static org.sheetrenamer.model.util.Constants.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import org.sheetrenamer.model.UserPreferences;
import org.sheetrenamer.view.UIStarter;

/**
 * Application launcher.
 *
 * Logging strategy:
 * - Primary configuration comes from {@code /logging.properties}.
 * - A file log ({@code sheetrenamer.log}) is created only when:
 *   - debug is enabled via {@code -Dsheetrenamer.debug=true}, OR
 *   - a fatal error occurs (then we write exception + environment summary).
 *
 * The log file is written next to the jar if possible, otherwise to the
 * temporary directory.  It is overwritten each run.
 */
class Launcher {

    private static final Logger logger = Logger.getLogger(
        Launcher.class.getName()
    );

    private static final String DEBUG_PROPERTY = "sheetrenamer.debug";
    private static final String LOG_FILENAME = "sheetrenamer.log";

    private static volatile FileHandler fileHandler;

    static void initializeLoggingConfig() {
        try (
            InputStream in = Launcher.class.getResourceAsStream(
                LOGGING_PROPERTIES
            )
        ) {
            if (in == null) {
                // Keep default JUL configuration; do not hard-fail startup.
                logger.warning(
                    "logging.properties not found on classpath; using default JDK logging configuration."
                );
                return;
            }
            LogManager.getLogManager().readConfiguration(in);
        } catch (IOException | SecurityException e) {
            // Logging config failures should not prevent startup.
            System.err.println("Failed to load logging configuration: " + e);
            logger.log(
                Level.WARNING,
                "Failed to load logging configuration",
                e
            );
        }
    }

    private static boolean isDebugEnabled() {
        return Boolean.parseBoolean(
            System.getProperty(DEBUG_PROPERTY, "false")
        );
    }

    private static Path resolveLogDirectory() {
        // 1) The directory containing the jar (or the classes directory).
        try {
            CodeSource cs =
                Launcher.class.getProtectionDomain().getCodeSource();
            if (cs != null) {
                URL location = cs.getLocation();
                if (location != null) {
                    URI uri = location.toURI();
                    Path p = Paths.get(uri).toAbsolutePath().normalize();

                    if (Files.isDirectory(p)) {
                        return p;
                    }
                    Path parent = p.getParent();
                    if (parent != null) {
                        return parent;
                    }
                }
            }
        } catch (
            URISyntaxException
            | IllegalArgumentException
            | SecurityException e
        ) {
            logger.fine("no code source directory for the log file: " + e);
        }

        // 2) Fallback: java.io.tmpdir
        return Paths.get(System.getProperty("java.io.tmpdir", "."))
            .toAbsolutePath()
            .normalize();
    }

    private static Path resolveLogFilePath() {
        return resolveLogDirectory().resolve(LOG_FILENAME);
    }

    private static synchronized void ensureFileLoggingAttached() {
        if (fileHandler != null) {
            return;
        }

        Path logPath = resolveLogFilePath();

        try {
            // Overwrite each run (append=false)
            fileHandler = new FileHandler(logPath.toString(), false);
            fileHandler.setFormatter(new SimpleFormatter());
            fileHandler.setLevel(Level.ALL);

            Logger root = Logger.getLogger("");
            root.addHandler(fileHandler);

            // Do not force root level here; honor logging.properties.
            logger.info("File logging enabled: " + logPath);
        } catch (IOException | SecurityException e) {
            // If we can't create the log file, do not block startup.
            System.err.println(
                "Could not create log file at " +
                    logPath +
                    ": " +
                    e.getMessage()
            );
            logger.log(
                Level.WARNING,
                "Could not create log file at " + logPath,
                e
            );
        }
    }

    private static String buildEnvironmentSummary() {
        StringBuilder sb = new StringBuilder(512);
        sb.append("=== ").append(APPLICATION_NAME).append(" Environment ===\n");
        sb.append("Version: ").append(VERSION_NUMBER).append('\n');
        sb
            .append("Java Version: ")
            .append(System.getProperty("java.version"))
            .append('\n');
        sb
            .append("Java Home: ")
            .append(System.getProperty("java.home"))
            .append('\n');
        sb
            .append("OS: ")
            .append(System.getProperty("os.name"))
            .append(' ')
            .append(System.getProperty("os.arch"))
            .append('\n');
        sb
            .append("Working Directory: ")
            .append(System.getProperty("user.dir"))
            .append('\n');
        sb.append("Preferences: ").append(PREFERENCES_FILE).append('\n');
        sb.append("Log File: ").append(resolveLogFilePath()).append('\n');
        return sb.toString();
    }

    private static String stackTraceToString(Throwable t) {
        StringWriter sw = new StringWriter(4096);
        PrintWriter pw = new PrintWriter(sw);
        t.printStackTrace(pw);
        pw.flush();
        return sw.toString();
    }

    private static void logFatal(String context, Throwable t) {
        // Attach file logging if not already enabled.
        ensureFileLoggingAttached();

        logger.severe("FATAL: " + context);
        logger.severe(buildEnvironmentSummary());
        logger.severe(stackTraceToString(t));
    }

    /**
     * Save preferences and close the file log.  There are no worker threads
     * to stop; every pass runs on the UI thread.
     */
    private static void shutdown() {
        logger.fine("Saving preferences...");
        UserPreferences.store(UserPreferences.getInstance());
        logger.fine("Shutdown complete.");

        FileHandler handler = fileHandler;
        if (handler != null) {
            handler.close();
        }
    }

    public static void main(String[] args) {
        // Configure logging from logging.properties (best effort).
        initializeLoggingConfig();

        // If debug enabled, create/overwrite sheetrenamer.log immediately.
        if (isDebugEnabled()) {
            ensureFileLoggingAttached();
            logger.info("Debug enabled via -D" + DEBUG_PROPERTY + "=true");
        }

        // Set up global exception handler to catch any uncaught exceptions.
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) -> {
            logFatal(
                "Uncaught exception in thread " + thread.getName(),
                throwable
            );
            shutdown();
        });

        try {
            logger.info("=== " + APPLICATION_NAME + " Startup ===");
            logger.info("Version: " + VERSION_NUMBER);

            UIStarter ui = new UIStarter();
            int status = ui.run();

            shutdown();
            logger.info("=== " + APPLICATION_NAME + " Exit ===");
            System.exit(status);
        } catch (Throwable t) {
            logFatal("Exception in main()", t);
            shutdown();
            System.exit(1);
        }
    }
}
