package org.sheetrenamer.controller;

import com.thoughtworks.xstream.XStream;
import com.thoughtworks.xstream.XStreamException;
import com.thoughtworks.xstream.converters.reflection.AbstractReflectionConverter.UnknownFieldException;
import com.thoughtworks.xstream.converters.reflection.PureJavaReflectionProvider;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.sheetrenamer.model.NameComparison;
import org.sheetrenamer.model.RenameMode;
import org.sheetrenamer.model.UserPreferences;

/**
 * Reads and writes {@code prefs.xml}.
 *
 * <pre>
 * &lt;preferences&gt;
 *   &lt;mappingFile&gt;...&lt;/mappingFile&gt;
 *   &lt;targetFolder&gt;...&lt;/targetFolder&gt;
 *   &lt;extension&gt;.pdf&lt;/extension&gt;
 *   &lt;mode&gt;PREFIX&lt;/mode&gt;
 *   &lt;delimiter&gt;-&lt;/delimiter&gt;
 *   &lt;backup&gt;true&lt;/backup&gt;
 *   &lt;recursive&gt;false&lt;/recursive&gt;
 *   &lt;autoPull&gt;true&lt;/autoPull&gt;
 *   &lt;nameComparison&gt;PLATFORM&lt;/nameComparison&gt;
 * &lt;/preferences&gt;
 * </pre>
 *
 * Elements missing from the file keep their defaults.  A file with elements
 * this version does not know is read a second time, ignoring them.
 */
public class UserPreferencesPersistence {

    private static final Logger logger = Logger.getLogger(
        UserPreferencesPersistence.class.getName()
    );

    private static final XStream STRICT = preferencesXStream(false);
    private static final XStream LENIENT = preferencesXStream(true);

    private UserPreferencesPersistence() {
        // utility
    }

    private static XStream preferencesXStream(final boolean ignoreUnknown) {
        // PureJavaReflectionProvider runs the default constructor, which is
        // where the defaults for missing elements come from.
        XStream xstream = new XStream(new PureJavaReflectionProvider());
        xstream.allowTypes(
            new Class[] {
                UserPreferences.class,
                RenameMode.class,
                NameComparison.class,
            }
        );
        xstream.alias("preferences", UserPreferences.class);
        xstream.omitField(UserPreferences.class, "pcs");
        xstream.aliasField("mode", UserPreferences.class, "renameMode");
        xstream.aliasField("backup", UserPreferences.class, "backupSelected");
        if (ignoreUnknown) {
            xstream.ignoreUnknownElements();
        }
        return xstream;
    }

    /**
     * Save the preferences, replacing any earlier file.  Failures are logged;
     * the application keeps running with the values in memory.
     *
     * @param prefs the preferences to save
     * @param path  where to write them
     */
    public static void persist(UserPreferences prefs, Path path) {
        String xml = STRICT.toXML(prefs);
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, xml);
        } catch (
            IOException
            | UnsupportedOperationException
            | SecurityException e
        ) {
            logger.log(
                Level.SEVERE,
                "could not write preferences file " + path.toAbsolutePath(),
                e
            );
        }
    }

    /**
     * Load the preferences.
     *
     * @param path the file to read
     * @return the preferences, or null if the file is missing or unusable,
     *         in which case the caller uses defaults
     */
    public static UserPreferences retrieve(Path path) {
        if (Files.notExists(path)) {
            logger.fine("no preferences file at " + path.toAbsolutePath());
            return null;
        }
        try {
            try {
                return read(STRICT, path);
            } catch (UnknownFieldException ufe) {
                logger.info(
                    "ignoring unknown elements in " +
                        path.toAbsolutePath() +
                        ": " +
                        ufe.getShortMessage()
                );
                return read(LENIENT, path);
            }
        } catch (
            IOException
            | XStreamException
            | ClassCastException
            | IllegalArgumentException
            | SecurityException e
        ) {
            logger.log(
                Level.SEVERE,
                "unusable preferences file " +
                    path.toAbsolutePath() +
                    "; using defaults",
                e
            );
            return null;
        }
    }

    private static UserPreferences read(final XStream xstream, final Path path)
        throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return (UserPreferences) xstream.fromXML(in);
        }
    }
}
