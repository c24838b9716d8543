package org.sheetrenamer.model.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

public class Environment {

    private static final Logger logger = Logger.getLogger(
        Environment.class.getName()
    );

    public static final String USER_HOME = System.getProperty("user.home");
    private static final String OS_NAME = System.getProperty("os.name");

    private enum OSType {
        WINDOWS,
        LINUX,
        MAC,
    }

    private static OSType chooseOSType() {
        if (OS_NAME.contains("Mac")) {
            return OSType.MAC;
        }
        if (OS_NAME.contains("Windows")) {
            return OSType.WINDOWS;
        }
        return OSType.LINUX;
    }

    private static final OSType JVM_OS_TYPE = chooseOSType();
    public static final boolean IS_MAC_OSX = (JVM_OS_TYPE == OSType.MAC);
    public static final boolean IS_WINDOWS = (JVM_OS_TYPE == OSType.WINDOWS);

    /**
     * Whether the default file system of this platform usually treats names
     * that differ only by case as the same file.
     */
    public static final boolean HAS_CASE_INSENSITIVE_FILENAMES =
        IS_WINDOWS || IS_MAC_OSX;

    // A version is at least "x.y".
    private static final int MIN_BYTES_FOR_VERSION = 3;
    private static final String VERSION_RESOURCE = "/sheetrenamer.version";
    private static final String UNKNOWN_VERSION = "unknown";

    static String readVersionNumber() {
        byte[] buffer = new byte[32];

        try (
            InputStream stream = Environment.class.getResourceAsStream(
                VERSION_RESOURCE
            )
        ) {
            if (stream == null) {
                logger.warning(
                    "Version file '" +
                        VERSION_RESOURCE +
                        "' not found on classpath"
                );
                return UNKNOWN_VERSION;
            }

            int bytesRead = stream.read(buffer);
            if (bytesRead < MIN_BYTES_FOR_VERSION) {
                logger.warning("Unable to extract version from version file");
                return UNKNOWN_VERSION;
            }

            return new String(buffer, 0, bytesRead, StandardCharsets.UTF_8)
                .trim();
        } catch (IOException ioe) {
            logger.log(
                Level.WARNING,
                "Exception when reading resource " + VERSION_RESOURCE,
                ioe
            );
            return UNKNOWN_VERSION;
        }
    }
}
