package org.sheetrenamer.model;

import java.util.Locale;
import org.sheetrenamer.model.util.Environment;

/**
 * Policy for deciding whether two file names refer to the same directory
 * entry when checking a proposed name for collisions.
 *
 * <p>Matching a row to a file is always exact and case-sensitive; this
 * policy only affects collision detection.
 */
public enum NameComparison {
    CASE_SENSITIVE("Case-sensitive"),
    CASE_INSENSITIVE("Case-insensitive"),
    PLATFORM("Platform default");

    private final String label;

    NameComparison(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }

    /**
     * @return CASE_SENSITIVE or CASE_INSENSITIVE; PLATFORM is resolved for
     *         the running operating system
     */
    public NameComparison resolve() {
        if (this != PLATFORM) {
            return this;
        }
        return Environment.HAS_CASE_INSENSITIVE_FILENAMES
            ? CASE_INSENSITIVE
            : CASE_SENSITIVE;
    }

    /**
     * Normalize a name into the key used for comparisons under this policy.
     *
     * @param name a file name
     * @return the comparison key
     */
    public String key(final String name) {
        if (resolve() == CASE_INSENSITIVE) {
            return name.toLowerCase(Locale.ROOT);
        }
        return name;
    }

    public static NameComparison fromString(String value) {
        if (value == null) {
            return null;
        }
        String upper = value.trim().toUpperCase(Locale.ROOT);
        for (NameComparison policy : values()) {
            if (policy.name().equals(upper)) {
                return policy;
            }
        }
        return null;
    }
}
