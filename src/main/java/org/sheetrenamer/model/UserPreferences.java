package org.sheetrenamer.model;

import static org.sheetrenamer.model.util.Constants.*;

import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;
import org.sheetrenamer.controller.UserPreferencesPersistence;
import org.sheetrenamer.controller.util.FileUtilities;

public class UserPreferences {

    private static final Logger logger = Logger.getLogger(
        UserPreferences.class.getName()
    );

    private static final UserPreferences INSTANCE = load();

    private final java.beans.PropertyChangeSupport pcs =
        new java.beans.PropertyChangeSupport(this);

    public void addPropertyChangeListener(
        java.beans.PropertyChangeListener listener
    ) {
        pcs.addPropertyChangeListener(listener);
    }

    public void removePropertyChangeListener(
        java.beans.PropertyChangeListener listener
    ) {
        pcs.removePropertyChangeListener(listener);
    }

    private String mappingFile;
    private String targetFolder;
    private String extension;
    private RenameMode renameMode;
    private String delimiter;
    private boolean backupSelected;
    private boolean recursive;
    private boolean autoPull;
    private NameComparison nameComparison;

    /**
     * UserPreferences constructor which uses the defaults from
     * {@link org.sheetrenamer.model.util.Constants}
     */
    UserPreferences() {
        mappingFile = "";
        targetFolder = "";
        extension = DEFAULT_EXTENSION;
        renameMode = RenameMode.PREFIX;
        delimiter = DEFAULT_DELIMITER;
        backupSelected = true;
        recursive = false;
        autoPull = true;
        nameComparison = NameComparison.PLATFORM;
    }

    /**
     * @return the singleton UserPreferences instance for this application
     */
    public static UserPreferences getInstance() {
        return INSTANCE;
    }

    /**
     * Save preferences to xml file
     *
     * @param prefs the instance to export to XML
     */
    @SuppressWarnings("SameParameterValue")
    public static void store(UserPreferences prefs) {
        UserPreferencesPersistence.persist(prefs, PREFERENCES_FILE);
        logger.fine("Successfully saved/updated preferences");
    }

    /**
     * Load preferences from xml file
     *
     * @return an instance of UserPreferences, expected to be used as the
     *         singleton instance for the class
     */
    private static UserPreferences load() {
        if (!FileUtilities.ensureWritableDirectory(CONFIGURATION_DIRECTORY)) {
            // Not fatal: we run on defaults and simply cannot save.
            logger.warning(
                "Could not create configuration directory: " +
                    CONFIGURATION_DIRECTORY
            );
        }

        UserPreferences prefs = UserPreferencesPersistence.retrieve(
            PREFERENCES_FILE
        );

        if (prefs != null) {
            prefs.sanitize();
            logger.fine("Successfully read preferences: " + prefs.toString());
        } else {
            prefs = new UserPreferences();
        }

        return prefs;
    }

    /**
     * Fill in anything a hand-edited or older prefs.xml left out.
     * XStream bypasses the constructor, so absent fields arrive as null.
     */
    void sanitize() {
        if (mappingFile == null) {
            mappingFile = "";
        }
        if (targetFolder == null) {
            targetFolder = "";
        }
        if (extension == null || !extension.startsWith(".")) {
            extension = DEFAULT_EXTENSION;
        }
        if (renameMode == null) {
            renameMode = RenameMode.PREFIX;
        }
        if (delimiter == null) {
            delimiter = DEFAULT_DELIMITER;
        }
        if (nameComparison == null) {
            nameComparison = NameComparison.PLATFORM;
        }
    }

    /**
     * A private helper method we call for each preference that gets changed.
     *
     * @param preference the user preference that has changed
     */
    private void preferenceChanged(UserPreference preference) {
        pcs.firePropertyChange("preference", null, preference);
    }

    private boolean valuesAreDifferent(Object originalValue, Object newValue) {
        return !Objects.equals(originalValue, newValue);
    }

    /**
     * @return the last mapping workbook the user chose, or "" if none
     */
    public String getMappingFile() {
        return mappingFile;
    }

    public void setMappingFile(String mappingFile) {
        String value = (mappingFile == null) ? "" : mappingFile;
        if (valuesAreDifferent(this.mappingFile, value)) {
            this.mappingFile = value;
            preferenceChanged(UserPreference.MAPPING_FILE);
        }
    }

    /**
     * @return the last folder the user renamed in, or "" if none
     */
    public String getTargetFolder() {
        return targetFolder;
    }

    public void setTargetFolder(String targetFolder) {
        String value = (targetFolder == null) ? "" : targetFolder;
        if (valuesAreDifferent(this.targetFolder, value)) {
            this.targetFolder = value;
            preferenceChanged(UserPreference.TARGET_FOLDER);
        }
    }

    public String getExtension() {
        return extension;
    }

    public void setExtension(String extension) {
        if (valuesAreDifferent(this.extension, extension)) {
            this.extension = extension;
            preferenceChanged(UserPreference.EXTENSION);
        }
    }

    public RenameMode getRenameMode() {
        return renameMode;
    }

    public void setRenameMode(RenameMode renameMode) {
        if (renameMode != null && valuesAreDifferent(this.renameMode, renameMode)) {
            this.renameMode = renameMode;
            preferenceChanged(UserPreference.RENAME_MODE);
        }
    }

    /**
     * @return the delimiter placed between prefix and name; may be ""
     */
    public String getDelimiter() {
        return delimiter;
    }

    public void setDelimiter(String delimiter) {
        String value = (delimiter == null) ? "" : delimiter;
        if (valuesAreDifferent(this.delimiter, value)) {
            this.delimiter = value;
            preferenceChanged(UserPreference.DELIMITER);
        }
    }

    public boolean isBackupSelected() {
        return backupSelected;
    }

    public void setBackupSelected(boolean backupSelected) {
        if (valuesAreDifferent(this.backupSelected, backupSelected)) {
            this.backupSelected = backupSelected;
            preferenceChanged(UserPreference.BACKUP);
        }
    }

    public boolean isRecursive() {
        return recursive;
    }

    public void setRecursive(boolean recursive) {
        if (valuesAreDifferent(this.recursive, recursive)) {
            this.recursive = recursive;
            preferenceChanged(UserPreference.RECURSIVE);
        }
    }

    /**
     * @return true if, lacking a chosen mapping file, the newest template in
     *         the target folder should be used
     */
    public boolean isAutoPull() {
        return autoPull;
    }

    public void setAutoPull(boolean autoPull) {
        if (valuesAreDifferent(this.autoPull, autoPull)) {
            this.autoPull = autoPull;
            preferenceChanged(UserPreference.AUTO_PULL);
        }
    }

    public NameComparison getNameComparison() {
        return nameComparison;
    }

    public void setNameComparison(NameComparison nameComparison) {
        if (
            nameComparison != null &&
            valuesAreDifferent(this.nameComparison, nameComparison)
        ) {
            this.nameComparison = nameComparison;
            preferenceChanged(UserPreference.NAME_COMPARISON);
        }
    }

    /**
     * @return the saved mapping file as a Path, or null if none is saved
     */
    public Path getMappingFilePath() {
        return mappingFile.isBlank() ? null : Path.of(mappingFile);
    }

    /**
     * @return a string displaying attributes of this object
     */
    @Override
    public String toString() {
        return (
            "UserPreferences\n [mappingFile=" +
            mappingFile +
            ",\n  targetFolder=" +
            targetFolder +
            ",\n  extension=" +
            extension +
            ",\n  renameMode=" +
            renameMode +
            ",\n  delimiter='" +
            delimiter +
            "',\n  backupSelected=" +
            backupSelected +
            ",\n  recursive=" +
            recursive +
            ",\n  autoPull=" +
            autoPull +
            ",\n  nameComparison=" +
            nameComparison +
            "]"
        );
    }
}
