package org.sheetrenamer.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.beans.PropertyChangeEvent;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sheetrenamer.controller.UserPreferencesPersistence;

public class UserPreferencesTest {

    private static final Logger PERSISTENCE_LOGGER = Logger.getLogger(
        UserPreferencesPersistence.class.getName()
    );

    @BeforeAll
    public static void quietLogging() {
        // Corrupt files are logged at SEVERE before defaults are used.
        PERSISTENCE_LOGGER.setLevel(Level.OFF);
    }

    @TempDir
    Path tempFolder;

    @Test
    @DisplayName("Defaults match the documented starting values")
    public void testDefaults() {
        UserPreferences prefs = new UserPreferences();

        assertEquals("", prefs.getMappingFile());
        assertNull(prefs.getMappingFilePath());
        assertEquals(".pdf", prefs.getExtension());
        assertEquals(RenameMode.PREFIX, prefs.getRenameMode());
        assertEquals("-", prefs.getDelimiter());
        assertTrue(prefs.isBackupSelected());
        assertFalse(prefs.isRecursive());
        assertTrue(prefs.isAutoPull());
        assertEquals(NameComparison.PLATFORM, prefs.getNameComparison());
    }

    @Test
    @DisplayName("Saved preferences come back unchanged")
    public void testPersistAndRetrieve() {
        UserPreferences prefs = new UserPreferences();
        prefs.setMappingFile(tempFolder.resolve("map.xlsx").toString());
        prefs.setTargetFolder(tempFolder.toString());
        prefs.setExtension(".docx");
        prefs.setRenameMode(RenameMode.REPLACE);
        prefs.setDelimiter("");
        prefs.setBackupSelected(false);
        prefs.setRecursive(true);
        prefs.setAutoPull(false);
        prefs.setNameComparison(NameComparison.CASE_INSENSITIVE);

        Path file = tempFolder.resolve("config").resolve("prefs.xml");
        UserPreferencesPersistence.persist(prefs, file);
        assertTrue(Files.exists(file), "preferences file not written");

        UserPreferences loaded = UserPreferencesPersistence.retrieve(file);

        assertNotNull(loaded);
        assertEquals(tempFolder.resolve("map.xlsx"), loaded.getMappingFilePath());
        assertEquals(tempFolder.toString(), loaded.getTargetFolder());
        assertEquals(".docx", loaded.getExtension());
        assertEquals(RenameMode.REPLACE, loaded.getRenameMode());
        assertEquals("", loaded.getDelimiter(), "empty delimiter must survive a round trip");
        assertFalse(loaded.isBackupSelected());
        assertTrue(loaded.isRecursive());
        assertFalse(loaded.isAutoPull());
        assertEquals(NameComparison.CASE_INSENSITIVE, loaded.getNameComparison());
    }

    @Test
    @DisplayName("Missing file means defaults")
    public void testRetrieveMissing() {
        assertNull(UserPreferencesPersistence.retrieve(tempFolder.resolve("none.xml")));
    }

    @Test
    @DisplayName("Corrupt file means defaults")
    public void testRetrieveCorrupt() throws IOException {
        Path file = Files.writeString(tempFolder.resolve("prefs.xml"), "<preferences><oops");
        assertNull(UserPreferencesPersistence.retrieve(file));
    }

    @Test
    @DisplayName("Unknown and missing elements in a hand-edited file are tolerated")
    public void testRetrievePartial() throws IOException {
        Path file = Files.writeString(
            tempFolder.resolve("prefs.xml"),
            "<preferences>\n" +
                "  <extension>.tif</extension>\n" +
                "  <mode>REPLACE</mode>\n" +
                "  <backup>false</backup>\n" +
                "  <themeMode>DARK</themeMode>\n" +
                "</preferences>\n"
        );

        UserPreferences loaded = UserPreferencesPersistence.retrieve(file);

        assertNotNull(loaded);
        loaded.sanitize();
        assertEquals(".tif", loaded.getExtension());
        assertEquals(RenameMode.REPLACE, loaded.getRenameMode());
        assertFalse(loaded.isBackupSelected());
        assertEquals("-", loaded.getDelimiter());
        assertEquals("", loaded.getMappingFile());
        assertEquals(NameComparison.PLATFORM, loaded.getNameComparison());
    }

    @Test
    @DisplayName("Sanitize repairs values a hand edit can break")
    public void testSanitize() throws IOException {
        Path file = Files.writeString(
            tempFolder.resolve("prefs.xml"),
            "<preferences>\n" +
                "  <extension>pdf</extension>\n" +
                "</preferences>\n"
        );

        UserPreferences loaded = UserPreferencesPersistence.retrieve(file);
        assertNotNull(loaded);
        loaded.sanitize();

        assertEquals(".pdf", loaded.getExtension(), "extension without a dot kept");
    }

    @Test
    @DisplayName("Changing a value notifies listeners once; setting the same value does not")
    public void testChangeEvents() {
        UserPreferences prefs = new UserPreferences();
        List<PropertyChangeEvent> events = new ArrayList<>();
        prefs.addPropertyChangeListener(events::add);

        prefs.setTargetFolder("/scans");
        prefs.setTargetFolder("/scans");
        prefs.setDelimiter("_");
        prefs.setRenameMode(null);

        assertEquals(2, events.size(), "events: " + events);
        assertEquals(UserPreference.TARGET_FOLDER, events.get(0).getNewValue());
        assertEquals(UserPreference.DELIMITER, events.get(1).getNewValue());
        assertEquals(RenameMode.PREFIX, prefs.getRenameMode(), "null mode accepted");
    }
}
