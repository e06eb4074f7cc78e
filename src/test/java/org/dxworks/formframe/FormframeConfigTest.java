package org.dxworks.formframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FormframeConfigTest {

    @TempDir
    Path dir;

    @Test
    void missingFileGivesDefaults() {
        FormframeConfig config = FormframeConfig.load(dir.resolve("absent.yml"));

        assertEquals(50, config.getMaxHistoryEntries());
        assertEquals(400, config.getHistoryDebounceMillis());
        assertEquals(200 * 1024, config.getExportSizeWarningBytes());
        assertEquals(400, config.getLayoutTableMinWidthPx());
        assertEquals("Agreement Form", config.getDocumentTitle());
    }

    @Test
    void readsYamlAndFillsGaps() throws IOException {
        Path file = dir.resolve("formframe-config.yml");
        Files.writeString(file, "maxHistoryEntries: 20\nhistoryDebounceMillis: 0\ndocumentTitle: Rental Agreement\n");

        FormframeConfig config = FormframeConfig.load(file);

        assertEquals(20, config.getMaxHistoryEntries());
        assertEquals(0, config.getHistoryDebounceMillis());
        assertEquals("Rental Agreement", config.getDocumentTitle());
        assertEquals(400, config.getLayoutTableMinWidthPx());
    }

    @Test
    void invalidValuesFallBack() throws IOException {
        Path file = dir.resolve("formframe-config.yml");
        Files.writeString(file, "maxHistoryEntries: -3\nexportSizeWarningBytes: 0\ndocumentTitle: \"  \"\n");

        FormframeConfig config = FormframeConfig.load(file);

        assertEquals(50, config.getMaxHistoryEntries());
        assertEquals(200 * 1024, config.getExportSizeWarningBytes());
        assertEquals("Agreement Form", config.getDocumentTitle());
    }

    @Test
    void unreadableFileGivesDefaults() throws IOException {
        Path file = dir.resolve("formframe-config.yml");
        Files.writeString(file, "maxHistoryEntries: [unclosed\n");

        assertEquals(50, FormframeConfig.load(file).getMaxHistoryEntries());
    }
}
