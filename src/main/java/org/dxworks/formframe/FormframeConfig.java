package org.dxworks.formframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class FormframeConfig {
    private static final Logger LOG = LoggerFactory.getLogger(FormframeConfig.class);

    private static final String CONFIG_FILE_NAME = "formframe-config.yml";
    private static final int DEFAULT_MAX_HISTORY_ENTRIES = 50;
    private static final long DEFAULT_HISTORY_DEBOUNCE_MILLIS = 400;
    private static final int DEFAULT_EXPORT_SIZE_WARNING_BYTES = 200 * 1024;
    private static final int DEFAULT_LAYOUT_TABLE_MIN_WIDTH_PX = 400;
    private static final String DEFAULT_DOCUMENT_TITLE = "Agreement Form";

    private final int maxHistoryEntries;
    private final long historyDebounceMillis;
    private final int exportSizeWarningBytes;
    private final int layoutTableMinWidthPx;
    private final String documentTitle;

    private FormframeConfig(int maxHistoryEntries, long historyDebounceMillis, int exportSizeWarningBytes,
                            int layoutTableMinWidthPx, String documentTitle) {
        this.maxHistoryEntries = maxHistoryEntries;
        this.historyDebounceMillis = historyDebounceMillis;
        this.exportSizeWarningBytes = exportSizeWarningBytes;
        this.layoutTableMinWidthPx = layoutTableMinWidthPx;
        this.documentTitle = documentTitle;
    }

    public int getMaxHistoryEntries() {
        return maxHistoryEntries;
    }

    public long getHistoryDebounceMillis() {
        return historyDebounceMillis;
    }

    public int getExportSizeWarningBytes() {
        return exportSizeWarningBytes;
    }

    public int getLayoutTableMinWidthPx() {
        return layoutTableMinWidthPx;
    }

    public String getDocumentTitle() {
        return documentTitle;
    }

    public static FormframeConfig defaults() {
        return new FormframeConfig(DEFAULT_MAX_HISTORY_ENTRIES, DEFAULT_HISTORY_DEBOUNCE_MILLIS,
                DEFAULT_EXPORT_SIZE_WARNING_BYTES, DEFAULT_LAYOUT_TABLE_MIN_WIDTH_PX, DEFAULT_DOCUMENT_TITLE);
    }

    public static FormframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static FormframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return with(
                        orDefault(yamlConfig.maxHistoryEntries, DEFAULT_MAX_HISTORY_ENTRIES),
                        yamlConfig.historyDebounceMillis != null ? yamlConfig.historyDebounceMillis : -1,
                        orDefault(yamlConfig.exportSizeWarningBytes, DEFAULT_EXPORT_SIZE_WARNING_BYTES),
                        orDefault(yamlConfig.layoutTableMinWidthPx, DEFAULT_LAYOUT_TABLE_MIN_WIDTH_PX),
                        yamlConfig.documentTitle);
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    /** Non-positive numbers and blank titles fall back to the defaults. */
    public static FormframeConfig with(int maxHistoryEntries, long historyDebounceMillis, int exportSizeWarningBytes,
                                       int layoutTableMinWidthPx, String documentTitle) {
        return new FormframeConfig(
                maxHistoryEntries > 0 ? maxHistoryEntries : DEFAULT_MAX_HISTORY_ENTRIES,
                historyDebounceMillis >= 0 ? historyDebounceMillis : DEFAULT_HISTORY_DEBOUNCE_MILLIS,
                exportSizeWarningBytes > 0 ? exportSizeWarningBytes : DEFAULT_EXPORT_SIZE_WARNING_BYTES,
                layoutTableMinWidthPx > 0 ? layoutTableMinWidthPx : DEFAULT_LAYOUT_TABLE_MIN_WIDTH_PX,
                documentTitle != null && !documentTitle.isBlank() ? documentTitle : DEFAULT_DOCUMENT_TITLE);
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static class YamlConfig {
        public Integer maxHistoryEntries;
        public Long historyDebounceMillis;
        public Integer exportSizeWarningBytes;
        public Integer layoutTableMinWidthPx;
        public String documentTitle;
    }
}
