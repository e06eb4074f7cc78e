package org.dxworks.formframe.parser;

import org.dxworks.formframe.FormframeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one parse run: collected warnings and the raw-html fallback count.
 */
class ParseContext {
    private static final Logger LOG = LoggerFactory.getLogger(ParseContext.class);

    private final FormframeConfig config;
    private final List<String> warnings = new ArrayList<>();
    private int rawHtmlCount;
    private boolean editorMarkupSeen;

    ParseContext(FormframeConfig config) {
        this.config = config;
    }

    FormframeConfig config() {
        return config;
    }

    void warn(String message) {
        LOG.warn(message);
        warnings.add(message);
    }

    List<String> warnings() {
        return warnings;
    }

    void rawHtmlPreserved(String tag) {
        rawHtmlPreserved(tag, "Unrecognized");
    }

    void rawHtmlPreserved(String tag, String reason) {
        rawHtmlCount++;
        warn(reason + " <" + tag + "> preserved as raw HTML");
    }

    int rawHtmlCount() {
        return rawHtmlCount;
    }

    void markEditorMarkupSeen() {
        editorMarkupSeen = true;
    }

    boolean editorMarkupSeen() {
        return editorMarkupSeen;
    }
}
