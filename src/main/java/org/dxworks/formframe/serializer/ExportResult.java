package org.dxworks.formframe.serializer;

import java.util.List;

public class ExportResult {
    private final String html;
    private final List<String> warnings;

    public ExportResult(String html, List<String> warnings) {
        this.html = html;
        this.warnings = List.copyOf(warnings);
    }

    public String getHtml() {
        return html;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
