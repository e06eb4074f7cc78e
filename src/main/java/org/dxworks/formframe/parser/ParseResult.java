package org.dxworks.formframe.parser;

import org.dxworks.formframe.model.Section;

import java.util.List;

public class ParseResult {
    private final List<Section> sections;
    private final List<String> warnings;
    private final ParseSource source;
    private final int rawHtmlCount;

    public ParseResult(List<Section> sections, List<String> warnings, ParseSource source, int rawHtmlCount) {
        this.sections = sections;
        this.warnings = List.copyOf(warnings);
        this.source = source;
        this.rawHtmlCount = rawHtmlCount;
    }

    public List<Section> getSections() {
        return sections;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public ParseSource getSource() {
        return source;
    }

    /** True when the input was a document previously exported with round-trip metadata. */
    public boolean isNativeFormat() {
        return source == ParseSource.METADATA;
    }

    public int getRawHtmlCount() {
        return rawHtmlCount;
    }
}
