package org.dxworks.formframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the document model and the shape of the round-trip metadata blob.
 */
public class FormDocument {
    public static final String CURRENT_VERSION = "1";

    public String version = CURRENT_VERSION;
    public List<Section> sections = new ArrayList<>();

    public FormDocument() {
    }

    public FormDocument(List<Section> sections) {
        this.sections = sections;
    }
}
