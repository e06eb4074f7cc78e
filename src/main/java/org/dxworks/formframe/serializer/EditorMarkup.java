package org.dxworks.formframe.serializer;

/**
 * Attributes written on exported sections, columns and blocks. The parser uses them to restore
 * structure when the metadata comment is missing.
 */
public final class EditorMarkup {

    public static final String VERSION = "data-editor-version";
    public static final String SECTION = "data-editor-section";
    public static final String SECTION_ID = "data-section-id";
    public static final String LAYOUT = "data-editor-layout";
    public static final String COLUMN = "data-editor-column";
    public static final String BLOCK_ID = "data-block-id";
    public static final String BLOCK_TYPE = "data-block-type";
    public static final String WIDTH = "data-width";
    public static final String LOCKED = "data-locked";
    public static final String CHOICE_LAYOUT = "data-layout";
    public static final String FIELD_NAME = "data-field-name";
    public static final String REQUIRED = "data-required";
    public static final String MAX_SIZE = "data-max-size";
    public static final String SIGNATURE_BUTTON = "data-signature-button";

    public static final String REQUIRED_MARK_CLASS = "required-mark";
    public static final String HELP_TEXT_CLASS = "help-text";
    public static final String SIGNATURE_AREA_CLASS = "signature-area";
    public static final String SIGNATURE_LABEL_CLASS = "signature-label";
    public static final String SIGNATURE_IMAGE_CLASS = "signature-image";

    private EditorMarkup() {
        // constants
    }
}
