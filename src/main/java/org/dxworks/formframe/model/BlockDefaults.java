package org.dxworks.formframe.model;

import org.dxworks.formframe.model.block.*;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Builds fully populated blocks. Every field of the returned block carries a usable value, which
 * is what lets the metadata reader fill fields missing from older exports.
 */
public final class BlockDefaults {

    private BlockDefaults() {
        // utility class
    }

    public static Block create(BlockType type) {
        Block block = switch (type) {
            case HEADING -> heading();
            case PARAGRAPH -> paragraph();
            case DIVIDER -> divider();
            case IMAGE -> image();
            case TEXT_INPUT -> textInput();
            case TEXTAREA -> textarea();
            case DROPDOWN -> dropdown();
            case RADIO_GROUP -> radioGroup();
            case CHECKBOX_GROUP -> checkboxGroup();
            case SINGLE_CHECKBOX -> singleCheckbox();
            case DATE_PICKER -> datePicker();
            case FILE_UPLOAD -> fileUpload();
            case SIGNATURE -> signature();
            case TABLE -> table();
            case LIST -> list();
            case BUTTON -> button();
            case RAW_HTML -> new RawHtmlBlock();
        };
        block.id = newId();
        return block;
    }

    public static <T extends Block> T create(BlockType type, Class<T> expected) {
        return expected.cast(create(type));
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    private static String fieldName(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static HeadingBlock heading() {
        HeadingBlock b = new HeadingBlock();
        b.segments = Placeholders.segment("Heading Text");
        b.level = 2;
        b.fontSize = 24;
        b.fontWeight = 600;
        b.lineHeight = 1.3;
        b.marginBottom = 12;
        return b;
    }

    private static ParagraphBlock paragraph() {
        ParagraphBlock b = new ParagraphBlock();
        b.segments = Placeholders.segment("Enter your text here. This paragraph block supports rich content "
                + "for legal agreements, descriptions, and professional documents.");
        b.fontSize = 14;
        b.fontWeight = 400;
        b.lineHeight = 1.6;
        return b;
    }

    private static DividerBlock divider() {
        DividerBlock b = new DividerBlock();
        b.thickness = 1;
        b.style = DividerBlock.LineStyle.SOLID;
        b.color = "#000000";
        b.marginTop = 16;
        b.marginBottom = 16;
        return b;
    }

    private static ImageBlock image() {
        ImageBlock b = new ImageBlock();
        b.alt = "Image";
        b.alignment = "center";
        b.borderRadius = 4;
        b.maxHeight = 300;
        return b;
    }

    private static TextInputBlock textInput() {
        TextInputBlock b = new TextInputBlock();
        b.label = "Text Field";
        b.placeholder = "Enter text...";
        b.fieldName = fieldName("text_field");
        return b;
    }

    private static TextareaBlock textarea() {
        TextareaBlock b = new TextareaBlock();
        b.label = "Text Area";
        b.placeholder = "Enter detailed text...";
        b.fieldName = fieldName("textarea");
        b.rows = 4;
        return b;
    }

    private static DropdownBlock dropdown() {
        DropdownBlock b = new DropdownBlock();
        b.label = "Dropdown";
        b.fieldName = fieldName("dropdown");
        b.options = new ArrayList<>(List.of("Option 1", "Option 2", "Option 3"));
        return b;
    }

    private static RadioGroupBlock radioGroup() {
        RadioGroupBlock b = new RadioGroupBlock();
        b.label = "Radio Group";
        b.fieldName = fieldName("radio");
        b.options = new ArrayList<>(List.of("Option A", "Option B", "Option C"));
        return b;
    }

    private static CheckboxGroupBlock checkboxGroup() {
        CheckboxGroupBlock b = new CheckboxGroupBlock();
        b.label = "Checkbox Group";
        b.fieldName = fieldName("checkbox_group");
        b.options = new ArrayList<>(List.of("Choice 1", "Choice 2", "Choice 3"));
        return b;
    }

    private static SingleCheckboxBlock singleCheckbox() {
        SingleCheckboxBlock b = new SingleCheckboxBlock();
        b.label = "I agree to the terms and conditions outlined in this agreement.";
        b.fieldName = fieldName("agreement");
        return b;
    }

    private static DatePickerBlock datePicker() {
        DatePickerBlock b = new DatePickerBlock();
        b.label = "Date";
        b.fieldName = fieldName("date");
        b.width = 50;
        return b;
    }

    private static FileUploadBlock fileUpload() {
        FileUploadBlock b = new FileUploadBlock();
        b.label = "File Upload";
        b.fieldName = fieldName("file");
        b.acceptTypes = ".pdf,.doc,.docx,.jpg,.png";
        b.maxSize = "10MB";
        return b;
    }

    private static SignatureBlock signature() {
        SignatureBlock b = new SignatureBlock();
        b.label = "Signature";
        b.fieldName = fieldName("signature");
        b.helpText = "Click to insert signature";
        return b;
    }

    private static TableBlock table() {
        TableBlock b = new TableBlock();
        b.rows = new ArrayList<>();
        b.rows.add(new ArrayList<>(List.of("Header 1", "Header 2", "Header 3")));
        b.rows.add(new ArrayList<>(List.of("Cell 1", "Cell 2", "Cell 3")));
        b.headerRow = true;
        b.normalize();
        return b;
    }

    private static ListBlock list() {
        ListBlock b = new ListBlock();
        b.listType = ListBlock.ListType.UNORDERED;
        b.items = new ArrayList<>(List.of("Item 1", "Item 2", "Item 3"));
        return b;
    }

    private static ButtonBlock button() {
        ButtonBlock b = new ButtonBlock();
        b.label = "Submit";
        b.buttonType = ButtonBlock.ButtonType.SUBMIT;
        b.variant = ButtonBlock.Variant.PRIMARY;
        return b;
    }
}
