package org.dxworks.formframe.model.block;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.dxworks.formframe.model.BlockType;

/**
 * One content or form-field unit inside a column. The set of variants is closed: every
 * subclass corresponds to exactly one {@link BlockType} and is registered below under that tag.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = HeadingBlock.class, name = "heading"),
        @JsonSubTypes.Type(value = ParagraphBlock.class, name = "paragraph"),
        @JsonSubTypes.Type(value = DividerBlock.class, name = "divider"),
        @JsonSubTypes.Type(value = ImageBlock.class, name = "image"),
        @JsonSubTypes.Type(value = TextInputBlock.class, name = "text-input"),
        @JsonSubTypes.Type(value = TextareaBlock.class, name = "textarea"),
        @JsonSubTypes.Type(value = DropdownBlock.class, name = "dropdown"),
        @JsonSubTypes.Type(value = RadioGroupBlock.class, name = "radio-group"),
        @JsonSubTypes.Type(value = CheckboxGroupBlock.class, name = "checkbox-group"),
        @JsonSubTypes.Type(value = SingleCheckboxBlock.class, name = "single-checkbox"),
        @JsonSubTypes.Type(value = DatePickerBlock.class, name = "date-picker"),
        @JsonSubTypes.Type(value = FileUploadBlock.class, name = "file-upload"),
        @JsonSubTypes.Type(value = SignatureBlock.class, name = "signature"),
        @JsonSubTypes.Type(value = TableBlock.class, name = "table"),
        @JsonSubTypes.Type(value = ListBlock.class, name = "list"),
        @JsonSubTypes.Type(value = ButtonBlock.class, name = "button"),
        @JsonSubTypes.Type(value = RawHtmlBlock.class, name = "raw-html")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class Block {
    public String id;
    public int width = 100; // percent of the column
    public int marginTop;
    public int marginBottom = 8;
    public int marginLeft;
    public int marginRight;
    public int paddingX;
    public int paddingY;
    public boolean locked;

    @JsonIgnore
    public abstract BlockType getType();
}
