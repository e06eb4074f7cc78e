package org.dxworks.formframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum BlockType {
    HEADING("heading"),
    PARAGRAPH("paragraph"),
    DIVIDER("divider"),
    IMAGE("image"),
    TEXT_INPUT("text-input"),
    TEXTAREA("textarea"),
    DROPDOWN("dropdown"),
    RADIO_GROUP("radio-group"),
    CHECKBOX_GROUP("checkbox-group"),
    SINGLE_CHECKBOX("single-checkbox"),
    DATE_PICKER("date-picker"),
    FILE_UPLOAD("file-upload"),
    SIGNATURE("signature"),
    TABLE("table"),
    LIST("list"),
    BUTTON("button"),
    RAW_HTML("raw-html");

    private final String tag;

    BlockType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    public static Optional<BlockType> find(String tag) {
        if (tag == null) return Optional.empty();
        for (BlockType type : values()) {
            if (type.tag.equals(tag)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static BlockType fromTag(String tag) {
        return find(tag).orElseThrow(() -> new IllegalArgumentException("Unknown block type: " + tag));
    }
}
