package org.dxworks.formframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of inline marks. Declaration order is the canonical mark order: the serializer wraps
 * text in this order, so {@link #FONT_SIZE} ends up innermost and {@link #PLACEHOLDER} outermost.
 */
public enum MarkType {
    FONT_SIZE("fontSize", true),
    FONT_FAMILY("fontFamily", true),
    TEXT_COLOR("textColor", true),
    BACKGROUND_COLOR("backgroundColor", true),
    BOLD("bold", false),
    ITALIC("italic", false),
    UNDERLINE("underline", false),
    STRIKETHROUGH("strikethrough", false),
    LINK("link", true),
    PLACEHOLDER("placeholder", true);

    private final String tag;
    private final boolean valued;

    MarkType(String tag, boolean valued) {
        this.tag = tag;
        this.valued = valued;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /** Valued kinds are exclusive: a segment carries at most one value for them. */
    public boolean isValued() {
        return valued;
    }

    @JsonCreator
    public static MarkType fromTag(String tag) {
        for (MarkType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown mark type: " + tag);
    }
}
