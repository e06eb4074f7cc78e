package org.dxworks.formframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Mark {
    private final MarkType type;
    private final String value;

    @JsonCreator
    public Mark(@JsonProperty("type") MarkType type, @JsonProperty("value") String value) {
        this.type = Objects.requireNonNull(type, "type");
        if (type.isValued() && (value == null || value.isEmpty())) {
            throw new IllegalArgumentException("Mark " + type.getTag() + " requires a value");
        }
        this.value = type.isValued() ? value : null;
    }

    public static Mark bold() {
        return new Mark(MarkType.BOLD, null);
    }

    public static Mark italic() {
        return new Mark(MarkType.ITALIC, null);
    }

    public static Mark underline() {
        return new Mark(MarkType.UNDERLINE, null);
    }

    public static Mark strikethrough() {
        return new Mark(MarkType.STRIKETHROUGH, null);
    }

    public static Mark link(String url) {
        return new Mark(MarkType.LINK, url);
    }

    public static Mark textColor(String color) {
        return new Mark(MarkType.TEXT_COLOR, color);
    }

    public static Mark backgroundColor(String color) {
        return new Mark(MarkType.BACKGROUND_COLOR, color);
    }

    public static Mark fontSize(String size) {
        return new Mark(MarkType.FONT_SIZE, size);
    }

    public static Mark fontFamily(String family) {
        return new Mark(MarkType.FONT_FAMILY, family);
    }

    public static Mark placeholder(String token) {
        return new Mark(MarkType.PLACEHOLDER, token);
    }

    public MarkType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Mark)) return false;
        Mark other = (Mark) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return value == null ? type.getTag() : type.getTag() + "(" + value + ")";
    }
}
