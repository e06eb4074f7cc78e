package org.dxworks.formframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A run of text sharing one set of marks. Marks are kept in canonical order with at most one
 * mark per kind.
 */
public final class TextSegment {
    private final String text;
    private final MarkSet markSet;

    public TextSegment(String text, MarkSet marks) {
        this.text = text == null ? "" : text;
        this.markSet = marks == null ? MarkSet.EMPTY : marks;
    }

    @JsonCreator
    public TextSegment(@JsonProperty("text") String text, @JsonProperty("marks") List<Mark> marks) {
        this(text, MarkSet.of(marks));
    }

    public static TextSegment plain(String text) {
        return new TextSegment(text, MarkSet.EMPTY);
    }

    public String getText() {
        return text;
    }

    public List<Mark> getMarks() {
        return markSet.asList();
    }

    @JsonIgnore
    public MarkSet getMarkSet() {
        return markSet;
    }

    public boolean hasMark(MarkType type) {
        return markSet.contains(type);
    }

    public TextSegment withText(String newText) {
        return new TextSegment(newText, markSet);
    }

    public static String plainText(List<TextSegment> segments) {
        if (segments == null) return "";
        StringBuilder sb = new StringBuilder();
        for (TextSegment segment : segments) {
            sb.append(segment.text);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextSegment)) return false;
        TextSegment other = (TextSegment) o;
        return text.equals(other.text) && markSet.equals(other.markSet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, markSet);
    }

    @Override
    public String toString() {
        return markSet.isEmpty() ? "\"" + text + "\"" : "\"" + text + "\"" + markSet;
    }
}
