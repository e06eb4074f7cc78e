package org.dxworks.formframe.model.block;

import com.fasterxml.jackson.annotation.JsonSetter;
import org.dxworks.formframe.model.Placeholders;
import org.dxworks.formframe.model.TextSegment;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared shape of heading and paragraph blocks. {@link #segments} is the source of truth for
 * the text; a plain {@code content} string is still accepted on input for older documents.
 */
public abstract class TextBlock extends Block {
    public List<TextSegment> segments = new ArrayList<>();
    public int fontSize;
    public int fontWeight;
    public String textAlign = "left";
    public double lineHeight;
    public String color = "";

    public String plainText() {
        return TextSegment.plainText(segments);
    }

    @JsonSetter("content")
    public void setLegacyContent(String content) {
        this.segments = Placeholders.segment(content);
    }
}
