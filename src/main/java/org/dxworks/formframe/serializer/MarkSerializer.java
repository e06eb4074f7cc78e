package org.dxworks.formframe.serializer;

import org.dxworks.formframe.model.Mark;
import org.dxworks.formframe.model.Placeholders;
import org.dxworks.formframe.model.TextSegment;

import java.util.List;

/**
 * Turns text segments back into inline HTML. Marks are applied in canonical {@code MarkType}
 * order, each one wrapping the previous result, so font size ends up innermost and the
 * placeholder span outermost whatever nesting the text was imported from.
 */
public final class MarkSerializer {

    public static final String PLACEHOLDER_CLASS = "placeholder";
    public static final String PLACEHOLDER_ATTR = "data-placeholder";
    static final String PLACEHOLDER_STYLE = "background-color: #b3d4fc; padding: 0 2px;";

    private MarkSerializer() {
        // utility class
    }

    public static String serialize(List<TextSegment> segments) {
        if (segments == null) return "";
        StringBuilder sb = new StringBuilder();
        for (TextSegment segment : segments) {
            sb.append(serialize(segment));
        }
        return sb.toString();
    }

    public static String serialize(TextSegment segment) {
        String html = HtmlEscaper.escapeMultiline(segment.getText());
        for (Mark mark : segment.getMarks()) {
            html = wrap(mark, html);
        }
        return html;
    }

    /** Plain text with placeholder tokens wrapped, used for labels, list items and cells. */
    public static String serializePlain(String text) {
        return serialize(Placeholders.segment(text));
    }

    private static String wrap(Mark mark, String inner) {
        String value = HtmlEscaper.escape(mark.getValue());
        return switch (mark.getType()) {
            case FONT_SIZE -> "<span style=\"font-size: " + value + ";\">" + inner + "</span>";
            case FONT_FAMILY -> "<span style=\"font-family: " + value + ";\">" + inner + "</span>";
            case TEXT_COLOR -> "<span style=\"color: " + value + ";\">" + inner + "</span>";
            case BACKGROUND_COLOR -> "<span style=\"background-color: " + value + ";\">" + inner + "</span>";
            case BOLD -> "<strong>" + inner + "</strong>";
            case ITALIC -> "<em>" + inner + "</em>";
            case UNDERLINE -> "<u>" + inner + "</u>";
            case STRIKETHROUGH -> "<s>" + inner + "</s>";
            case LINK -> "<a href=\"" + value + "\">" + inner + "</a>";
            case PLACEHOLDER -> "<span class=\"" + PLACEHOLDER_CLASS + "\" " + PLACEHOLDER_ATTR + "=\"" + value
                    + "\" style=\"" + PLACEHOLDER_STYLE + "\">" + inner + "</span>";
        };
    }
}
