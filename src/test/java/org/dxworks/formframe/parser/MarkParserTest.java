package org.dxworks.formframe.parser;

import org.dxworks.formframe.model.MarkSet;
import org.dxworks.formframe.model.MarkType;
import org.dxworks.formframe.model.TextSegment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkParserTest {

    private final MarkParser parser = new MarkParser();

    private List<TextSegment> parse(String html) {
        return parser.parseMarks(html, MarkSet.EMPTY);
    }

    @Test
    void innermostColorWins() {
        List<TextSegment> segments = parse("<span style=\"color: red\">a<span style=\"color: blue\">b</span></span>");

        assertEquals(2, segments.size());
        assertEquals("red", segments.get(0).getMarkSet().get(MarkType.TEXT_COLOR).getValue());
        assertEquals("blue", segments.get(1).getMarkSet().get(MarkType.TEXT_COLOR).getValue());
    }

    @Test
    void boldIsNotClearedByAnInnerNormalWeight() {
        List<TextSegment> segments = parse("<b>bold <span style=\"font-weight: normal\">still</span></b>");

        assertEquals(1, segments.size());
        assertEquals("bold still", segments.get(0).getText());
        assertTrue(segments.get(0).hasMark(MarkType.BOLD));
    }

    @Test
    void nestedMarksAccumulate() {
        List<TextSegment> segments = parse("<strong><em><u>all three</u></em></strong>");

        TextSegment segment = segments.get(0);
        assertTrue(segment.hasMark(MarkType.BOLD));
        assertTrue(segment.hasMark(MarkType.ITALIC));
        assertTrue(segment.hasMark(MarkType.UNDERLINE));
    }

    @Test
    void styleDeclarationsBecomeMarks() {
        List<TextSegment> segments = parse("<span style=\"font-size: 18px; font-family: Georgia; "
                + "background-color: yellow; text-decoration: line-through; font-style: italic\">x</span>");

        MarkSet marks = segments.get(0).getMarkSet();
        assertEquals("18px", marks.get(MarkType.FONT_SIZE).getValue());
        assertEquals("Georgia", marks.get(MarkType.FONT_FAMILY).getValue());
        assertEquals("yellow", marks.get(MarkType.BACKGROUND_COLOR).getValue());
        assertTrue(marks.contains(MarkType.STRIKETHROUGH));
        assertTrue(marks.contains(MarkType.ITALIC));
    }

    @Test
    void linksCarryTheirTarget() {
        List<TextSegment> segments = parse("See <a href=\"https://example.com/terms\">the terms</a>.");

        assertEquals(3, segments.size());
        assertEquals("the terms", segments.get(1).getText());
        assertEquals("https://example.com/terms", segments.get(1).getMarkSet().get(MarkType.LINK).getValue());
    }

    @Test
    void lineBreakBecomesNewline() {
        List<TextSegment> segments = parse("Line one<br>Line two");

        assertEquals("Line one\nLine two", TextSegment.plainText(segments));
    }

    @Test
    void whitespaceIsCollapsedAndTrimmed() {
        List<TextSegment> segments = parse("  Hello \n   world  ");

        assertEquals(List.of(TextSegment.plain("Hello world")), segments);
    }

    @Test
    void spaceBetweenElementsIsKept() {
        List<TextSegment> segments = parse("<b>one</b> <i>two</i>");

        assertEquals("one two", TextSegment.plainText(segments));
    }

    @Test
    void placeholdersAreSplitOutWithSurroundingMarks() {
        List<TextSegment> segments = parse("<i>Dear @Name</i>");

        assertEquals(2, segments.size());
        assertEquals("Dear ", segments.get(0).getText());
        assertTrue(segments.get(1).hasMark(MarkType.ITALIC));
        assertEquals("@Name", segments.get(1).getMarkSet().get(MarkType.PLACEHOLDER).getValue());
    }

    @Test
    void placeholderWrapperStylingIsNotAMark() {
        List<TextSegment> segments = parse("<span class=\"placeholder\" data-placeholder=\"@X\" "
                + "style=\"background-color: #b3d4fc; padding: 0 2px;\">@X</span>");

        assertEquals(1, segments.size());
        assertTrue(segments.get(0).hasMark(MarkType.PLACEHOLDER));
        assertFalse(segments.get(0).hasMark(MarkType.BACKGROUND_COLOR));
    }

    @Test
    void scriptsAreSkipped() {
        assertEquals("safe", TextSegment.plainText(parse("safe<script>alert(1)</script>")));
    }

    @Test
    void emptyInputYieldsNoSegments() {
        assertTrue(parse("").isEmpty());
        assertTrue(parser.parseMarks(null, MarkSet.EMPTY).isEmpty());
    }
}
