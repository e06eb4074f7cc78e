package org.dxworks.formframe.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlaceholdersTest {

    @Test
    void segmentsTextAroundTokens() {
        List<TextSegment> segments = Placeholders.segment("Dear @FirstName, see PH@Date.");

        assertEquals(5, segments.size());
        assertEquals(TextSegment.plain("Dear "), segments.get(0));
        assertEquals("@FirstName", segments.get(1).getText());
        assertEquals("@FirstName", segments.get(1).getMarkSet().get(MarkType.PLACEHOLDER).getValue());
        assertEquals(TextSegment.plain(", see "), segments.get(2));
        assertEquals("PH@Date", segments.get(3).getText());
        assertTrue(segments.get(3).hasMark(MarkType.PLACEHOLDER));
        assertEquals(TextSegment.plain("."), segments.get(4));
    }

    @Test
    void tokensKeepTheSurroundingMarks() {
        List<TextSegment> segments = Placeholders.segment("Hi @Name", MarkSet.of(Mark.bold()));

        assertTrue(segments.get(0).hasMark(MarkType.BOLD));
        assertTrue(segments.get(1).hasMark(MarkType.BOLD));
        assertTrue(segments.get(1).hasMark(MarkType.PLACEHOLDER));
    }

    @Test
    void extractsDistinctTokensInOrder() {
        assertEquals(List.of("@B", "@A"), Placeholders.extract("@B and @A and @B again"));
        assertTrue(Placeholders.extract("no tokens here").isEmpty());
    }

    @Test
    void replaceLeavesUnknownTokens() {
        assertEquals("Hello Ada, @Unknown", Placeholders.replace("Hello @Name, @Unknown", Map.of("@Name", "Ada")));
    }

    @Test
    void recognisesWholeTokens() {
        assertTrue(Placeholders.isToken("@Name"));
        assertTrue(Placeholders.isToken("PH@Name"));
        assertFalse(Placeholders.isToken("Hello @Name"));
        assertFalse(Placeholders.contains("user at example dot com"));
    }
}
