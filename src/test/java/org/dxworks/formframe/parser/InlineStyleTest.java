package org.dxworks.formframe.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InlineStyleTest {

    @Test
    void semicolonInsideUrlDoesNotSplitTheDeclaration() {
        InlineStyle style = InlineStyle.parse("background: url(data:image/png;base64,AAAA); color: red");

        assertEquals("url(data:image/png;base64,AAAA)", style.get("background"));
        assertEquals("red", style.get("color"));
    }

    @Test
    void semicolonInsideQuotesDoesNotSplitTheDeclaration() {
        InlineStyle style = InlineStyle.parse("font-family: 'Odd;Name', serif; font-size: 12px");

        assertEquals("'Odd;Name', serif", style.get("font-family"));
        assertEquals(12, style.px("font-size"));
    }

    @Test
    void namesAreLowerCasedAndImportantIsDropped() {
        InlineStyle style = InlineStyle.parse("COLOR: Blue !important;;  width:50%");

        assertEquals("Blue", style.get("color"));
        assertEquals("50%", style.get("width"));
        assertFalse(style.has("Color"));
    }
}
