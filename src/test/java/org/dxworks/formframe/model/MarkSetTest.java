package org.dxworks.formframe.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MarkSetTest {

    @Test
    void addingAMarkOfTheSameKindReplacesIt() {
        MarkSet marks = MarkSet.of(Mark.textColor("red")).with(Mark.textColor("blue"));

        assertEquals(1, marks.asList().size());
        assertEquals("blue", marks.get(MarkType.TEXT_COLOR).getValue());
    }

    @Test
    void withAllLetsTheArgumentWin() {
        MarkSet outer = MarkSet.of(Mark.bold(), Mark.fontSize("12px"));
        MarkSet inner = MarkSet.of(Mark.fontSize("18px"));

        MarkSet merged = outer.withAll(inner);

        assertTrue(merged.contains(MarkType.BOLD));
        assertEquals("18px", merged.get(MarkType.FONT_SIZE).getValue());
    }

    @Test
    void isImmutable() {
        MarkSet base = MarkSet.of(Mark.bold());

        MarkSet added = base.with(Mark.italic());
        MarkSet removed = base.without(MarkType.BOLD);

        assertEquals(MarkSet.of(Mark.bold()), base);
        assertTrue(added.contains(MarkType.ITALIC));
        assertTrue(removed.isEmpty());
    }

    @Test
    void equalityIgnoresInsertionOrder() {
        assertEquals(MarkSet.of(Mark.bold(), Mark.italic()), MarkSet.of(Mark.italic(), Mark.bold()));
        assertEquals(MarkSet.of(Mark.bold(), Mark.italic()).hashCode(), MarkSet.of(Mark.italic(), Mark.bold()).hashCode());
    }
}
