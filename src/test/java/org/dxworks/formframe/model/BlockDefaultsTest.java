package org.dxworks.formframe.model;

import org.dxworks.formframe.model.block.*;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BlockDefaultsTest {

    @Test
    void createsABlockOfEveryType() {
        Set<String> ids = new HashSet<>();
        for (BlockType type : BlockType.values()) {
            Block block = BlockDefaults.create(type);

            assertEquals(type, block.getType());
            assertNotNull(block.id);
            assertTrue(ids.add(block.id), "ids are unique");
        }
    }

    @Test
    void headingDefaults() {
        HeadingBlock heading = BlockDefaults.create(BlockType.HEADING, HeadingBlock.class);

        assertEquals("Heading Text", heading.plainText());
        assertEquals(2, heading.level);
        assertEquals(24, heading.fontSize);
        assertEquals(600, heading.fontWeight);
        assertEquals(1.3, heading.lineHeight);
        assertEquals(12, heading.marginBottom);
        assertEquals(100, heading.width);
    }

    @Test
    void tableDefaultsAreRectangular() {
        TableBlock table = BlockDefaults.create(BlockType.TABLE, TableBlock.class);

        assertEquals(List.of("Header 1", "Header 2", "Header 3"), table.rows.get(0));
        assertTrue(table.headerRow);
        assertTrue(table.isRectangular());
        assertEquals(List.of(0, 0), table.rowHeights);
    }

    @Test
    void fieldNamesAreDistinct() {
        TextInputBlock first = BlockDefaults.create(BlockType.TEXT_INPUT, TextInputBlock.class);
        TextInputBlock second = BlockDefaults.create(BlockType.TEXT_INPUT, TextInputBlock.class);

        assertTrue(first.fieldName.startsWith("text_field_"));
        assertNotEquals(first.fieldName, second.fieldName);
    }

    @Test
    void datePickerIsHalfWidth() {
        assertEquals(50, BlockDefaults.create(BlockType.DATE_PICKER).width);
    }

    @Test
    void createsFreshInstances() {
        ListBlock first = BlockDefaults.create(BlockType.LIST, ListBlock.class);
        ListBlock second = BlockDefaults.create(BlockType.LIST, ListBlock.class);

        first.items.add("Item 4");

        assertEquals(3, second.items.size());
    }
}
