package org.dxworks.formframe.model.block;

import org.dxworks.formframe.model.BlockDefaults;
import org.dxworks.formframe.model.BlockType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableBlockTest {

    private TableBlock defaultTable() {
        return BlockDefaults.create(BlockType.TABLE, TableBlock.class);
    }

    @Test
    void addRowInsertsAnEmptyRowOfFullWidth() {
        TableBlock table = defaultTable();

        table.addRow(1);

        assertEquals(3, table.rowCount());
        assertEquals(List.of("", "", ""), table.rows.get(1));
        assertEquals(List.of("Cell 1", "Cell 2", "Cell 3"), table.rows.get(2));
        assertTrue(table.isRectangular());
    }

    @Test
    void addRowPastTheEndAppends() {
        TableBlock table = defaultTable();

        table.addRow(99);

        assertEquals(List.of("", "", ""), table.rows.get(2));
        assertEquals(List.of(0, 0, 0), table.rowHeights);
    }

    @Test
    void addColumnRedistributesWidths() {
        TableBlock table = defaultTable();

        table.addColumn(0);

        assertEquals(4, table.columnCount());
        assertEquals("", table.rows.get(0).get(0));
        assertEquals("Header 1", table.rows.get(0).get(1));
        assertEquals(List.of(25.0, 25.0, 25.0, 25.0), table.columnWidths);
        assertTrue(table.isRectangular());
    }

    @Test
    void lastRowAndColumnCannotBeRemoved() {
        TableBlock table = new TableBlock();
        table.rows.add(new ArrayList<>(List.of("only")));
        table.normalize();

        assertFalse(table.removeRow(0));
        assertFalse(table.removeColumn(0));
        assertEquals(List.of(List.of("only")), table.rows);
    }

    @Test
    void removeColumnKeepsTheTableRectangular() {
        TableBlock table = defaultTable();

        assertTrue(table.removeColumn(1));

        assertEquals(List.of("Header 1", "Header 3"), table.rows.get(0));
        assertEquals(List.of("Cell 1", "Cell 3"), table.rows.get(1));
        assertEquals(List.of(50.0, 50.0), table.columnWidths);
        assertTrue(table.isRectangular());
    }

    @Test
    void removeRowOutOfRangeIsRefused() {
        TableBlock table = defaultTable();

        assertFalse(table.removeRow(5));
        assertEquals(2, table.rowCount());
    }

    @Test
    void normalizePadsRaggedRows() {
        TableBlock table = new TableBlock();
        table.rows.add(new ArrayList<>(List.of("a", "b", "c")));
        table.rows.add(new ArrayList<>(List.of("d")));
        assertFalse(table.isRectangular());

        table.normalize();

        assertEquals(List.of("d", "", ""), table.rows.get(1));
        assertEquals(List.of(33.33, 33.33, 33.33), table.columnWidths);
        assertEquals(List.of(0, 0), table.rowHeights);
        assertTrue(table.isRectangular());
    }
}
