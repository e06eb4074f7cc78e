package org.dxworks.formframe.model;

import org.dxworks.formframe.model.block.Block;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A horizontal layout region split into one to three columns.
 * Invariant: {@code columns.size() == columnCount}.
 */
public class Section {
    public static final int MIN_COLUMNS = 1;
    public static final int MAX_COLUMNS = 3;

    public String id;
    public int columnCount = 1;
    public List<Column> columns = new ArrayList<>();

    public static Section create(int columnCount) {
        if (columnCount < MIN_COLUMNS || columnCount > MAX_COLUMNS) {
            throw new IllegalArgumentException("Section column count must be 1-3, got " + columnCount);
        }
        Section section = new Section();
        section.id = UUID.randomUUID().toString();
        section.columnCount = columnCount;
        for (int i = 0; i < columnCount; i++) {
            section.columns.add(new Column());
        }
        return section;
    }

    public Column column(int index) {
        return columns.get(index);
    }

    /** All blocks in column order. */
    public List<Block> allBlocks() {
        List<Block> result = new ArrayList<>();
        for (Column column : columns) {
            result.addAll(column.blocks);
        }
        return result;
    }
}
