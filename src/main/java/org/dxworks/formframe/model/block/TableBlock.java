package org.dxworks.formframe.model.block;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.dxworks.formframe.model.BlockType;

import java.util.ArrayList;
import java.util.List;

/**
 * A data table. Rows are kept rectangular: every editing operation leaves all rows with the
 * same number of cells, one {@link #columnWidths} entry per column and one {@link #rowHeights}
 * entry per row.
 */
public class TableBlock extends Block {
    public List<List<String>> rows = new ArrayList<>();
    public boolean headerRow;
    public List<Double> columnWidths = new ArrayList<>(); // percent
    public List<Integer> rowHeights = new ArrayList<>(); // px, 0 = auto

    @Override
    public BlockType getType() {
        return BlockType.TABLE;
    }

    public int columnCount() {
        int max = 0;
        for (List<String> row : rows) {
            max = Math.max(max, row.size());
        }
        return max;
    }

    public int rowCount() {
        return rows.size();
    }

    @JsonIgnore
    public boolean isRectangular() {
        int columns = columnCount();
        for (List<String> row : rows) {
            if (row.size() != columns) {
                return false;
            }
        }
        return columnWidths.size() == columns && rowHeights.size() == rows.size();
    }

    /**
     * Pads short rows with empty cells and realigns widths and heights. Column widths are reset
     * to an even split when their count no longer matches the columns.
     */
    public void normalize() {
        int columns = columnCount();
        List<List<String>> padded = new ArrayList<>();
        for (List<String> row : rows) {
            List<String> copy = new ArrayList<>(row);
            while (copy.size() < columns) {
                copy.add("");
            }
            padded.add(copy);
        }
        rows = padded;
        if (columnWidths.size() != columns) {
            columnWidths = evenWidths(columns);
        }
        List<Integer> heights = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            Integer h = i < rowHeights.size() ? rowHeights.get(i) : null;
            heights.add(h != null && h > 0 ? h : 0);
        }
        rowHeights = heights;
    }

    public void addRow(int index) {
        normalize();
        int columns = Math.max(1, columnCount());
        List<String> row = new ArrayList<>();
        for (int i = 0; i < columns; i++) {
            row.add("");
        }
        int at = clamp(index, rows.size());
        rows.add(at, row);
        rowHeights.add(at, 0);
        if (columnWidths.size() != columns) {
            columnWidths = evenWidths(columns);
        }
    }

    /** Removes a row unless it is the last one left. Returns whether a row was removed. */
    public boolean removeRow(int index) {
        if (index < 0 || index >= rows.size() || rows.size() <= 1) {
            return false;
        }
        normalize();
        rows.remove(index);
        rowHeights.remove(index);
        return true;
    }

    public void addColumn(int index) {
        normalize();
        if (rows.isEmpty()) {
            rows.add(new ArrayList<>());
            rowHeights.add(0);
        }
        int at = clamp(index, columnCount());
        for (List<String> row : rows) {
            row.add(at, "");
        }
        columnWidths = evenWidths(columnCount());
    }

    /** Removes a column unless it is the last one left. Returns whether a column was removed. */
    public boolean removeColumn(int index) {
        normalize();
        int columns = columnCount();
        if (index < 0 || index >= columns || columns <= 1) {
            return false;
        }
        for (List<String> row : rows) {
            row.remove(index);
        }
        columnWidths = evenWidths(columns - 1);
        return true;
    }

    public static List<Double> evenWidths(int columns) {
        List<Double> widths = new ArrayList<>();
        if (columns <= 0) {
            return widths;
        }
        double width = Math.round(10000.0 / columns) / 100.0;
        for (int i = 0; i < columns; i++) {
            widths.add(width);
        }
        return widths;
    }

    private static int clamp(int index, int size) {
        if (index < 0 || index > size) {
            return size;
        }
        return index;
    }
}
