package org.dxworks.formframe.parser;

import org.dxworks.formframe.model.BlockDefaults;
import org.dxworks.formframe.model.BlockType;
import org.dxworks.formframe.model.block.TableBlock;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a table block from a data table. Spanned cells are expanded so the grid stays
 * rectangular: the text lives in the top-left position of a span and the covered positions are
 * empty.
 */
public class TableExtractor {
    private static final int MAX_SPAN = 50;
    private static final int MAX_DEPTH = 256;
    private static final Set<String> LINE_ELEMENTS = Set.of("p", "div", "h1", "h2", "h3", "h4", "h5", "h6", "tr");

    public TableBlock extract(Element table) {
        TableBlock block = BlockDefaults.create(BlockType.TABLE, TableBlock.class);
        List<Element> rowElements = TableClassifier.rowsOf(table);

        Map<Integer, Map<Integer, String>> grid = new HashMap<>();
        Map<Integer, Integer> firstRowWidthsByColumn = new HashMap<>();
        int columns = 0;
        for (int r = 0; r < rowElements.size(); r++) {
            Map<Integer, String> row = grid.computeIfAbsent(r, k -> new HashMap<>());
            int c = 0;
            for (Element cell : TableClassifier.cellsOf(rowElements.get(r))) {
                while (row.containsKey(c)) {
                    c++;
                }
                int colspan = span(cell.attr("colspan"));
                int rowspan = span(cell.attr("rowspan"));
                for (int dr = 0; dr < rowspan && r + dr < rowElements.size(); dr++) {
                    Map<Integer, String> target = grid.computeIfAbsent(r + dr, k -> new HashMap<>());
                    for (int dc = 0; dc < colspan; dc++) {
                        target.put(c + dc, "");
                    }
                }
                row.put(c, cellText(cell));
                if (r == 0 && colspan == 1) {
                    Integer width = percentWidth(cell);
                    if (width != null) {
                        firstRowWidthsByColumn.put(c, width);
                    }
                }
                c += colspan;
            }
            columns = Math.max(columns, c);
        }

        block.rows = new ArrayList<>();
        for (int r = 0; r < rowElements.size(); r++) {
            Map<Integer, String> row = grid.getOrDefault(r, Map.of());
            List<String> cells = new ArrayList<>();
            for (int c = 0; c < columns; c++) {
                cells.add(row.getOrDefault(c, ""));
            }
            block.rows.add(cells);
        }
        block.headerRow = hasHeader(table, rowElements);
        block.columnWidths = columnWidths(table, firstRowWidthsByColumn, columns);
        block.rowHeights = new ArrayList<>();
        for (Element row : rowElements) {
            Integer height = InlineStyle.of(row).px("height");
            if (height == null) {
                height = InlineStyle.toPx(row.attr("height"));
            }
            block.rowHeights.add(height != null && height > 0 ? height : 0);
        }
        block.normalize();
        GeometryReader.apply(table, block);
        return block;
    }

    private static boolean hasHeader(Element table, List<Element> rows) {
        for (Element child : table.children()) {
            if (child.normalName().equals("thead")) {
                return true;
            }
        }
        for (Element row : rows) {
            for (Element cell : TableClassifier.cellsOf(row)) {
                if (cell.normalName().equals("th")) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<Double> columnWidths(Element table, Map<Integer, Integer> firstRow, int columns) {
        List<Double> fromColgroup = new ArrayList<>();
        List<Element> cols = new ArrayList<>();
        for (Element child : table.children()) {
            if (child.normalName().equals("col")) {
                cols.add(child);
            } else if (child.normalName().equals("colgroup")) {
                cols.addAll(child.getElementsByTag("col"));
            }
        }
        for (Element col : cols) {
            Double width = InlineStyle.of(col).percent("width");
            if (width == null) {
                width = InlineStyle.toPercent(col.attr("width"));
            }
            int span = span(col.attr("span"));
            for (int i = 0; i < span; i++) {
                fromColgroup.add(width);
            }
        }
        if (fromColgroup.size() == columns && fromColgroup.stream().allMatch(w -> w != null)) {
            return fromColgroup;
        }
        if (firstRow.size() == columns && columns > 0) {
            List<Double> widths = new ArrayList<>();
            for (int c = 0; c < columns; c++) {
                widths.add((double) firstRow.get(c));
            }
            return widths;
        }
        return TableBlock.evenWidths(columns);
    }

    private static Integer percentWidth(Element cell) {
        Double width = InlineStyle.of(cell).percent("width");
        if (width == null) {
            width = InlineStyle.toPercent(cell.attr("width"));
        }
        return width == null ? null : (int) Math.round(width);
    }

    private static int span(String value) {
        try {
            int span = Integer.parseInt(value.trim());
            return Math.max(1, Math.min(MAX_SPAN, span));
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    /**
     * Visible text of a cell: {@code <br>} and block elements start new lines, list items are
     * prefixed with a bullet, whitespace inside a line is collapsed.
     */
    static String cellText(Element cell) {
        StringBuilder sb = new StringBuilder();
        appendText(cell, sb, 0);
        List<String> lines = new ArrayList<>();
        for (String line : sb.toString().split("\n", -1)) {
            String collapsed = line.replaceAll("[ \\t\\r\\f]+", " ").trim();
            if (!collapsed.isEmpty()) {
                lines.add(collapsed);
            }
        }
        return String.join("\n", lines);
    }

    private static void appendText(Node node, StringBuilder sb, int depth) {
        if (depth >= MAX_DEPTH && node instanceof Element deep) {
            sb.append(deep.wholeText().replace('\n', ' '));
            return;
        }
        for (Node child : node.childNodes()) {
            if (child instanceof TextNode text) {
                sb.append(text.getWholeText().replace('\n', ' '));
            } else if (child instanceof Element element) {
                String name = element.normalName();
                if (name.equals("br")) {
                    sb.append('\n');
                } else if (name.equals("li")) {
                    sb.append("\n• ");
                    appendText(element, sb, depth + 1);
                    sb.append('\n');
                } else if (LINE_ELEMENTS.contains(name)) {
                    sb.append('\n');
                    appendText(element, sb, depth + 1);
                    sb.append('\n');
                } else if (!name.equals("script") && !name.equals("style")) {
                    appendText(element, sb, depth + 1);
                }
            }
        }
    }
}
