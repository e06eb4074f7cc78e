package org.dxworks.formframe.parser;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tells layout tables (structure to unwrap) from data tables (content to keep as a table block).
 *
 * <h3>Decision order, first match wins:</h3>
 * <ol>
 *   <li><b>layout</b>: {@code role="presentation"} or {@code role="none"}</li>
 *   <li><b>data</b>: a {@code <thead>} or any {@code <th>}</li>
 *   <li><b>layout</b>: a pixel width (attribute or style) of at least the configured minimum</li>
 *   <li><b>layout</b>: legacy {@code cellpadding}, {@code cellspacing}, {@code bgcolor},
 *       {@code background} or {@code border="0"}</li>
 *   <li><b>layout</b>: a cell holding block-level content such as paragraphs, images or controls</li>
 *   <li><b>data</b>: two or more rows</li>
 *   <li><b>layout</b>: fallback (a single row without header cells)</li>
 * </ol>
 */
public class TableClassifier {

    public enum Kind {
        LAYOUT,
        DATA
    }

    private static final Set<String> BLOCK_CONTENT = Set.of("table", "div", "p", "h1", "h2", "h3", "h4", "h5", "h6",
            "ul", "ol", "img", "input", "select", "textarea", "form", "fieldset", "button", "hr");

    private final int layoutMinWidthPx;

    public TableClassifier(int layoutMinWidthPx) {
        this.layoutMinWidthPx = layoutMinWidthPx;
    }

    public Kind classify(Element table) {
        String role = table.attr("role").trim().toLowerCase(Locale.ROOT);
        if (role.equals("presentation") || role.equals("none")) {
            return Kind.LAYOUT;
        }

        List<Element> rows = rowsOf(table);
        for (Element row : rows) {
            if (cellsOf(row).stream().anyMatch(cell -> cell.normalName().equals("th"))) {
                return Kind.DATA;
            }
        }
        if (table.children().stream().anyMatch(child -> child.normalName().equals("thead"))) {
            return Kind.DATA;
        }

        Integer width = InlineStyle.toPx(table.attr("width"));
        if (width == null) {
            width = InlineStyle.of(table).px("width");
        }
        if (width != null && width >= layoutMinWidthPx) {
            return Kind.LAYOUT;
        }

        if (table.hasAttr("cellpadding") || table.hasAttr("cellspacing") || table.hasAttr("bgcolor")
                || table.hasAttr("background") || table.attr("border").trim().equals("0")) {
            return Kind.LAYOUT;
        }

        for (Element row : rows) {
            for (Element cell : cellsOf(row)) {
                for (Element descendant : cell.getAllElements()) {
                    if (descendant != cell && BLOCK_CONTENT.contains(descendant.normalName())) {
                        return Kind.LAYOUT;
                    }
                }
            }
        }

        return rows.size() >= 2 ? Kind.DATA : Kind.LAYOUT;
    }

    /** Rows of this table only, never of nested tables, in document order. */
    public static List<Element> rowsOf(Element table) {
        List<Element> rows = new ArrayList<>();
        for (Element child : table.children()) {
            switch (child.normalName()) {
                case "tr" -> rows.add(child);
                case "thead", "tbody", "tfoot" -> {
                    for (Element grandChild : child.children()) {
                        if (grandChild.normalName().equals("tr")) {
                            rows.add(grandChild);
                        }
                    }
                }
                default -> {
                }
            }
        }
        return rows;
    }

    public static List<Element> cellsOf(Element row) {
        List<Element> cells = new ArrayList<>();
        for (Element child : row.children()) {
            if (child.normalName().equals("td") || child.normalName().equals("th")) {
                cells.add(child);
            }
        }
        return cells;
    }
}
