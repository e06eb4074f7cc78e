package org.dxworks.formframe.parser;

import org.dxworks.formframe.model.block.Block;
import org.dxworks.formframe.serializer.EditorMarkup;
import org.jsoup.nodes.Element;

/**
 * Copies block geometry (margins, padding, width, lock flag) from an element's inline style and
 * editor attributes. Values that are absent or not expressed in px/% keep the block's defaults.
 */
final class GeometryReader {

    private GeometryReader() {
        // utility class
    }

    static void apply(Element element, Block block) {
        InlineStyle style = InlineStyle.of(element);

        Integer[] margin = style.box("margin");
        if (margin[0] != null) block.marginTop = margin[0];
        if (margin[1] != null) block.marginRight = margin[1];
        if (margin[2] != null) block.marginBottom = margin[2];
        if (margin[3] != null) block.marginLeft = margin[3];

        Integer[] padding = style.box("padding");
        if (padding[0] != null) block.paddingY = padding[0];
        if (padding[1] != null) block.paddingX = padding[1];

        Integer width = parseWidth(element.attr(EditorMarkup.WIDTH));
        if (width == null) {
            Double percent = style.percent("width");
            width = percent == null ? null : (int) Math.round(percent);
        }
        if (width != null && width > 0 && width <= 100) {
            block.width = width;
        }

        if ("true".equalsIgnoreCase(element.attr(EditorMarkup.LOCKED))) {
            block.locked = true;
        }
    }

    private static Integer parseWidth(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
