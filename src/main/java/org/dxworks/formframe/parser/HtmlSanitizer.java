package org.dxworks.formframe.parser;

import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Removes active content from an imported tree in place: script-like elements, event handler
 * attributes and {@code javascript:} URLs. {@code style} and {@code data-*} attributes are kept
 * since layout detection and editor markup depend on them.
 */
public class HtmlSanitizer {
    private static final Set<String> REMOVED_ELEMENTS = Set.of("script", "iframe", "object", "embed", "applet", "noscript");
    private static final Set<String> URL_ATTRIBUTES = Set.of("href", "src", "action", "formaction", "background", "xlink:href");

    /** Returns the number of elements and attributes removed. */
    public int sanitize(Element root) {
        int removed = 0;
        for (Element element : root.select(String.join(",", REMOVED_ELEMENTS))) {
            element.remove();
            removed++;
        }
        for (Element element : root.getAllElements()) {
            List<String> drop = new ArrayList<>();
            for (Attribute attribute : element.attributes()) {
                String key = attribute.getKey().toLowerCase(Locale.ROOT);
                if (key.startsWith("on")) {
                    drop.add(attribute.getKey());
                } else if (URL_ATTRIBUTES.contains(key) && isScriptUrl(attribute.getValue())) {
                    drop.add(attribute.getKey());
                }
            }
            for (String key : drop) {
                element.removeAttr(key);
                removed++;
            }
        }
        return removed;
    }

    static boolean isScriptUrl(String value) {
        if (value == null) return false;
        String compact = value.replaceAll("[\\s\\u0000-\\u001f]", "").toLowerCase(Locale.ROOT);
        return compact.startsWith("javascript:") || compact.startsWith("vbscript:");
    }
}
