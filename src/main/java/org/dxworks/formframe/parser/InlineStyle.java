package org.dxworks.formframe.parser;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Declarations of an element's {@code style} attribute. Property names are lower-cased and
 * {@code !important} is dropped; values keep their authored form.
 */
public final class InlineStyle {
    private static final Pattern LENGTH = Pattern.compile("^(-?\\d+(?:\\.\\d+)?)(px|%)?$");

    private final Map<String, String> declarations;

    private InlineStyle(Map<String, String> declarations) {
        this.declarations = declarations;
    }

    public static InlineStyle of(Element element) {
        return parse(element.attr("style"));
    }

    public static InlineStyle parse(String style) {
        Map<String, String> declarations = new LinkedHashMap<>();
        if (style != null) {
            for (String declaration : splitDeclarations(style)) {
                int colon = declaration.indexOf(':');
                if (colon <= 0) continue;
                String property = declaration.substring(0, colon).trim().toLowerCase(Locale.ROOT);
                String value = declaration.substring(colon + 1).replace("!important", "").trim();
                if (!property.isEmpty() && !value.isEmpty()) {
                    declarations.put(property, value);
                }
            }
        }
        return new InlineStyle(declarations);
    }

    /** Splits at {@code ;} outside parentheses and quotes, so {@code url(data:...;base64,...)} stays whole. */
    private static List<String> splitDeclarations(String style) {
        List<String> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int parens = 0;
        char quote = 0;
        for (int i = 0; i < style.length(); i++) {
            char c = style.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                parens++;
            } else if (c == ')' && parens > 0) {
                parens--;
            } else if (c == ';' && parens == 0) {
                result.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        result.add(current.toString());
        return result;
    }

    public String get(String property) {
        return declarations.get(property);
    }

    public boolean has(String property) {
        return declarations.containsKey(property);
    }

    public boolean isEmpty() {
        return declarations.isEmpty();
    }

    /** Pixel value of a property, or {@code null} if missing or not in px. */
    public Integer px(String property) {
        return toPx(get(property));
    }

    /** Percent value of a property, or {@code null} if missing or not in %. */
    public Double percent(String property) {
        return toPercent(get(property));
    }

    public static Integer toPx(String value) {
        if (value == null) return null;
        Matcher m = LENGTH.matcher(value.trim().toLowerCase(Locale.ROOT));
        if (!m.matches() || "%".equals(m.group(2))) return null;
        return (int) Math.round(Double.parseDouble(m.group(1)));
    }

    public static Double toPercent(String value) {
        if (value == null) return null;
        Matcher m = LENGTH.matcher(value.trim().toLowerCase(Locale.ROOT));
        if (!m.matches() || !"%".equals(m.group(2))) return null;
        return Double.parseDouble(m.group(1));
    }

    /**
     * Expands a box shorthand such as {@code margin: 4px 8px} into top, right, bottom, left pixel
     * values. Entries that are not pixel lengths are {@code null}.
     */
    public Integer[] box(String property) {
        Integer[] result = new Integer[4];
        String shorthand = get(property);
        if (shorthand != null) {
            String[] parts = shorthand.trim().split("\\s+");
            String[] expanded = switch (parts.length) {
                case 1 -> new String[]{parts[0], parts[0], parts[0], parts[0]};
                case 2 -> new String[]{parts[0], parts[1], parts[0], parts[1]};
                case 3 -> new String[]{parts[0], parts[1], parts[2], parts[1]};
                default -> new String[]{parts[0], parts[1], parts[2], parts[3]};
            };
            for (int i = 0; i < 4; i++) {
                result[i] = "0".equals(expanded[i]) ? Integer.valueOf(0) : toPx(expanded[i]);
            }
        }
        String[] sides = {"top", "right", "bottom", "left"};
        for (int i = 0; i < 4; i++) {
            Integer side = px(property + "-" + sides[i]);
            if (side != null) {
                result[i] = side;
            }
        }
        return result;
    }
}
