package org.dxworks.formframe.parser;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises containers that lay their children out side by side and splits those children into
 * two or three columns. Recognised shapes are a CSS grid with N tracks, a flex row of sized
 * children and the common column class names of CSS frameworks.
 */
public class ColumnLayoutDetector {
    private static final Pattern REPEAT = Pattern.compile("repeat\\(\\s*(\\d+)\\s*,");
    private static final Pattern COLUMN_CLASS = Pattern.compile("(?:^|[-_])(?:cols?-([23])|(two|three)-columns?)$");

    public Optional<List<List<Node>>> detect(Element container) {
        if (!container.ownText().isBlank()) {
            // loose text between the columns has no column to go to
            return Optional.empty();
        }
        InlineStyle style = InlineStyle.of(container);
        List<Element> children = container.children();
        String display = lower(style.get("display"));

        if (display.equals("grid") || display.equals("inline-grid")) {
            int tracks = gridTracks(style.get("grid-template-columns"));
            if (isColumnCount(tracks) && !children.isEmpty()) {
                return Optional.of(distribute(children, tracks));
            }
            return Optional.empty();
        }

        if (display.equals("flex") || display.equals("inline-flex")) {
            String direction = lower(style.get("flex-direction"));
            if (direction.startsWith("column") || !isColumnCount(children.size())) {
                return Optional.empty();
            }
            for (Element child : children) {
                InlineStyle childStyle = InlineStyle.of(child);
                if (!childStyle.has("width") && !childStyle.has("flex") && !childStyle.has("flex-basis")) {
                    return Optional.empty();
                }
            }
            return Optional.of(distribute(children, children.size()));
        }

        if (isColumnCount(children.size()) && hasColumnClass(container)) {
            return Optional.of(distribute(children, children.size()));
        }
        return Optional.empty();
    }

    static int gridTracks(String template) {
        if (template == null || template.isBlank()) {
            return 0;
        }
        Matcher repeat = REPEAT.matcher(template);
        if (repeat.find()) {
            try {
                return Integer.parseInt(repeat.group(1));
            } catch (NumberFormatException e) {
                // far more tracks than columns; not a column layout
                return 0;
            }
        }
        // track sizes may contain spaces inside minmax(...)
        String flattened = template.replaceAll("\\([^)]*\\)", "()").trim();
        return flattened.split("\\s+").length;
    }

    private static boolean hasColumnClass(Element container) {
        for (String className : container.classNames()) {
            String name = className.toLowerCase(Locale.ROOT);
            if (name.equals("row") || COLUMN_CLASS.matcher(name).find()) {
                return true;
            }
        }
        return false;
    }

    /** One child per column when the counts match, round-robin otherwise. */
    private static List<List<Node>> distribute(List<Element> children, int columns) {
        List<List<Node>> result = new ArrayList<>();
        for (int i = 0; i < columns; i++) {
            result.add(new ArrayList<>());
        }
        for (int i = 0; i < children.size(); i++) {
            result.get(i % columns).add(children.get(i));
        }
        return result;
    }

    private static boolean isColumnCount(int count) {
        return count == 2 || count == 3;
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
