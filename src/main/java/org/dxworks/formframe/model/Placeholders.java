package org.dxworks.formframe.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Merge-field tokens of the form {@code @Name} or {@code PH@Name}. Tokens are plain text in the
 * model; resolving them is left to whoever consumes the exported document.
 */
public final class Placeholders {

    public static final Pattern TOKEN = Pattern.compile("(?:PH)?@\\w+");

    private Placeholders() {
        // utility class
    }

    public static boolean contains(String text) {
        return text != null && TOKEN.matcher(text).find();
    }

    public static boolean isToken(String text) {
        return text != null && TOKEN.matcher(text).matches();
    }

    /** Distinct tokens in order of first appearance. */
    public static List<String> extract(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text != null) {
            Matcher m = TOKEN.matcher(text);
            while (m.find()) {
                tokens.add(m.group());
            }
        }
        return new ArrayList<>(tokens);
    }

    /** Replaces known tokens with their values; unknown tokens are left as they are. */
    public static String replace(String text, Map<String, String> values) {
        if (text == null) return null;
        Matcher m = TOKEN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = values.get(m.group());
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Splits a text run at token boundaries. Every segment carries {@code base}; token segments
     * additionally carry a placeholder mark.
     */
    public static List<TextSegment> segment(String text, MarkSet base) {
        List<TextSegment> segments = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return segments;
        }
        Matcher m = TOKEN.matcher(text);
        int last = 0;
        while (m.find()) {
            if (m.start() > last) {
                segments.add(new TextSegment(text.substring(last, m.start()), base));
            }
            segments.add(new TextSegment(m.group(), base.with(Mark.placeholder(m.group()))));
            last = m.end();
        }
        if (last < text.length()) {
            segments.add(new TextSegment(text.substring(last), base));
        }
        return segments;
    }

    public static List<TextSegment> segment(String text) {
        return segment(text, MarkSet.EMPTY);
    }
}
