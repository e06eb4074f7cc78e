package org.dxworks.formframe.parser;

import org.dxworks.formframe.model.Mark;
import org.dxworks.formframe.model.MarkSet;
import org.dxworks.formframe.model.MarkType;
import org.dxworks.formframe.model.Placeholders;
import org.dxworks.formframe.model.TextSegment;
import org.dxworks.formframe.serializer.MarkSerializer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Inline layer of the parser: an HTML fragment to styled text segments.
 *
 * <p>Each element passes {@code inherited ∪ own} marks down to its children. Marks of an exclusive
 * kind set on an inner element replace the inherited value, so the innermost value wins. Boolean
 * marks only ever add: {@code font-weight: normal} inside {@code <b>} stays bold.</p>
 *
 * <p>Whitespace is collapsed as a browser would render it and trimmed at both ends of the run,
 * {@code <br>} becomes a newline, text is split at placeholder tokens and adjacent segments with
 * equal marks are merged.</p>
 */
public class MarkParser {
    private static final Set<String> SKIPPED = Set.of("script", "style", "template", "head", "title", "meta", "link");
    private static final Set<String> BLOCK_BREAKS = Set.of("p", "div", "li", "tr", "h1", "h2", "h3", "h4", "h5", "h6",
            "blockquote", "section", "article", "header", "footer", "ul", "ol", "table");
    private static final int MAX_DEPTH = 256;

    public List<TextSegment> parseMarks(String fragmentHtml, MarkSet inherited) {
        if (fragmentHtml == null || fragmentHtml.isEmpty()) {
            return new ArrayList<>();
        }
        Element body = Jsoup.parseBodyFragment(fragmentHtml).body();
        return parseNodes(body.childNodes(), inherited);
    }

    public List<TextSegment> parseNodes(List<Node> nodes, MarkSet inherited) {
        List<Run> runs = new ArrayList<>();
        for (Node node : nodes) {
            collect(node, inherited == null ? MarkSet.EMPTY : inherited, runs, 0);
        }
        return finish(runs);
    }

    public List<TextSegment> parseChildren(Element element, MarkSet inherited) {
        return parseNodes(element.childNodes(), inherited);
    }

    private void collect(Node node, MarkSet marks, List<Run> runs, int depth) {
        if (node instanceof TextNode text) {
            runs.add(new Run(text.getWholeText(), marks, false));
            return;
        }
        if (!(node instanceof Element element)) {
            return;
        }
        String name = element.normalName();
        if (SKIPPED.contains(name)) {
            return;
        }
        if (depth >= MAX_DEPTH) {
            // too deep to style; keep the text with the marks gathered so far
            runs.add(new Run(element.wholeText(), marks, false));
            return;
        }
        if (name.equals("br")) {
            runs.add(new Run("\n", marks, true));
            return;
        }
        if (BLOCK_BREAKS.contains(name) && !runs.isEmpty() && !runs.get(runs.size() - 1).lineBreak) {
            runs.add(new Run("\n", marks, true));
        }
        // the placeholder wrapper's own styling is presentation of the token, not a mark
        MarkSet childMarks = isPlaceholderSpan(element) ? marks : marks.withAll(marksOf(element));
        for (Node child : element.childNodes()) {
            collect(child, childMarks, runs, depth + 1);
        }
    }

    static boolean isPlaceholderSpan(Element element) {
        return element.normalName().equals("span") && element.hasClass(MarkSerializer.PLACEHOLDER_CLASS);
    }

    /** Marks contributed by the element itself, without inheritance. */
    public MarkSet marksOf(Element element) {
        MarkSet marks = MarkSet.EMPTY;
        switch (element.normalName()) {
            case "strong", "b" -> marks = marks.with(Mark.bold());
            case "em", "i" -> marks = marks.with(Mark.italic());
            case "u", "ins" -> marks = marks.with(Mark.underline());
            case "s", "strike", "del" -> marks = marks.with(Mark.strikethrough());
            case "a" -> {
                String href = element.attr("href").trim();
                if (!href.isEmpty()) {
                    marks = marks.with(Mark.link(href));
                }
            }
            case "font" -> {
                if (!element.attr("color").isBlank()) {
                    marks = marks.with(Mark.textColor(element.attr("color").trim()));
                }
                if (!element.attr("face").isBlank()) {
                    marks = marks.with(Mark.fontFamily(element.attr("face").trim()));
                }
            }
            default -> {
            }
        }
        return marks.withAll(styleMarks(InlineStyle.of(element)));
    }

    static MarkSet styleMarks(InlineStyle style) {
        MarkSet marks = MarkSet.EMPTY;
        if (isBoldWeight(style.get("font-weight"))) {
            marks = marks.with(Mark.bold());
        }
        String fontStyle = lower(style.get("font-style"));
        if (fontStyle.equals("italic") || fontStyle.equals("oblique")) {
            marks = marks.with(Mark.italic());
        }
        String decoration = lower(style.get("text-decoration")) + " " + lower(style.get("text-decoration-line"));
        if (decoration.contains("underline")) {
            marks = marks.with(Mark.underline());
        }
        if (decoration.contains("line-through")) {
            marks = marks.with(Mark.strikethrough());
        }
        if (style.has("color")) {
            marks = marks.with(Mark.textColor(style.get("color")));
        }
        String background = style.get("background-color");
        if (background != null && !lower(background).equals("transparent") && !lower(background).equals("initial")) {
            marks = marks.with(Mark.backgroundColor(background));
        }
        if (style.has("font-size")) {
            marks = marks.with(Mark.fontSize(style.get("font-size")));
        }
        if (style.has("font-family")) {
            marks = marks.with(Mark.fontFamily(style.get("font-family")));
        }
        return marks;
    }

    static boolean isBoldWeight(String weight) {
        String w = lower(weight);
        if (w.equals("bold") || w.equals("bolder")) {
            return true;
        }
        try {
            return !w.isEmpty() && Integer.parseInt(w) >= 600;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private List<TextSegment> finish(List<Run> runs) {
        List<TextSegment> collapsed = new ArrayList<>();
        boolean pendingSpace = false;
        boolean atLineStart = true;
        for (Run run : runs) {
            if (run.lineBreak) {
                collapsed.add(new TextSegment("\n", run.marks));
                pendingSpace = false;
                atLineStart = true;
                continue;
            }
            StringBuilder sb = new StringBuilder();
            boolean spaceInRun = false;
            for (int i = 0; i < run.text.length(); i++) {
                char c = run.text.charAt(i);
                if (isCollapsible(c)) {
                    pendingSpace = !atLineStart;
                    spaceInRun = true;
                } else {
                    if (pendingSpace) {
                        if (!spaceInRun && sb.length() == 0 && !collapsed.isEmpty()) {
                            // the space ended the previous run; keep it with that text
                            appendSpace(collapsed);
                        } else {
                            sb.append(' ');
                        }
                        pendingSpace = false;
                    }
                    sb.append(c);
                    atLineStart = false;
                }
            }
            if (sb.length() > 0) {
                collapsed.add(new TextSegment(sb.toString(), run.marks));
            }
        }
        trimLineBreaks(collapsed);

        List<TextSegment> split = new ArrayList<>();
        for (TextSegment segment : collapsed) {
            split.addAll(Placeholders.segment(segment.getText(), segment.getMarkSet()));
        }
        return merge(split);
    }

    private static void appendSpace(List<TextSegment> collapsed) {
        TextSegment last = collapsed.get(collapsed.size() - 1);
        collapsed.set(collapsed.size() - 1, last.withText(last.getText() + " "));
    }

    private static void trimLineBreaks(List<TextSegment> segments) {
        while (!segments.isEmpty() && segments.get(0).getText().equals("\n")) {
            segments.remove(0);
        }
        while (!segments.isEmpty() && segments.get(segments.size() - 1).getText().equals("\n")) {
            segments.remove(segments.size() - 1);
        }
    }

    static List<TextSegment> merge(List<TextSegment> segments) {
        List<TextSegment> merged = new ArrayList<>();
        for (TextSegment segment : segments) {
            if (segment.getText().isEmpty()) {
                continue;
            }
            if (!merged.isEmpty()) {
                TextSegment last = merged.get(merged.size() - 1);
                if (last.getMarkSet().equals(segment.getMarkSet())
                        && !segment.getMarkSet().contains(MarkType.PLACEHOLDER)) {
                    merged.set(merged.size() - 1, last.withText(last.getText() + segment.getText()));
                    continue;
                }
            }
            merged.add(segment);
        }
        return merged;
    }

    private static boolean isCollapsible(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static final class Run {
        final String text;
        final MarkSet marks;
        final boolean lineBreak;

        Run(String text, MarkSet marks, boolean lineBreak) {
            this.text = text;
            this.marks = marks;
            this.lineBreak = lineBreak;
        }
    }
}
