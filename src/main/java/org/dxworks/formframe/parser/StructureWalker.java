package org.dxworks.formframe.parser;

import org.dxworks.formframe.model.BlockDefaults;
import org.dxworks.formframe.model.BlockType;
import org.dxworks.formframe.model.Section;
import org.dxworks.formframe.model.block.Block;
import org.dxworks.formframe.model.block.ChoiceGroupBlock;
import org.dxworks.formframe.model.block.RawHtmlBlock;
import org.dxworks.formframe.serializer.EditorMarkup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Structural layer of the parser. Walks a sanitised body and emits sections of blocks: loose
 * inline content is grouped into paragraphs, containers are unwrapped, side-by-side layouts become
 * multi-column sections and anything unrecognised is kept as raw HTML.
 */
class StructureWalker {
    private static final Set<String> INLINE = Set.of("span", "strong", "b", "em", "i", "u", "ins", "s", "strike", "del",
            "a", "font", "br", "small", "sub", "sup", "code", "mark", "img", "abbr", "cite", "q", "kbd", "var", "time", "big");
    private static final Set<String> CONTAINERS = Set.of("div", "section", "article", "main", "header", "footer", "nav",
            "aside", "form", "center", "body", "figure", "details", "summary", "li", "td", "th", "tr", "tbody", "thead",
            "tfoot", "dl", "html");
    private static final Set<String> TEXT_LIKE = Set.of("blockquote", "pre", "address", "figcaption", "legend", "dt",
            "dd", "caption", "h5", "h6");
    private static final Set<String> IGNORED = Set.of("style", "meta", "link", "title", "head", "template", "colgroup",
            "col", "br", "option", "datalist");
    private static final Set<String> MEDIA = Set.of("img", "svg", "video", "audio", "canvas", "picture", "object");
    static final int MAX_DEPTH = 256;

    private final ParseContext ctx;
    private final BlockClassifier classifier = new BlockClassifier();
    private final ColumnLayoutDetector columnDetector = new ColumnLayoutDetector();
    private final TableClassifier tableClassifier;
    private int depth;

    StructureWalker(ParseContext ctx) {
        this.ctx = ctx;
        this.tableClassifier = new TableClassifier(ctx.config().getLayoutTableMinWidthPx());
    }

    List<Section> walk(Element body) {
        DocumentTarget target = new DocumentTarget();
        container(body, target);
        return target.sections;
    }

    private void visitNodes(List<Node> nodes, Target target) {
        List<Node> run = new ArrayList<>();
        for (Node node : new ArrayList<>(nodes)) {
            if (isInline(node)) {
                run.add(node);
                continue;
            }
            flushRun(run, target);
            visitElement((Element) node, target);
        }
        flushRun(run, target);
    }

    private boolean isInline(Node node) {
        if (!(node instanceof Element element)) {
            return true;
        }
        if (!INLINE.contains(element.normalName()) || hasEditorMarkup(element)) {
            return false;
        }
        for (Element descendant : element.getAllElements()) {
            if (descendant != element && !INLINE.contains(descendant.normalName())) {
                return false;
            }
        }
        return true;
    }

    private void flushRun(List<Node> run, Target target) {
        if (run.isEmpty()) {
            return;
        }
        List<Element> images = new ArrayList<>();
        for (Node node : run) {
            if (node instanceof Element element) {
                images.addAll(element.getElementsByTag("img"));
            }
        }
        if (images.isEmpty()) {
            classifier.paragraph(run).ifPresent(target::add);
        } else if (classifier.paragraph(run).isEmpty()) {
            for (Element img : images) {
                target.add(classifier.image(img, img.parent()));
            }
        } else {
            RawHtmlBlock block = BlockDefaults.create(BlockType.RAW_HTML, RawHtmlBlock.class);
            StringBuilder html = new StringBuilder();
            for (Node node : run) {
                html.append(node.outerHtml());
            }
            block.htmlContent = html.toString().trim();
            ctx.rawHtmlPreserved("img");
            target.add(block);
        }
        run.clear();
    }

    private void visitElement(Element element, Target target) {
        if (depth >= MAX_DEPTH) {
            if (hasContent(element)) {
                ctx.rawHtmlPreserved(element.normalName(), "Deeply nested");
                target.add(classifier.rawHtml(element));
            }
            return;
        }
        depth++;
        try {
            classify(element, target);
        } finally {
            depth--;
        }
    }

    private void classify(Element element, Target target) {
        if (element.hasAttr(EditorMarkup.SECTION)) {
            restoreSection(element, target);
            return;
        }
        Optional<BlockType> recorded = BlockType.find(element.attr(EditorMarkup.BLOCK_TYPE));
        if (recorded.isPresent()) {
            ctx.markEditorMarkupSeen();
            target.add(classifier.classifyAs(recorded.get(), element));
            return;
        }

        String name = element.normalName();
        if (IGNORED.contains(name)) {
            return;
        }
        switch (name) {
            case "h1", "h2", "h3", "h4" -> {
                if (hasMedia(element) || hasControls(element)) {
                    container(element, target);
                } else if (!element.text().isBlank()) {
                    target.add(classifier.heading(element));
                }
            }
            case "p" -> {
                if (hasMedia(element) || hasControls(element) || hasBlockChildren(element)) {
                    container(element, target);
                } else if (!element.text().isBlank()) {
                    target.add(classifier.paragraph(element));
                }
            }
            case "hr" -> target.add(classifier.divider(element));
            case "img" -> target.add(classifier.image(element, element.parent()));
            case "input", "select", "textarea" -> classifier.control(element).ifPresent(target::add);
            case "button" -> target.add(classifier.button(element));
            case "ul", "ol" -> {
                if (hasMedia(element) || hasControls(element)) {
                    container(element, target);
                } else if (!element.text().isBlank()) {
                    target.add(classifier.list(element));
                }
            }
            case "table" -> table(element, target);
            case "fieldset" -> {
                Optional<ChoiceGroupBlock> group = classifier.choiceGroup(element);
                if (group.isPresent()) {
                    target.add(group.get());
                } else {
                    container(element, target);
                }
            }
            case "label" -> label(element, target);
            default -> {
                if (TEXT_LIKE.contains(name) && !hasMedia(element) && !hasControls(element) && !hasBlockChildren(element)) {
                    if (!element.text().isBlank()) {
                        target.add(name.startsWith("h") ? classifier.heading(element) : classifier.paragraph(element));
                    }
                } else if (CONTAINERS.contains(name) || INLINE.contains(name) || TEXT_LIKE.contains(name)) {
                    container(element, target);
                } else if (hasContent(element)) {
                    ctx.rawHtmlPreserved(name);
                    target.add(classifier.rawHtml(element));
                }
            }
        }
    }

    private void container(Element element, Target target) {
        if (hasEditorMarkup(element)) {
            visitNodes(element.childNodes(), target);
            return;
        }
        if (BlockClassifier.isSignatureContainer(element)) {
            target.add(classifier.signature(element));
            return;
        }
        Optional<List<List<Node>>> columns = columnDetector.detect(element);
        if (columns.isPresent()) {
            columns(columns.get(), target);
            return;
        }
        Optional<ChoiceGroupBlock> group = classifier.choiceGroup(element);
        if (group.isPresent()) {
            target.add(group.get());
            return;
        }
        Optional<Block> field = classifier.fieldContainer(element);
        if (field.isPresent()) {
            target.add(field.get());
            return;
        }
        visitNodes(element.childNodes(), target);
    }

    private void columns(List<List<Node>> columns, Target target) {
        List<List<Block>> built = new ArrayList<>();
        int filled = 0;
        for (List<Node> nodes : columns) {
            ListTarget column = new ListTarget();
            visitNodes(nodes, column);
            built.add(column.blocks);
            if (!column.blocks.isEmpty()) {
                filled++;
            }
        }
        if (filled >= 2) {
            target.addColumns(built);
        } else {
            built.forEach(blocks -> blocks.forEach(target::add));
        }
    }

    private void table(Element table, Target target) {
        if (tableClassifier.classify(table) == TableClassifier.Kind.DATA) {
            target.add(classifier.table(table));
            return;
        }
        for (Element child : table.children()) {
            if (child.normalName().equals("caption") && !child.text().isBlank()) {
                target.add(classifier.paragraph(child));
            }
        }
        for (Element row : TableClassifier.rowsOf(table)) {
            List<Element> cells = TableClassifier.cellsOf(row);
            int withContent = 0;
            for (Element cell : cells) {
                if (hasContent(cell) || hasControls(cell)) {
                    withContent++;
                }
            }
            if (cells.size() >= Section.MIN_COLUMNS + 1 && cells.size() <= Section.MAX_COLUMNS && withContent >= 2) {
                List<List<Node>> columns = new ArrayList<>();
                for (Element cell : cells) {
                    columns.add(new ArrayList<>(cell.childNodes()));
                }
                columns(columns, target);
            } else {
                for (Element cell : cells) {
                    container(cell, target);
                }
            }
        }
    }

    private void label(Element label, Target target) {
        List<Element> controls = new ArrayList<>();
        for (Element element : label.getAllElements()) {
            if (BlockClassifier.isControl(element)) {
                controls.add(element);
            }
        }
        if (controls.size() == 1) {
            classifier.control(controls.get(0)).ifPresent(target::add);
            return;
        }
        if (controls.size() > 1) {
            container(label, target);
            return;
        }
        String forId = label.attr("for");
        if (!forId.isEmpty()) {
            for (Element element : label.root().getAllElements()) {
                if (forId.equals(element.id()) && BlockClassifier.isControl(element)) {
                    // consumed as the control's label
                    return;
                }
            }
        }
        if (!label.text().isBlank()) {
            target.add(classifier.paragraph(label));
        }
    }

    private void restoreSection(Element element, Target target) {
        ctx.markEditorMarkupSeen();
        List<Element> columnElements = new ArrayList<>();
        for (Element child : element.children()) {
            if (child.hasAttr(EditorMarkup.COLUMN)) {
                columnElements.add(child);
            }
        }
        columnElements.sort(Comparator.comparingInt(c -> parseIndex(c.attr(EditorMarkup.COLUMN))));

        int count = Math.max(Section.MIN_COLUMNS, Math.min(Section.MAX_COLUMNS, columnElements.size()));
        int declared = parseIndex(element.attr(EditorMarkup.LAYOUT));
        if (declared != columnElements.size() && !columnElements.isEmpty()) {
            ctx.warn("Section declares " + element.attr(EditorMarkup.LAYOUT) + " column(s) but contains "
                    + columnElements.size() + "; using " + count);
        }
        Section section = Section.create(count);
        String id = element.attr(EditorMarkup.SECTION_ID);
        if (!id.isBlank()) {
            section.id = id;
        }
        if (columnElements.isEmpty()) {
            ListTarget column = new ListTarget();
            visitNodes(element.childNodes(), column);
            section.column(0).blocks.addAll(column.blocks);
        } else {
            for (int i = 0; i < columnElements.size(); i++) {
                ListTarget column = new ListTarget();
                visitNodes(columnElements.get(i).childNodes(), column);
                section.column(Math.min(i, count - 1)).blocks.addAll(column.blocks);
            }
        }
        target.addSection(section);
    }

    private static int parseIndex(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    private static boolean hasEditorMarkup(Element element) {
        return element.selectFirst("[" + EditorMarkup.BLOCK_TYPE + "], [" + EditorMarkup.SECTION + "]") != null;
    }

    private static boolean hasMedia(Element element) {
        for (Element descendant : element.getAllElements()) {
            if (MEDIA.contains(descendant.normalName())) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasControls(Element element) {
        for (Element descendant : element.getAllElements()) {
            if (BlockClassifier.isControl(descendant) || descendant.normalName().equals("button")) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasBlockChildren(Element element) {
        for (Element descendant : element.getAllElements()) {
            if (descendant != element && !INLINE.contains(descendant.normalName())) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasContent(Element element) {
        return hasMedia(element) || !element.text().isBlank();
    }

    /** Where walked blocks go: the document's sections or a single column. */
    private abstract static class Target {
        abstract void add(Block block);

        abstract void addColumns(List<List<Block>> columns);

        void addSection(Section section) {
            section.allBlocks().forEach(this::add);
        }
    }

    private static final class DocumentTarget extends Target {
        final List<Section> sections = new ArrayList<>();
        private Section open;

        @Override
        void add(Block block) {
            if (open == null) {
                open = Section.create(1);
                sections.add(open);
            }
            open.column(0).blocks.add(block);
        }

        @Override
        void addColumns(List<List<Block>> columns) {
            Section section = Section.create(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                section.column(i).blocks.addAll(columns.get(i));
            }
            addSection(section);
        }

        @Override
        void addSection(Section section) {
            sections.add(section);
            open = null;
        }
    }

    /** Nested layouts inside a column are flattened into it. */
    private static final class ListTarget extends Target {
        final List<Block> blocks = new ArrayList<>();

        @Override
        void add(Block block) {
            blocks.add(block);
        }

        @Override
        void addColumns(List<List<Block>> columns) {
            columns.forEach(blocks::addAll);
        }
    }
}
