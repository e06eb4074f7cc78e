package org.dxworks.formframe.parser;

import org.dxworks.formframe.model.BlockDefaults;
import org.dxworks.formframe.model.BlockType;
import org.dxworks.formframe.model.MarkSet;
import org.dxworks.formframe.model.TextSegment;
import org.dxworks.formframe.model.block.*;
import org.dxworks.formframe.serializer.EditorMarkup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Maps single elements to blocks by tag and attribute heuristics. Every method returns a block
 * built on top of {@link BlockDefaults}, so fields the markup does not express keep their
 * defaults.
 */
public class BlockClassifier {
    private static final int[] HEADING_SIZES = {32, 24, 20, 16};
    private static final Set<String> TEXT_ALIGNMENTS = Set.of("left", "center", "right", "justify");
    private static final Set<String> BUTTON_INPUTS = Set.of("submit", "reset", "button", "image");

    private final MarkParser markParser = new MarkParser();
    private final TableExtractor tableExtractor = new TableExtractor();

    // ---- text --------------------------------------------------------------------------------

    public HeadingBlock heading(Element element) {
        HeadingBlock block = BlockDefaults.create(BlockType.HEADING, HeadingBlock.class);
        int level = Character.getNumericValue(element.normalName().charAt(1));
        block.level = Math.max(HeadingBlock.MIN_LEVEL, Math.min(HeadingBlock.MAX_LEVEL, level));
        block.fontSize = HEADING_SIZES[block.level - 1];
        block.fontWeight = 700;
        block.segments = markParser.parseChildren(element, MarkSet.EMPTY);
        applyTypography(element, block);
        GeometryReader.apply(element, block);
        return block;
    }

    public ParagraphBlock paragraph(Element element) {
        ParagraphBlock block = BlockDefaults.create(BlockType.PARAGRAPH, ParagraphBlock.class);
        block.segments = markParser.parseChildren(element, MarkSet.EMPTY);
        applyTypography(element, block);
        GeometryReader.apply(element, block);
        return block;
    }

    /** A paragraph from a run of loose inline nodes, or empty when the run holds no text. */
    public Optional<ParagraphBlock> paragraph(List<Node> inlineRun) {
        List<TextSegment> segments = markParser.parseNodes(inlineRun, MarkSet.EMPTY);
        if (TextSegment.plainText(segments).isBlank()) {
            return Optional.empty();
        }
        ParagraphBlock block = BlockDefaults.create(BlockType.PARAGRAPH, ParagraphBlock.class);
        block.segments = segments;
        return Optional.of(block);
    }

    private static void applyTypography(Element element, TextBlock block) {
        InlineStyle style = InlineStyle.of(element);
        Integer size = style.px("font-size");
        if (size != null && size > 0) {
            block.fontSize = size;
        }
        Integer weight = fontWeight(style.get("font-weight"));
        if (weight != null) {
            block.fontWeight = weight;
        }
        String align = style.has("text-align") ? style.get("text-align") : element.attr("align");
        align = align.trim().toLowerCase(Locale.ROOT);
        if (TEXT_ALIGNMENTS.contains(align)) {
            block.textAlign = align;
        }
        String lineHeight = style.get("line-height");
        if (lineHeight != null) {
            try {
                block.lineHeight = Double.parseDouble(lineHeight);
            } catch (NumberFormatException e) {
                // px or % line heights are outside the model
            }
        }
        if (style.has("color")) {
            block.color = style.get("color");
        }
    }

    static Integer fontWeight(String value) {
        if (value == null) return null;
        String weight = value.trim().toLowerCase(Locale.ROOT);
        switch (weight) {
            case "bold", "bolder":
                return 700;
            case "normal", "lighter":
                return 400;
            default:
                try {
                    return Integer.parseInt(weight);
                } catch (NumberFormatException e) {
                    return null;
                }
        }
    }

    // ---- content -----------------------------------------------------------------------------

    public DividerBlock divider(Element hr) {
        DividerBlock block = BlockDefaults.create(BlockType.DIVIDER, DividerBlock.class);
        InlineStyle style = InlineStyle.of(hr);
        String border = style.get("border-top");
        if (border == null || border.equalsIgnoreCase("none")) {
            border = style.get("border-bottom");
        }
        if (border == null && style.has("border") && !style.get("border").equalsIgnoreCase("none")) {
            border = style.get("border");
        }
        if (border != null) {
            for (String part : border.trim().split("\\s+(?![^(]*\\))")) {
                Integer px = InlineStyle.toPx(part);
                String lower = part.toLowerCase(Locale.ROOT);
                if (px != null) {
                    block.thickness = px;
                } else if (lower.equals("solid") || lower.equals("dashed") || lower.equals("dotted")) {
                    block.style = DividerBlock.LineStyle.fromCss(lower);
                } else if (!lower.equals("none")) {
                    block.color = part;
                }
            }
        } else {
            Integer size = InlineStyle.toPx(hr.attr("size"));
            if (size != null && size > 0) {
                block.thickness = size;
            }
            if (!hr.attr("color").isBlank()) {
                block.color = hr.attr("color").trim();
            }
        }
        GeometryReader.apply(hr, block);
        return block;
    }

    /**
     * @param alignmentSource element whose {@code text-align} positions the image, usually the
     *                        wrapper around it; may be the image itself
     */
    public ImageBlock image(Element img, Element alignmentSource) {
        ImageBlock block = BlockDefaults.create(BlockType.IMAGE, ImageBlock.class);
        block.src = img.attr("src");
        block.alt = img.attr("alt");
        InlineStyle style = InlineStyle.of(img);
        Integer maxHeight = style.px("max-height");
        if (maxHeight != null) {
            block.maxHeight = maxHeight;
        }
        Integer radius = style.px("border-radius");
        if (radius != null) {
            block.borderRadius = radius;
        }
        block.alignment = alignment(img, alignmentSource);
        return block;
    }

    private static String alignment(Element img, Element alignmentSource) {
        String fl = InlineStyle.of(img).get("float");
        if ("left".equalsIgnoreCase(fl) || "right".equalsIgnoreCase(fl)) {
            return fl.toLowerCase(Locale.ROOT);
        }
        if (alignmentSource != null && alignmentSource != img) {
            InlineStyle style = InlineStyle.of(alignmentSource);
            String align = style.has("text-align") ? style.get("text-align") : alignmentSource.attr("align");
            align = align.trim().toLowerCase(Locale.ROOT);
            if (align.equals("left") || align.equals("center") || align.equals("right")) {
                return align;
            }
        }
        return "left";
    }

    public ListBlock list(Element listElement) {
        ListBlock block = BlockDefaults.create(BlockType.LIST, ListBlock.class);
        block.listType = listElement.normalName().equals("ol") ? ListBlock.ListType.ORDERED : ListBlock.ListType.UNORDERED;
        block.items = new ArrayList<>();
        for (Element child : listElement.children()) {
            if (child.normalName().equals("li")) {
                block.items.add(TableExtractor.cellText(child));
            }
        }
        GeometryReader.apply(listElement, block);
        return block;
    }

    public TableBlock table(Element table) {
        return tableExtractor.extract(table);
    }

    public RawHtmlBlock rawHtml(Element element) {
        RawHtmlBlock block = BlockDefaults.create(BlockType.RAW_HTML, RawHtmlBlock.class);
        block.htmlContent = element.outerHtml();
        return block;
    }

    // ---- buttons and signatures --------------------------------------------------------------

    public static boolean isSignatureTrigger(Element button) {
        return button.hasAttr(EditorMarkup.SIGNATURE_BUTTON) || button.text().trim().equalsIgnoreCase("SIGN");
    }

    public static boolean isSignatureContainer(Element element) {
        return element.hasClass("signdiv") || element.hasClass(EditorMarkup.SIGNATURE_AREA_CLASS)
                || element.hasAttr("data-signature");
    }

    public Block button(Element button) {
        if (isSignatureTrigger(button)) {
            return signature(button);
        }
        ButtonBlock block = BlockDefaults.create(BlockType.BUTTON, ButtonBlock.class);
        String text = button.text().trim();
        if (!text.isEmpty()) {
            block.label = text;
        }
        block.buttonType = ButtonBlock.ButtonType.fromValue(button.attr("type"));
        block.variant = variant(button);
        GeometryReader.apply(button, block);
        return block;
    }

    private static ButtonBlock.Variant variant(Element button) {
        String style = button.attr("style");
        for (ButtonBlock.Variant variant : ButtonBlock.Variant.values()) {
            if (style.contains(variant.getCss())) {
                return variant;
            }
        }
        for (String className : button.classNames()) {
            String name = className.toLowerCase(Locale.ROOT);
            if (name.contains("outline")) return ButtonBlock.Variant.OUTLINE;
            if (name.contains("secondary")) return ButtonBlock.Variant.SECONDARY;
        }
        return ButtonBlock.Variant.PRIMARY;
    }

    /** Signature from a signature container or from a bare SIGN button. */
    public SignatureBlock signature(Element element) {
        SignatureBlock block = BlockDefaults.create(BlockType.SIGNATURE, SignatureBlock.class);
        Element labelElement = element.selectFirst("." + EditorMarkup.SIGNATURE_LABEL_CLASS);
        if (labelElement == null) {
            labelElement = element.selectFirst("label");
        }
        String label = "";
        if (labelElement != null) {
            label = labelElement.text();
        } else if (!element.normalName().equals("button")) {
            Element copy = element.clone();
            copy.select("button").remove();
            label = copy.text();
        }
        LabelText parsed = LabelText.of(label);
        if (!parsed.text.isEmpty()) {
            block.label = parsed.text;
        }
        block.required = parsed.required || "true".equalsIgnoreCase(element.attr(EditorMarkup.REQUIRED));

        String fieldName = element.attr(EditorMarkup.FIELD_NAME);
        if (!fieldName.isBlank()) {
            block.fieldName = fieldName;
        }
        Element trigger = element.normalName().equals("button") ? element : element.selectFirst("button");
        if (trigger != null && trigger.hasAttr("title")) {
            block.helpText = trigger.attr("title");
        }
        Element img = element.selectFirst("img");
        if (img != null) {
            block.signatureUrl = img.attr("src");
        }
        GeometryReader.apply(element, block);
        return block;
    }

    // ---- form controls -----------------------------------------------------------------------

    public static boolean isControl(Element element) {
        return switch (element.normalName()) {
            case "input" -> !element.attr("type").equalsIgnoreCase("hidden");
            case "select", "textarea" -> true;
            default -> false;
        };
    }

    /** Block for one form control, or empty for hidden inputs. Labels are looked up in the document. */
    public Optional<Block> control(Element control) {
        return switch (control.normalName()) {
            case "textarea" -> Optional.of(textarea(control));
            case "select" -> Optional.of(dropdown(control));
            case "input" -> input(control);
            default -> Optional.empty();
        };
    }

    private Optional<Block> input(Element input) {
        String type = input.attr("type").trim().toLowerCase(Locale.ROOT);
        if (type.equals("hidden")) {
            return Optional.empty();
        }
        if (BUTTON_INPUTS.contains(type)) {
            ButtonBlock button = BlockDefaults.create(BlockType.BUTTON, ButtonBlock.class);
            if (!input.attr("value").isBlank()) {
                button.label = input.attr("value").trim();
            } else if (type.equals("reset")) {
                button.label = "Reset";
            }
            button.buttonType = type.equals("image") ? ButtonBlock.ButtonType.SUBMIT : ButtonBlock.ButtonType.fromValue(type);
            button.variant = variant(input);
            return Optional.of(button);
        }
        FormFieldBlock block = switch (type) {
            case "date", "datetime-local" -> BlockDefaults.create(BlockType.DATE_PICKER, DatePickerBlock.class);
            case "checkbox" -> BlockDefaults.create(BlockType.SINGLE_CHECKBOX, SingleCheckboxBlock.class);
            case "radio" -> singleRadio(input);
            case "file" -> fileUpload(input);
            default -> textInput(input, type);
        };
        fillField(input, block);
        return Optional.of(block);
    }

    private static RadioGroupBlock singleRadio(Element input) {
        RadioGroupBlock block = BlockDefaults.create(BlockType.RADIO_GROUP, RadioGroupBlock.class);
        String value = input.attr("value").isBlank() ? "Option" : input.attr("value").trim();
        block.options = new ArrayList<>(List.of(value));
        return block;
    }

    private static FileUploadBlock fileUpload(Element input) {
        FileUploadBlock block = BlockDefaults.create(BlockType.FILE_UPLOAD, FileUploadBlock.class);
        block.acceptTypes = input.attr("accept");
        block.multiple = input.hasAttr("multiple");
        if (input.hasAttr(EditorMarkup.MAX_SIZE)) {
            block.maxSize = input.attr(EditorMarkup.MAX_SIZE);
        }
        return block;
    }

    private static TextInputBlock textInput(Element input, String type) {
        TextInputBlock block = BlockDefaults.create(BlockType.TEXT_INPUT, TextInputBlock.class);
        block.validationType = switch (type) {
            case "email" -> "email";
            case "tel" -> "phone";
            case "number" -> "number";
            case "url" -> "url";
            default -> "none";
        };
        block.placeholder = input.attr("placeholder");
        block.maxLength = positiveInt(input.attr("maxlength"));
        return block;
    }

    private TextareaBlock textarea(Element textarea) {
        TextareaBlock block = BlockDefaults.create(BlockType.TEXTAREA, TextareaBlock.class);
        block.placeholder = textarea.hasAttr("placeholder") ? textarea.attr("placeholder") : textarea.wholeText().trim();
        Integer rows = positiveInt(textarea.attr("rows"));
        if (rows != null) {
            block.rows = rows;
        }
        block.maxLength = positiveInt(textarea.attr("maxlength"));
        fillField(textarea, block);
        return block;
    }

    private DropdownBlock dropdown(Element select) {
        DropdownBlock block = BlockDefaults.create(BlockType.DROPDOWN, DropdownBlock.class);
        block.options = new ArrayList<>();
        block.defaultValue = "";
        for (Element option : select.getElementsByTag("option")) {
            String text = option.text().trim();
            if (option.hasAttr("value") && option.attr("value").isEmpty()) {
                // prompt entry such as "Select an option..."
                continue;
            }
            String value = text.isEmpty() ? option.attr("value") : text;
            block.options.add(value);
            if (option.hasAttr("selected")) {
                block.defaultValue = value;
            }
        }
        fillField(select, block);
        return block;
    }

    private static void fillField(Element control, FormFieldBlock block) {
        String name = control.attr("name").trim();
        if (name.isEmpty()) {
            name = control.id().trim();
        }
        if (!name.isEmpty()) {
            block.fieldName = name;
        }
        LabelText label = findLabel(control);
        if (label != null && !label.text.isEmpty()) {
            block.label = label.text;
        }
        block.required = control.hasAttr("required") || (label != null && label.required);
    }

    /** Label of a control: {@code label[for]}, an enclosing label, then aria-label, placeholder and name. */
    static LabelText findLabel(Element control) {
        String id = control.id();
        if (!id.isEmpty()) {
            for (Element label : control.root().getElementsByTag("label")) {
                if (label.attr("for").equals(id)) {
                    return LabelText.of(label);
                }
            }
        }
        for (Element parent : control.parents()) {
            if (parent.normalName().equals("label")) {
                return LabelText.of(parent);
            }
        }
        for (String attribute : List.of("aria-label", "placeholder", "name")) {
            if (!control.attr(attribute).isBlank()) {
                return LabelText.of(control.attr(attribute));
            }
        }
        return null;
    }

    static Element helpTextElement(Element container) {
        Element help = container.selectFirst("." + EditorMarkup.HELP_TEXT_CLASS);
        return help != null ? help : container.selectFirst("small");
    }

    /**
     * A container holding exactly one control with its label and optional help text and nothing
     * else visible becomes that control's block.
     */
    public Optional<Block> fieldContainer(Element container) {
        List<Element> controls = new ArrayList<>();
        for (Element element : container.getAllElements()) {
            if (isControl(element)) {
                controls.add(element);
            }
        }
        if (controls.size() != 1 || container.selectFirst("img, button, table") != null) {
            return Optional.empty();
        }
        Element control = controls.get(0);
        if (control.attr("type").equalsIgnoreCase("radio")) {
            return Optional.empty();
        }
        Element help = helpTextElement(container);
        Element copy = container.clone();
        copy.select("label, input, select, textarea, small, ." + EditorMarkup.HELP_TEXT_CLASS).remove();
        if (!copy.text().isBlank()) {
            return Optional.empty();
        }
        Optional<Block> block = control(control);
        block.ifPresent(b -> {
            if (b instanceof FormFieldBlock field && help != null && !(b instanceof SingleCheckboxBlock)) {
                field.helpText = TableExtractor.cellText(help);
            }
            GeometryReader.apply(container, b);
        });
        return block;
    }

    /**
     * Radio buttons or checkboxes sharing one {@code name}, with their labels, a legend and help
     * text and nothing else. A fieldset qualifies with a single option, other containers need two.
     */
    public Optional<ChoiceGroupBlock> choiceGroup(Element container) {
        List<Element> inputs = container.getElementsByTag("input");
        boolean fieldset = container.normalName().equals("fieldset");
        if (inputs.size() < (fieldset ? 1 : 2) || container.selectFirst("select, textarea, img, button, table") != null) {
            return Optional.empty();
        }
        String type = inputs.get(0).attr("type").toLowerCase(Locale.ROOT);
        String name = inputs.get(0).attr("name");
        if (!(type.equals("radio") || type.equals("checkbox")) || name.isBlank()) {
            return Optional.empty();
        }
        for (Element input : inputs) {
            if (!input.attr("type").equalsIgnoreCase(type) || !input.attr("name").equals(name)) {
                return Optional.empty();
            }
        }
        Element copy = container.clone();
        copy.select("legend, label, input, small, ." + EditorMarkup.HELP_TEXT_CLASS).remove();
        if (!copy.text().isBlank()) {
            return Optional.empty();
        }
        BlockType blockType = type.equals("radio") ? BlockType.RADIO_GROUP : BlockType.CHECKBOX_GROUP;
        return Optional.of(buildChoiceGroup(container, blockType));
    }

    private ChoiceGroupBlock buildChoiceGroup(Element container, BlockType type) {
        ChoiceGroupBlock block = BlockDefaults.create(type, ChoiceGroupBlock.class);
        List<Element> inputs = container.getElementsByTag("input");
        block.options = new ArrayList<>();
        boolean required = false;
        for (Element input : inputs) {
            LabelText optionLabel = null;
            String id = input.id();
            if (!id.isEmpty()) {
                for (Element label : container.getElementsByTag("label")) {
                    if (label.attr("for").equals(id)) {
                        optionLabel = LabelText.of(label);
                    }
                }
            }
            if (optionLabel == null && input.parent() != null && input.parent().normalName().equals("label")) {
                optionLabel = LabelText.of(input.parent());
            }
            String option = optionLabel != null && !optionLabel.text.isEmpty() ? optionLabel.text : input.attr("value").trim();
            block.options.add(option.isEmpty() ? "Option " + (block.options.size() + 1) : option);
            required |= input.hasAttr("required");
        }
        if (!inputs.isEmpty()) {
            block.fieldName = inputs.get(0).attr("name");
        }

        Element legend = container.selectFirst("legend");
        if (legend != null) {
            LabelText label = LabelText.of(legend);
            block.label = label.text;
            required |= label.required;
        } else if (!container.attr("aria-label").isBlank()) {
            block.label = container.attr("aria-label").trim();
        } else {
            block.label = block.fieldName;
        }
        block.required = required;

        Element help = helpTextElement(container);
        if (help != null) {
            block.helpText = TableExtractor.cellText(help);
        }
        block.layout = layout(container);
        GeometryReader.apply(container, block);
        return block;
    }

    private static ChoiceGroupBlock.Layout layout(Element container) {
        if (container.hasAttr(EditorMarkup.CHOICE_LAYOUT)) {
            return ChoiceGroupBlock.Layout.fromValue(container.attr(EditorMarkup.CHOICE_LAYOUT));
        }
        for (Element element : container.getAllElements()) {
            InlineStyle style = InlineStyle.of(element);
            String display = style.has("display") ? style.get("display").toLowerCase(Locale.ROOT) : "";
            String direction = style.has("flex-direction") ? style.get("flex-direction").toLowerCase(Locale.ROOT) : "row";
            if (display.contains("flex") && direction.startsWith("row")) {
                return ChoiceGroupBlock.Layout.HORIZONTAL;
            }
        }
        return ChoiceGroupBlock.Layout.VERTICAL;
    }

    // ---- editor markup -----------------------------------------------------------------------

    /**
     * Rebuilds a block whose element carries its recorded type. The element's geometry and id
     * are restored as well.
     */
    public Block classifyAs(BlockType type, Element element) {
        Block block = switch (type) {
            case HEADING -> element.normalName().matches("h[1-6]") ? heading(element) : headingFrom(element);
            case PARAGRAPH -> paragraph(element);
            case DIVIDER -> divider(element);
            case IMAGE -> imageFrom(element);
            case TEXT_INPUT, TEXTAREA, DROPDOWN, DATE_PICKER, FILE_UPLOAD, SINGLE_CHECKBOX -> fieldFrom(type, element);
            case RADIO_GROUP, CHECKBOX_GROUP -> buildChoiceGroup(element, type);
            case SIGNATURE -> signature(element);
            case TABLE -> element.normalName().equals("table") ? table(element) : rawHtmlContent(element);
            case LIST -> list(element);
            case BUTTON -> button(element);
            case RAW_HTML -> rawHtmlContent(element);
        };
        GeometryReader.apply(element, block);
        String id = element.attr(EditorMarkup.BLOCK_ID);
        if (!id.isBlank()) {
            block.id = id;
        }
        return block;
    }

    private HeadingBlock headingFrom(Element element) {
        HeadingBlock block = BlockDefaults.create(BlockType.HEADING, HeadingBlock.class);
        block.segments = markParser.parseChildren(element, MarkSet.EMPTY);
        applyTypography(element, block);
        return block;
    }

    private ImageBlock imageFrom(Element wrapper) {
        Element img = wrapper.normalName().equals("img") ? wrapper : wrapper.selectFirst("img");
        if (img == null) {
            return BlockDefaults.create(BlockType.IMAGE, ImageBlock.class);
        }
        return image(img, wrapper);
    }

    private Block fieldFrom(BlockType type, Element wrapper) {
        Element control = null;
        for (Element element : wrapper.getAllElements()) {
            if (isControl(element)) {
                control = element;
                break;
            }
        }
        Block parsed = control == null ? null : control(control).orElse(null);
        if (parsed == null || parsed.getType() != type) {
            Block fallback = BlockDefaults.create(type);
            if (parsed instanceof FormFieldBlock field && fallback instanceof FormFieldBlock target) {
                target.label = field.label;
                target.fieldName = field.fieldName;
                target.required = field.required;
            }
            parsed = fallback;
        }
        if (parsed instanceof SingleCheckboxBlock checkbox) {
            Element span = wrapper.selectFirst("label > span");
            if (span != null) {
                checkbox.label = span.text();
            }
        } else if (parsed instanceof FormFieldBlock field) {
            Element label = wrapper.selectFirst("label");
            if (label != null) {
                LabelText text = LabelText.of(label);
                field.label = text.text;
                field.required |= text.required;
            }
            Element help = wrapper.selectFirst("." + EditorMarkup.HELP_TEXT_CLASS);
            field.helpText = help == null ? "" : TableExtractor.cellText(help);
        }
        return parsed;
    }

    private static RawHtmlBlock rawHtmlContent(Element wrapper) {
        RawHtmlBlock block = BlockDefaults.create(BlockType.RAW_HTML, RawHtmlBlock.class);
        block.htmlContent = wrapper.html();
        block.originalStyles = wrapper.attr("style");
        return block;
    }

    private static Integer positiveInt(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Visible label text with the required marker removed. */
    static final class LabelText {
        final String text;
        final boolean required;

        private LabelText(String text, boolean required) {
            this.text = text;
            this.required = required;
        }

        static LabelText of(Element label) {
            Element copy = label.clone();
            boolean marked = !copy.select("." + EditorMarkup.REQUIRED_MARK_CLASS).isEmpty();
            copy.select("input, select, textarea, ." + EditorMarkup.REQUIRED_MARK_CLASS).remove();
            LabelText parsed = of(copy.text());
            return marked ? new LabelText(parsed.text, true) : parsed;
        }

        static LabelText of(String raw) {
            String text = raw == null ? "" : raw.replaceAll("\\s+", " ").trim();
            if (text.endsWith("*")) {
                return new LabelText(text.substring(0, text.length() - 1).trim(), true);
            }
            return new LabelText(text, false);
        }
    }
}
