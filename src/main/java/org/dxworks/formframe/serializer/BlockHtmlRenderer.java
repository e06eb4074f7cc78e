package org.dxworks.formframe.serializer;

import org.dxworks.formframe.model.block.*;

import java.util.List;

import static org.dxworks.formframe.serializer.HtmlEscaper.escape;
import static org.dxworks.formframe.serializer.HtmlEscaper.escapeMultiline;

/**
 * Fixed HTML template per block type. Every block element carries its id and type tag, and its
 * geometry as inline {@code margin}/{@code padding}/{@code width} style.
 */
public class BlockHtmlRenderer {

    static final String LABEL_STYLE = "display: block; font-size: 14px; font-weight: 500; margin-bottom: 6px;";
    static final String FIELD_STYLE = "width: 100%; padding: 8px 12px; border: 1px solid #e2e8f0; border-radius: 6px; font-size: 14px;";
    static final String HELP_STYLE = "display: block; font-size: 12px; color: #64748b; margin-top: 4px;";
    static final String CELL_STYLE = "padding: 8px; border: 1px solid #000;";

    public String render(Block block) {
        return switch (block.getType()) {
            case HEADING -> heading((HeadingBlock) block);
            case PARAGRAPH -> paragraph((ParagraphBlock) block);
            case DIVIDER -> divider((DividerBlock) block);
            case IMAGE -> image((ImageBlock) block);
            case TEXT_INPUT -> textInput((TextInputBlock) block);
            case TEXTAREA -> textarea((TextareaBlock) block);
            case DROPDOWN -> dropdown((DropdownBlock) block);
            case RADIO_GROUP -> choiceGroup((ChoiceGroupBlock) block, "radio");
            case CHECKBOX_GROUP -> choiceGroup((ChoiceGroupBlock) block, "checkbox");
            case SINGLE_CHECKBOX -> singleCheckbox((SingleCheckboxBlock) block);
            case DATE_PICKER -> datePicker((DatePickerBlock) block);
            case FILE_UPLOAD -> fileUpload((FileUploadBlock) block);
            case SIGNATURE -> signature((SignatureBlock) block);
            case TABLE -> table((TableBlock) block);
            case LIST -> list((ListBlock) block);
            case BUTTON -> button((ButtonBlock) block);
            case RAW_HTML -> rawHtml((RawHtmlBlock) block);
        };
    }

    private String heading(HeadingBlock b) {
        String tag = "h" + b.level;
        return "<" + tag + attrs(b) + " style=\"" + typography(b) + geometry(b) + "\">"
                + MarkSerializer.serialize(b.segments) + "</" + tag + ">";
    }

    private String paragraph(ParagraphBlock b) {
        return "<p" + attrs(b) + " style=\"" + typography(b) + geometry(b) + "\">"
                + MarkSerializer.serialize(b.segments) + "</p>";
    }

    private String typography(TextBlock b) {
        String color = b.color != null && !b.color.isBlank() ? "color: " + escape(b.color) + "; " : "";
        return "font-size: " + b.fontSize + "px; font-weight: " + b.fontWeight + "; text-align: " + escape(b.textAlign)
                + "; line-height: " + number(b.lineHeight) + "; " + color;
    }

    private String divider(DividerBlock b) {
        return "<hr" + attrs(b) + " style=\"border: none; border-top: " + b.thickness + "px " + b.style.getCss() + " "
                + escape(b.color) + "; " + geometry(b) + "\">";
    }

    private String image(ImageBlock b) {
        return "<div" + attrs(b) + " style=\"text-align: " + escape(b.alignment) + "; " + geometry(b) + "\">"
                + "<img src=\"" + escape(b.src) + "\" alt=\"" + escape(b.alt) + "\" style=\"max-width: 100%; border-radius: "
                + b.borderRadius + "px; max-height: " + b.maxHeight + "px;\"></div>";
    }

    private String textInput(TextInputBlock b) {
        String inputType = switch (b.validationType == null ? "none" : b.validationType) {
            case "email" -> "email";
            case "phone" -> "tel";
            case "number" -> "number";
            case "url" -> "url";
            default -> "text";
        };
        return "<div" + attrs(b) + " style=\"" + geometry(b) + "\">\n"
                + "  " + label(b) + "\n"
                + "  <input type=\"" + inputType + "\"" + idAndName(b) + " placeholder=\"" + escape(b.placeholder) + "\""
                + maxLength(b.maxLength) + required(b) + " style=\"" + FIELD_STYLE + "\">"
                + helpText(b) + "\n</div>";
    }

    private String textarea(TextareaBlock b) {
        return "<div" + attrs(b) + " style=\"" + geometry(b) + "\">\n"
                + "  " + label(b) + "\n"
                + "  <textarea" + idAndName(b) + " rows=\"" + b.rows + "\" placeholder=\"" + escape(b.placeholder) + "\""
                + maxLength(b.maxLength) + required(b) + " style=\"" + FIELD_STYLE + " resize: vertical;\"></textarea>"
                + helpText(b) + "\n</div>";
    }

    private String dropdown(DropdownBlock b) {
        StringBuilder sb = new StringBuilder();
        sb.append("<div").append(attrs(b)).append(" style=\"").append(geometry(b)).append("\">\n");
        sb.append("  ").append(label(b)).append('\n');
        sb.append("  <select").append(idAndName(b)).append(required(b))
                .append(" style=\"").append(FIELD_STYLE).append(" background: white;\">\n");
        sb.append("    <option value=\"\">Select an option...</option>\n");
        for (String option : b.options) {
            String selected = option.equals(b.defaultValue) ? " selected" : "";
            sb.append("    <option value=\"").append(escape(option)).append("\"").append(selected).append(">")
                    .append(escape(option)).append("</option>\n");
        }
        sb.append("  </select>").append(helpText(b)).append("\n</div>");
        return sb.toString();
    }

    private String choiceGroup(ChoiceGroupBlock b, String inputType) {
        String direction = b.layout == ChoiceGroupBlock.Layout.HORIZONTAL ? "row" : "column";
        StringBuilder sb = new StringBuilder();
        sb.append("<fieldset").append(attrs(b)).append(" ").append(EditorMarkup.CHOICE_LAYOUT).append("=\"")
                .append(b.layout.getValue()).append("\" style=\"border: none; padding: 0; ").append(geometry(b)).append("\">\n");
        sb.append("  <legend style=\"font-size: 14px; font-weight: 500; margin-bottom: 8px;\">")
                .append(labelText(b)).append("</legend>\n");
        sb.append("  <div style=\"display: flex; flex-direction: ").append(direction).append("; gap: 8px;\">\n");
        for (int i = 0; i < b.options.size(); i++) {
            String option = b.options.get(i);
            String req = b.required && i == 0 ? " required" : "";
            sb.append("    <label style=\"display: flex; align-items: center; gap: 8px; font-size: 14px;\">")
                    .append("<input type=\"").append(inputType).append("\" name=\"").append(escape(b.fieldName))
                    .append("\" value=\"").append(escape(option)).append("\"").append(req).append("> ")
                    .append(escape(option)).append("</label>\n");
        }
        sb.append("  </div>").append(helpText(b)).append("\n</fieldset>");
        return sb.toString();
    }

    private String singleCheckbox(SingleCheckboxBlock b) {
        return "<div" + attrs(b) + " style=\"" + geometry(b) + "\">\n"
                + "  <label style=\"display: flex; align-items: flex-start; gap: 10px; font-size: 14px; line-height: 1.5;\">\n"
                + "    <input type=\"checkbox\" name=\"" + escape(b.fieldName) + "\"" + required(b)
                + " style=\"margin-top: 4px; flex-shrink: 0;\">\n"
                + "    <span>" + MarkSerializer.serializePlain(b.label) + "</span>\n"
                + "  </label>\n</div>";
    }

    private String datePicker(DatePickerBlock b) {
        return "<div" + attrs(b) + " style=\"" + geometry(b) + "\">\n"
                + "  " + label(b) + "\n"
                + "  <input type=\"date\"" + idAndName(b) + required(b) + " style=\"" + FIELD_STYLE + "\">"
                + helpText(b) + "\n</div>";
    }

    private String fileUpload(FileUploadBlock b) {
        String accept = b.acceptTypes != null && !b.acceptTypes.isBlank() ? " accept=\"" + escape(b.acceptTypes) + "\"" : "";
        String maxSize = b.maxSize != null && !b.maxSize.isBlank()
                ? " " + EditorMarkup.MAX_SIZE + "=\"" + escape(b.maxSize) + "\"" : "";
        return "<div" + attrs(b) + " style=\"" + geometry(b) + "\">\n"
                + "  " + label(b) + "\n"
                + "  <input type=\"file\"" + idAndName(b) + required(b) + accept + (b.multiple ? " multiple" : "") + maxSize
                + " style=\"width: 100%; padding: 8px; border: 1px solid #e2e8f0; border-radius: 6px; font-size: 14px;\">"
                + helpText(b) + "\n</div>";
    }

    private String signature(SignatureBlock b) {
        StringBuilder sb = new StringBuilder();
        sb.append("<div").append(attrs(b)).append(" class=\"").append(EditorMarkup.SIGNATURE_AREA_CLASS).append("\" ")
                .append(EditorMarkup.FIELD_NAME).append("=\"").append(escape(b.fieldName)).append("\"")
                .append(b.required ? " " + EditorMarkup.REQUIRED + "=\"true\"" : "")
                .append(" style=\"display: flex; align-items: center; gap: 8px; ").append(geometry(b)).append("\">\n");
        sb.append("  <button type=\"button\" class=\"sign-button\" ").append(EditorMarkup.SIGNATURE_BUTTON)
                .append(" title=\"").append(escape(b.helpText)).append("\"")
                .append(" style=\"background: #ffeb3b; border: 1px solid #000; padding: 4px 16px; font-weight: bold; font-size: 12px;\">SIGN</button>\n");
        sb.append("  <span class=\"").append(EditorMarkup.SIGNATURE_LABEL_CLASS).append("\">")
                .append(MarkSerializer.serializePlain(b.label)).append("</span>");
        if (b.signatureUrl != null && !b.signatureUrl.isBlank()) {
            sb.append("\n  <img class=\"").append(EditorMarkup.SIGNATURE_IMAGE_CLASS).append("\" src=\"")
                    .append(escape(b.signatureUrl)).append("\" alt=\"Signature\" style=\"max-height: 50px;\">");
        }
        sb.append("\n</div>");
        return sb.toString();
    }

    private String table(TableBlock b) {
        StringBuilder sb = new StringBuilder();
        sb.append("<table").append(attrs(b)).append(" style=\"width: 100%; border-collapse: collapse; ")
                .append(geometry(b)).append("\">\n");
        if (!b.columnWidths.isEmpty()) {
            sb.append("  <colgroup>\n");
            for (Double width : b.columnWidths) {
                sb.append("    <col style=\"width: ").append(number(width == null ? 0 : width)).append("%;\">\n");
            }
            sb.append("  </colgroup>\n");
        }
        int first = 0;
        if (b.headerRow && !b.rows.isEmpty()) {
            sb.append("  <thead>\n");
            appendRow(sb, b, 0, "th");
            sb.append("  </thead>\n");
            first = 1;
        }
        sb.append("  <tbody>\n");
        for (int r = first; r < b.rows.size(); r++) {
            appendRow(sb, b, r, "td");
        }
        sb.append("  </tbody>\n</table>");
        return sb.toString();
    }

    private void appendRow(StringBuilder sb, TableBlock b, int rowIndex, String cellTag) {
        Integer height = rowIndex < b.rowHeights.size() ? b.rowHeights.get(rowIndex) : null;
        sb.append("    <tr").append(height != null && height > 0 ? " style=\"height: " + height + "px;\"" : "").append(">\n");
        String style = "th".equals(cellTag) ? CELL_STYLE + " font-weight: bold;" : CELL_STYLE;
        for (String cell : b.rows.get(rowIndex)) {
            sb.append("      <").append(cellTag).append(" style=\"").append(style).append("\">")
                    .append(MarkSerializer.serializePlain(cell)).append("</").append(cellTag).append(">\n");
        }
        sb.append("    </tr>\n");
    }

    private String list(ListBlock b) {
        boolean ordered = b.listType == ListBlock.ListType.ORDERED;
        String tag = ordered ? "ol" : "ul";
        StringBuilder sb = new StringBuilder();
        sb.append("<").append(tag).append(attrs(b)).append(" style=\"list-style-type: ")
                .append(ordered ? "decimal" : "disc").append("; padding-left: 24px; ").append(geometry(b)).append("\">\n");
        for (String item : b.items) {
            sb.append("  <li style=\"padding: 4px 0;\">").append(MarkSerializer.serializePlain(item)).append("</li>\n");
        }
        sb.append("</").append(tag).append(">");
        return sb.toString();
    }

    private String button(ButtonBlock b) {
        return "<button" + attrs(b) + " type=\"" + b.buttonType.getValue() + "\" style=\"padding: 10px 20px; border-radius: 6px; "
                + "font-size: 14px; font-weight: 500; cursor: pointer; " + b.variant.getCss() + " " + geometry(b) + "\">"
                + escape(b.label) + "</button>";
    }

    private String rawHtml(RawHtmlBlock b) {
        String style = b.originalStyles != null && !b.originalStyles.isBlank() ? " style=\"" + escape(b.originalStyles) + "\"" : "";
        return "<div" + attrs(b) + style + ">" + (b.htmlContent == null ? "" : b.htmlContent) + "</div>";
    }

    private String label(FormFieldBlock b) {
        return "<label for=\"" + escape(b.fieldName) + "\" style=\"" + LABEL_STYLE + "\">" + labelText(b) + "</label>";
    }

    private String labelText(FormFieldBlock b) {
        return escape(b.label) + (b.required
                ? " <span class=\"" + EditorMarkup.REQUIRED_MARK_CLASS + "\" style=\"color: #ef4444;\">*</span>" : "");
    }

    private String helpText(FormFieldBlock b) {
        if (b.helpText == null || b.helpText.isBlank()) return "";
        return "\n  <small class=\"" + EditorMarkup.HELP_TEXT_CLASS + "\" style=\"" + HELP_STYLE + "\">"
                + escapeMultiline(b.helpText) + "</small>";
    }

    private String idAndName(FormFieldBlock b) {
        String name = escape(b.fieldName);
        return " id=\"" + name + "\" name=\"" + name + "\"";
    }

    private String required(FormFieldBlock b) {
        return b.required ? " required" : "";
    }

    private String maxLength(Integer maxLength) {
        return maxLength != null && maxLength > 0 ? " maxlength=\"" + maxLength + "\"" : "";
    }

    private String attrs(Block b) {
        StringBuilder sb = new StringBuilder();
        sb.append(' ').append(EditorMarkup.BLOCK_ID).append("=\"").append(escape(b.id)).append('"');
        sb.append(' ').append(EditorMarkup.BLOCK_TYPE).append("=\"").append(b.getType().getTag()).append('"');
        if (b.width != 100) {
            sb.append(' ').append(EditorMarkup.WIDTH).append("=\"").append(b.width).append('"');
        }
        if (b.locked) {
            sb.append(' ').append(EditorMarkup.LOCKED).append("=\"true\"");
        }
        return sb.toString();
    }

    private String geometry(Block b) {
        StringBuilder sb = new StringBuilder();
        sb.append("margin: ").append(b.marginTop).append("px ").append(b.marginRight).append("px ")
                .append(b.marginBottom).append("px ").append(b.marginLeft).append("px;");
        if (b.paddingX != 0 || b.paddingY != 0) {
            sb.append(" padding: ").append(b.paddingY).append("px ").append(b.paddingX).append("px;");
        }
        if (b.width != 100) {
            sb.append(" width: ").append(b.width).append("%;");
        }
        return sb.toString();
    }

    static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /** Joins rendered blocks, indenting only the first line of each. */
    String renderAll(List<Block> blocks, String indent) {
        StringBuilder sb = new StringBuilder();
        for (Block block : blocks) {
            sb.append(indent).append(render(block)).append('\n');
        }
        return sb.toString();
    }
}
