package org.dxworks.formframe.serializer;

import org.dxworks.formframe.FormframeConfig;
import org.dxworks.formframe.metadata.DocumentMetadataCodec;
import org.dxworks.formframe.model.Column;
import org.dxworks.formframe.model.FormDocument;
import org.dxworks.formframe.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Sections to HTML. Both the full document and the body fragment end with the round-trip
 * metadata comment, so parsing the output restores the exact model.
 */
public class HtmlDocumentSerializer {
    private static final Logger LOG = LoggerFactory.getLogger(HtmlDocumentSerializer.class);

    private static final String DOCUMENT_STYLES =
            "    * { margin: 0; padding: 0; box-sizing: border-box; }\n" +
            "    body { font-family: 'Times New Roman', Times, serif; color: #000; background: #fff; font-size: 12px; line-height: 1.4; }\n" +
            "    form { max-width: 800px; margin: 20px auto; padding: 24px; background: white; }\n" +
            "    table { width: 100%; border-collapse: collapse; margin: 8px 0; }\n" +
            "    td, th { padding: 8px; border: 1px solid #000; vertical-align: top; font-size: inherit; }\n" +
            "    p { margin: 0 0 8px 0; text-align: justify; }\n" +
            "    h1, h2, h3 { text-align: center; font-weight: bold; margin: 12px 0; }\n" +
            "    input, select, textarea { outline: none; font-family: inherit; font-size: inherit; }\n" +
            "    fieldset { border: none; padding: 0; margin: 0; }\n" +
            "    .placeholder { background-color: #b3d4fc; padding: 0 2px; }\n" +
            "    .sign-button { background: #ffeb3b; border: 1px solid #000; padding: 4px 16px; font-weight: bold; font-size: 12px; }\n" +
            "    .signature-area { display: flex; align-items: center; gap: 8px; }\n" +
            "    a { color: #0066cc; text-decoration: underline; }\n";

    private final BlockHtmlRenderer renderer = new BlockHtmlRenderer();
    private final DocumentMetadataCodec metadataCodec = new DocumentMetadataCodec();
    private final FormframeConfig config;

    public HtmlDocumentSerializer() {
        this(FormframeConfig.defaults());
    }

    public HtmlDocumentSerializer(FormframeConfig config) {
        this.config = config;
    }

    public String serialize(List<Section> sections) {
        StringBuilder sb = new StringBuilder();
        sb.append("<!DOCTYPE html>\n");
        sb.append("<html lang=\"en\" ").append(EditorMarkup.VERSION).append("=\"").append(FormDocument.CURRENT_VERSION).append("\">\n");
        sb.append("<head>\n");
        sb.append("  <meta charset=\"UTF-8\">\n");
        sb.append("  <meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n");
        sb.append("  <title>").append(HtmlEscaper.escape(config.getDocumentTitle())).append("</title>\n");
        sb.append("  <style>\n").append(DOCUMENT_STYLES).append("  </style>\n");
        sb.append("</head>\n");
        sb.append("<body>\n");
        sb.append("  <form novalidate>\n");
        sb.append(renderSections(sections));
        sb.append("  </form>\n");
        sb.append(metadataCodec.encode(sections)).append('\n');
        sb.append("</body>\n");
        sb.append("</html>\n");
        return sb.toString();
    }

    public String serializeBody(List<Section> sections) {
        return renderSections(sections) + metadataCodec.encode(sections) + "\n";
    }

    /** Serializes and reports a size warning when the output exceeds the configured threshold. */
    public ExportResult export(List<Section> sections, boolean bodyOnly) {
        String html = bodyOnly ? serializeBody(sections) : serialize(sections);
        List<String> warnings = new ArrayList<>();
        int size = html.getBytes(StandardCharsets.UTF_8).length;
        if (size > config.getExportSizeWarningBytes()) {
            String message = "Exported HTML is " + (size / 1024) + " KB, above the " + (config.getExportSizeWarningBytes() / 1024)
                    + " KB guideline; some email clients may clip it";
            LOG.warn(message);
            warnings.add(message);
        }
        LOG.debug("Exported {} section(s), {} bytes", sections.size(), size);
        return new ExportResult(html, warnings);
    }

    String renderSections(List<Section> sections) {
        StringBuilder sb = new StringBuilder();
        for (Section section : sections) {
            sb.append(renderSection(section));
        }
        return sb.toString();
    }

    String renderSection(Section section) {
        int columnCount = section.columns.size();
        boolean multi = columnCount > 1;
        StringBuilder sb = new StringBuilder();
        sb.append("<div ").append(EditorMarkup.SECTION).append("=\"true\" ")
                .append(EditorMarkup.SECTION_ID).append("=\"").append(HtmlEscaper.escape(section.id)).append("\" ")
                .append(EditorMarkup.LAYOUT).append("=\"").append(columnCount).append("\" style=\"")
                .append(multi ? "display: flex; gap: 0; margin-bottom: 16px;" : "margin-bottom: 16px;").append("\">\n");
        String width = BlockHtmlRenderer.number(Math.round(10000.0 / Math.max(1, columnCount)) / 100.0);
        for (int i = 0; i < columnCount; i++) {
            Column column = section.columns.get(i);
            sb.append("  <div ").append(EditorMarkup.COLUMN).append("=\"").append(i).append("\"");
            if (multi) {
                sb.append(" style=\"width: ").append(width).append("%; padding: 0 8px; box-sizing: border-box;\"");
            }
            sb.append(">\n");
            sb.append(renderer.renderAll(column.blocks, "    "));
            sb.append("  </div>\n");
        }
        sb.append("</div>\n");
        return sb.toString();
    }
}
