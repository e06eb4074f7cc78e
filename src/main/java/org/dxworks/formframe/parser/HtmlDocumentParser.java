package org.dxworks.formframe.parser;

import org.dxworks.formframe.FormframeConfig;
import org.dxworks.formframe.metadata.DocumentMetadataCodec;
import org.dxworks.formframe.model.FormDocument;
import org.dxworks.formframe.model.Mark;
import org.dxworks.formframe.model.MarkType;
import org.dxworks.formframe.model.Section;
import org.dxworks.formframe.model.TextSegment;
import org.dxworks.formframe.model.block.Block;
import org.dxworks.formframe.model.block.ImageBlock;
import org.dxworks.formframe.model.block.RawHtmlBlock;
import org.dxworks.formframe.model.block.SignatureBlock;
import org.dxworks.formframe.model.block.TextBlock;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Imports an HTML string into sections.
 *
 * <p>The input is sanitised first. A document carrying the round-trip metadata comment is rebuilt
 * from it directly; otherwise the body is walked and classified, using the editor markers of an
 * exported document when they are present. Only input that yields no content at all fails; every
 * other problem is recovered and reported in {@link ParseResult#getWarnings()}.</p>
 */
public class HtmlDocumentParser {
    private static final Logger LOG = LoggerFactory.getLogger(HtmlDocumentParser.class);
    private static final String CONTENT_ELEMENTS = "img, input, select, textarea, hr, table, button, svg, video";

    private final FormframeConfig config;
    private final HtmlSanitizer sanitizer = new HtmlSanitizer();
    private final DocumentMetadataCodec metadataCodec = new DocumentMetadataCodec();

    public HtmlDocumentParser() {
        this(FormframeConfig.defaults());
    }

    public HtmlDocumentParser(FormframeConfig config) {
        this.config = config;
    }

    public ParseResult parse(String html) throws MalformedInputException {
        if (html == null || html.isBlank()) {
            throw new MalformedInputException("Input is empty");
        }
        Document document = Jsoup.parse(html);
        document.outputSettings().prettyPrint(false);
        ParseContext ctx = new ParseContext(config);

        int removed = sanitizer.sanitize(document);
        if (removed > 0) {
            ctx.warn("Removed " + removed + " script element(s) or attribute(s)");
        }

        List<Comment> metadataComments = metadataCodec.findMetadataComments(document);
        if (!metadataComments.isEmpty()) {
            if (metadataComments.size() > 1) {
                ctx.warn("Found " + metadataComments.size() + " round-trip metadata comments; using the first");
            }
            List<String> codecWarnings = new ArrayList<>();
            Optional<FormDocument> restored = metadataCodec.decode(metadataComments.get(0).getData(), codecWarnings);
            codecWarnings.forEach(ctx.warnings()::add);
            if (restored.isPresent()) {
                List<Section> sections = restored.get().sections;
                sanitizeRestored(sections, ctx);
                LOG.debug("Restored {} section(s) from round-trip metadata", sections.size());
                return new ParseResult(sections, ctx.warnings(), ParseSource.METADATA, 0);
            }
        }

        Element body = document.body();
        if (body.text().isBlank() && body.selectFirst(CONTENT_ELEMENTS) == null) {
            throw new MalformedInputException("Input contains no content to import");
        }

        List<Section> sections = new StructureWalker(ctx).walk(body);
        if (sections.isEmpty()) {
            sections.add(Section.create(1));
        }
        if (ctx.rawHtmlCount() > 0) {
            ctx.warn(ctx.rawHtmlCount() + " element(s) preserved as raw HTML");
        }
        ParseSource source = ctx.editorMarkupSeen() ? ParseSource.EDITOR_MARKUP : ParseSource.EXTERNAL;
        LOG.debug("Parsed {} section(s) from {} markup with {} warning(s)", sections.size(), source, ctx.warnings().size());
        return new ParseResult(sections, ctx.warnings(), source, ctx.rawHtmlCount());
    }

    /**
     * Metadata bypasses the document sanitiser, so restored blocks are cleaned here the same way:
     * raw HTML is sanitised, script links lose their link mark and script image or signature URLs
     * are cleared.
     */
    private void sanitizeRestored(List<Section> sections, ParseContext ctx) {
        for (Section section : sections) {
            for (Block block : section.allBlocks()) {
                if (block instanceof RawHtmlBlock raw && raw.htmlContent != null && !raw.htmlContent.isEmpty()) {
                    Document fragment = Jsoup.parseBodyFragment(raw.htmlContent);
                    fragment.outputSettings().prettyPrint(false);
                    int removed = sanitizer.sanitize(fragment.body());
                    if (removed > 0) {
                        raw.htmlContent = fragment.body().html();
                        ctx.warn("Removed " + removed + " script element(s) or attribute(s) from raw HTML block " + raw.id);
                    }
                } else if (block instanceof TextBlock text) {
                    stripScriptLinks(text, ctx);
                } else if (block instanceof ImageBlock image && HtmlSanitizer.isScriptUrl(image.src)) {
                    image.src = "";
                    ctx.warn("Removed script URL from image block " + image.id);
                } else if (block instanceof SignatureBlock signature && HtmlSanitizer.isScriptUrl(signature.signatureUrl)) {
                    signature.signatureUrl = "";
                    ctx.warn("Removed script URL from signature block " + signature.id);
                }
            }
        }
    }

    private static void stripScriptLinks(TextBlock block, ParseContext ctx) {
        List<TextSegment> cleaned = new ArrayList<>();
        int removed = 0;
        for (TextSegment segment : block.segments) {
            Mark link = segment.getMarkSet().get(MarkType.LINK);
            if (link != null && HtmlSanitizer.isScriptUrl(link.getValue())) {
                cleaned.add(new TextSegment(segment.getText(), segment.getMarkSet().without(MarkType.LINK)));
                removed++;
            } else {
                cleaned.add(segment);
            }
        }
        if (removed > 0) {
            block.segments = MarkParser.merge(cleaned);
            ctx.warn("Removed " + removed + " script link(s) from block " + block.id);
        }
    }
}
