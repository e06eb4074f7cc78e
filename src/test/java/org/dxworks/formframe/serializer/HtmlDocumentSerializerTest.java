package org.dxworks.formframe.serializer;

import org.approvaltests.Approvals;
import org.dxworks.formframe.FormframeConfig;
import org.dxworks.formframe.model.Section;
import org.dxworks.formframe.model.block.ParagraphBlock;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.formframe.TestUtils.heading;
import static org.dxworks.formframe.TestUtils.paragraph;
import static org.dxworks.formframe.TestUtils.section;
import static org.junit.jupiter.api.Assertions.*;

class HtmlDocumentSerializerTest {

    private final HtmlDocumentSerializer serializer = new HtmlDocumentSerializer();

    private static List<Section> twoColumnDocument() {
        return List.of(section("s1", List.of(heading("h1", "Welcome")), List.of(paragraph("p1", "Hello @Name"))));
    }

    @Test
    void serializesTwoColumnSection() {
        String body = serializer.serializeBody(twoColumnDocument());

        Approvals.verify(body.replaceAll("<!-- doc-metadata: .* -->", "<!-- doc-metadata -->"));
    }

    @Test
    void columnsAreSiblingsInsideOneSection() {
        Document document = Jsoup.parse(serializer.serializeBody(twoColumnDocument()));

        Elements sections = document.select("[data-editor-section]");
        assertEquals(1, sections.size());
        Elements columns = sections.get(0).children();
        assertEquals(2, columns.size());
        assertEquals("0", columns.get(0).attr("data-editor-column"));
        assertEquals("1", columns.get(1).attr("data-editor-column"));
        assertNotNull(columns.get(0).selectFirst("h2[data-block-type=heading]"));
        assertNotNull(columns.get(1).selectFirst("p[data-block-type=paragraph]"));
    }

    @Test
    void fullDocumentCarriesTitleFormAndOneMetadataComment() {
        FormframeConfig config = FormframeConfig.with(50, 400, 200 * 1024, 400, "Lease <Draft>");

        String html = new HtmlDocumentSerializer(config).serialize(twoColumnDocument());

        assertTrue(html.startsWith("<!DOCTYPE html>\n"));
        assertTrue(html.contains("<title>Lease &lt;Draft&gt;</title>"));
        assertTrue(html.contains("<form novalidate>"));
        assertEquals(1, html.split("<!-- doc-metadata:", -1).length - 1);
        assertTrue(html.indexOf("<!-- doc-metadata:") > html.indexOf("</form>"));
    }

    @Test
    void textIsEscaped() {
        ParagraphBlock paragraph = paragraph("p1", "Fees < 5% & \"net\"");
        Section section = section("s1", List.of(paragraph));

        String html = serializer.serializeBody(List.of(section));

        assertTrue(html.contains(">Fees &lt; 5% &amp; &quot;net&quot;</p>"));
    }

    @Test
    void doubleDashesNeverCloseTheMetadataComment() {
        Section section = section("s1", List.of(paragraph("p1", "before -- after -->")));

        String html = serializer.serializeBody(List.of(section));
        String comment = html.substring(html.indexOf("<!-- doc-metadata:"));

        assertEquals(comment.length() - 4, comment.indexOf("-->"));
    }

    @Test
    void largeExportIsFlagged() {
        FormframeConfig config = FormframeConfig.with(50, 400, 1024, 400, null);
        Section section = section("s1", List.of(paragraph("p1", "x".repeat(4000))));

        ExportResult result = new HtmlDocumentSerializer(config).export(List.of(section), true);

        assertTrue(result.hasWarnings());
        assertTrue(result.getWarnings().get(0).contains("above the 1 KB guideline"));
    }

    @Test
    void smallExportHasNoWarnings() {
        ExportResult result = serializer.export(twoColumnDocument(), false);

        assertFalse(result.hasWarnings());
    }

    @Test
    void singleColumnSectionHasNoColumnStyle() {
        Element column = Jsoup.parse(serializer.serializeBody(List.of(section("s1", List.of(heading("h1", "T"))))))
                .selectFirst("[data-editor-column]");

        assertFalse(column.hasAttr("style"));
        assertEquals("margin-bottom: 16px;", column.parent().attr("style"));
    }
}
