package org.dxworks.formframe.metadata;

import org.dxworks.formframe.TestUtils;
import org.dxworks.formframe.model.FormDocument;
import org.dxworks.formframe.model.MarkType;
import org.dxworks.formframe.model.Section;
import org.dxworks.formframe.model.block.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.dxworks.formframe.TestUtils.heading;
import static org.dxworks.formframe.TestUtils.paragraph;
import static org.dxworks.formframe.TestUtils.section;
import static org.junit.jupiter.api.Assertions.*;

class DocumentMetadataCodecTest {

    private final DocumentMetadataCodec codec = new DocumentMetadataCodec();
    private final List<String> warnings = new ArrayList<>();

    private static String document(String blocks) {
        return "{\"version\":\"1\",\"sections\":[{\"id\":\"s1\",\"columnCount\":1,\"columns\":[{\"blocks\":[" + blocks + "]}]}]}";
    }

    private Block onlyBlock(Optional<FormDocument> decoded) {
        assertTrue(decoded.isPresent(), () -> "decode failed: " + warnings);
        return decoded.get().sections.get(0).column(0).blocks.get(0);
    }

    @Test
    void encodedCommentDecodesToTheSameDocument() throws Exception {
        List<Section> sections = List.of(section("s1", List.of(heading("h1", "Title")), List.of(paragraph("p1", "Dear @Name"))));
        String comment = codec.encode(sections);

        assertTrue(comment.startsWith("<!-- doc-metadata: {\"version\":\"1\""));
        assertTrue(comment.endsWith(" -->"));
        String data = comment.substring("<!--".length(), comment.length() - "-->".length());

        Optional<FormDocument> decoded = codec.decode(data, warnings);

        assertTrue(decoded.isPresent());
        assertEquals(TestUtils.json(sections), TestUtils.json(decoded.get().sections));
        assertTrue(warnings.isEmpty(), warnings::toString);
    }

    @Test
    void doubleDashesAreEscaped() {
        String comment = codec.encode(List.of(section("s1", List.of(paragraph("p1", "a -- b")))));

        assertFalse(comment.substring(4, comment.length() - 3).contains("--"));
        assertTrue(comment.contains("a -\\u002d b"));
    }

    @Test
    void unknownBlockTypeRejectsTheWholeBlob() {
        Optional<FormDocument> decoded = codec.decode(document("{\"type\":\"video\",\"id\":\"b1\"}"), warnings);

        assertTrue(decoded.isEmpty());
        assertEquals(List.of("Round-trip metadata contains unknown block type 'video'; parsing markup instead"), warnings);
    }

    @Test
    void missingFieldsGetDefaults() {
        Block block = onlyBlock(codec.decode(document(
                "{\"type\":\"heading\",\"id\":\"h1\",\"segments\":[{\"text\":\"Hi\",\"marks\":[]}]}"), warnings));

        HeadingBlock heading = assertInstanceOf(HeadingBlock.class, block);
        assertEquals("Hi", heading.plainText());
        assertEquals(2, heading.level);
        assertEquals(24, heading.fontSize);
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).startsWith("Block h1 (heading) was missing "));
        assertTrue(warnings.get(0).contains("level"));
        assertTrue(warnings.get(0).endsWith("; defaults applied"));
    }

    @Test
    void legacyContentBecomesSegments() {
        ParagraphBlock paragraph = (ParagraphBlock) onlyBlock(codec.decode(document(
                "{\"type\":\"paragraph\",\"id\":\"p1\",\"content\":\"Hello @Name\",\"fontSize\":14,\"fontWeight\":400,"
                        + "\"textAlign\":\"left\",\"lineHeight\":1.6,\"color\":\"\",\"width\":100,\"marginTop\":0,"
                        + "\"marginBottom\":8,\"marginLeft\":0,\"marginRight\":0,\"paddingX\":0,\"paddingY\":0,"
                        + "\"locked\":false}"), warnings));

        assertEquals("Hello @Name", paragraph.plainText());
        assertTrue(paragraph.segments.get(1).hasMark(MarkType.PLACEHOLDER));
        assertTrue(warnings.isEmpty(), warnings::toString);
    }

    @Test
    void headingLevelIsClamped() {
        HeadingBlock heading = (HeadingBlock) onlyBlock(codec.decode(document(
                "{\"type\":\"heading\",\"id\":\"h1\",\"level\":9}"), warnings));

        assertEquals(4, heading.level);
        assertTrue(warnings.contains("Heading h1 had level 9; using 4"));
    }

    @Test
    void raggedTableIsPadded() {
        TableBlock table = (TableBlock) onlyBlock(codec.decode(document(
                "{\"type\":\"table\",\"id\":\"t1\",\"rows\":[[\"a\",\"b\"],[\"c\"]],\"headerRow\":false,"
                        + "\"columnWidths\":[50.0,50.0],\"rowHeights\":[0,0]}"), warnings));

        assertEquals(List.of(List.of("a", "b"), List.of("c", "")), table.rows);
        assertTrue(table.isRectangular());
        assertTrue(warnings.contains("Table t1 was not rectangular; rows were padded"));
    }

    @Test
    void unreadableFieldKeepsItsDefault() {
        ParagraphBlock paragraph = (ParagraphBlock) onlyBlock(codec.decode(document(
                "{\"type\":\"paragraph\",\"id\":\"p1\",\"fontSize\":\"big\",\"fontWeight\":700}"), warnings));

        assertEquals(14, paragraph.fontSize);
        assertEquals(700, paragraph.fontWeight);
        assertTrue(warnings.contains("Field 'fontSize' of block p1 (paragraph) could not be read; default kept"));
    }

    @Test
    void duplicateIdsAreReplaced() {
        Optional<FormDocument> decoded = codec.decode(document(
                "{\"type\":\"divider\",\"id\":\"d\"},{\"type\":\"divider\",\"id\":\"d\"}"), warnings);

        List<Block> blocks = decoded.orElseThrow().sections.get(0).column(0).blocks;
        assertEquals("d", blocks.get(0).id);
        assertNotEquals("d", blocks.get(1).id);
        assertTrue(warnings.stream().anyMatch(w -> w.startsWith("Duplicate block id d was given id ")));
    }

    @Test
    void columnCountIsClampedAndExtraColumnsMerged() {
        String json = "{\"version\":\"1\",\"sections\":[{\"id\":\"s1\",\"columnCount\":4,\"columns\":["
                + "{\"blocks\":[{\"type\":\"divider\",\"id\":\"a\"}]},{\"blocks\":[]},{\"blocks\":[{\"type\":\"divider\",\"id\":\"c\"}]},"
                + "{\"blocks\":[{\"type\":\"divider\",\"id\":\"d\"}]}]}]}";

        Section section = codec.decode(json, warnings).orElseThrow().sections.get(0);

        assertEquals(3, section.columnCount);
        assertEquals(3, section.columns.size());
        assertEquals(List.of("c", "d"), List.of(section.column(2).blocks.get(0).id, section.column(2).blocks.get(1).id));
        assertTrue(warnings.contains("Section s1 declared 4 column(s); using 3"));
    }

    @Test
    void invalidJsonFallsBack() {
        assertTrue(codec.decode("doc-metadata: {\"version\":", warnings).isEmpty());
        assertTrue(warnings.get(0).startsWith("Round-trip metadata is not valid JSON"));
        assertTrue(warnings.get(0).endsWith("; parsing markup instead"));
    }

    @Test
    void unsupportedVersionFallsBack() {
        assertTrue(codec.decode("{\"version\":\"2\",\"sections\":[]}", warnings).isEmpty());
        assertEquals(List.of("Unsupported round-trip metadata version '2'; parsing markup instead"), warnings);
    }
}
