package org.dxworks.formframe.session;

import org.dxworks.formframe.FormframeConfig;
import org.dxworks.formframe.model.BlockType;
import org.dxworks.formframe.model.Section;
import org.dxworks.formframe.model.block.Block;
import org.dxworks.formframe.model.block.ParagraphBlock;
import org.dxworks.formframe.parser.MalformedInputException;
import org.dxworks.formframe.parser.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.dxworks.formframe.TestUtils.paragraph;
import static org.dxworks.formframe.TestUtils.section;
import static org.junit.jupiter.api.Assertions.*;

class EditorSessionTest {

    private final AtomicLong now = new AtomicLong();
    private EditorSession session;
    private String sectionId;

    @BeforeEach
    void setUp() {
        session = new EditorSession(FormframeConfig.defaults(), now::get);
        sectionId = session.getSections().get(0).id;
    }

    private Block add(BlockType type) {
        return session.addBlock(type, sectionId, 0).orElseThrow();
    }

    private List<Block> firstColumn() {
        return session.getSections().get(0).column(0).blocks;
    }

    @Test
    void startsWithOneEmptySectionAndOneHistoryEntry() {
        assertEquals(1, session.getSections().size());
        assertTrue(session.getSections().get(0).allBlocks().isEmpty());
        assertEquals(1, session.getHistory().size());
        assertFalse(session.getHistory().canUndo());
    }

    @Test
    void addedBlockIsSelectedAndUndoable() {
        Block block = add(BlockType.PARAGRAPH);

        assertEquals(block.id, session.getSelectedBlockId());
        assertEquals(2, session.getHistory().size());

        assertTrue(session.undo());
        assertTrue(firstColumn().isEmpty());
        assertNull(session.getSelectedBlockId());
    }

    @Test
    void addingToAMissingColumnDoesNothing() {
        assertTrue(session.addBlock(BlockType.HEADING, sectionId, 2).isEmpty());
        assertTrue(session.addBlock(BlockType.HEADING, "nope", 0).isEmpty());
        assertEquals(1, session.getHistory().size());
    }

    @Test
    void removeBlockClearsItsSelection() {
        Block block = add(BlockType.DIVIDER);

        assertTrue(session.removeBlock(block.id));

        assertNull(session.getSelectedBlockId());
        assertTrue(firstColumn().isEmpty());
        assertFalse(session.removeBlock(block.id));
    }

    @Test
    void duplicateGetsAFreshIdAndSitsAfterTheOriginal() {
        Block original = add(BlockType.TEXT_INPUT);
        add(BlockType.DIVIDER);

        Block copy = session.duplicateBlock(original.id).orElseThrow();

        assertNotEquals(original.id, copy.id);
        assertEquals(BlockType.TEXT_INPUT, copy.getType());
        assertSame(copy, firstColumn().get(1));
        assertEquals(copy.id, session.getSelectedBlockId());
    }

    @Test
    void moveAcrossSections() {
        Block block = add(BlockType.PARAGRAPH);
        Section second = session.addSection(2);

        assertTrue(session.moveBlock(block.id, second.id, 1, 0));

        assertTrue(firstColumn().isEmpty());
        assertEquals(block.id, session.findSection(second.id).orElseThrow().column(1).blocks.get(0).id);
    }

    @Test
    void moveToAMissingTargetKeepsTheBlock() {
        Block block = add(BlockType.PARAGRAPH);
        int entries = session.getHistory().size();

        assertFalse(session.moveBlock(block.id, "gone", 0, 0));
        assertFalse(session.moveBlock(block.id, sectionId, 5, 0));

        assertEquals(List.of(block), firstColumn());
        assertEquals(entries, session.getHistory().size());
    }

    @Test
    void reorderBlocksAndSections() {
        Block a = add(BlockType.HEADING);
        Block b = add(BlockType.PARAGRAPH);
        Section second = session.addSection(1);

        assertTrue(session.reorderBlocks(sectionId, 0, 1, 0));
        assertEquals(List.of(b, a), firstColumn());
        assertFalse(session.reorderBlocks(sectionId, 0, 0, 7));

        assertTrue(session.reorderSections(1, 0));
        assertEquals(second.id, session.getSections().get(0).id);
    }

    @Test
    void removeSectionDropsItsSelection() {
        Section second = session.addSection(1, 0);
        session.selectSection(second.id);

        assertTrue(session.removeSection(second.id));

        assertNull(session.getSelectedSectionId());
        assertEquals(sectionId, session.getSections().get(0).id);
    }

    @Test
    void pastedBlockIsANewCopy() {
        ParagraphBlock original = (ParagraphBlock) add(BlockType.PARAGRAPH);
        assertTrue(session.copyBlock(original.id));

        Block first = session.pasteBlock(sectionId, 0, 0).orElseThrow();
        Block second = session.pasteBlock(sectionId, 0, 0).orElseThrow();

        assertNotEquals(original.id, first.id);
        assertNotEquals(first.id, second.id);
        assertEquals(original.plainText(), ((ParagraphBlock) first).plainText());
        assertEquals(3, firstColumn().size());
    }

    @Test
    void pasteWithEmptyClipboardDoesNothing() {
        assertFalse(session.hasClipboard());
        assertTrue(session.pasteBlock(sectionId, 0, 0).isEmpty());
    }

    @Test
    void selectingABlockDeselectsTheSection() {
        session.selectSection(sectionId);
        session.selectBlock("b1");

        assertEquals("b1", session.getSelectedBlockId());
        assertNull(session.getSelectedSectionId());
    }

    @Test
    void typingIsRecordedOnceAfterTheDebounce() {
        ParagraphBlock block = (ParagraphBlock) add(BlockType.PARAGRAPH);
        int defaultSize = block.fontSize;
        int entries = session.getHistory().size();

        for (int i = 0; i < 5; i++) {
            now.addAndGet(50);
            int size = 10 + i;
            session.updateBlockWithHistory(block.id, b -> ((ParagraphBlock) b).fontSize = size);
        }
        assertFalse(session.tick());
        now.addAndGet(400);
        assertTrue(session.tick());

        assertEquals(entries + 1, session.getHistory().size());
        assertTrue(session.undo());
        assertEquals(defaultSize, ((ParagraphBlock) session.findBlock(block.id).orElseThrow()).fontSize);
    }

    @Test
    void updateWithoutHistoryLeavesTheStackAlone() {
        Block block = add(BlockType.HEADING);
        int entries = session.getHistory().size();

        assertTrue(session.updateBlock(block.id, b -> b.width = 50));

        assertEquals(50, session.findBlock(block.id).orElseThrow().width);
        assertEquals(entries, session.getHistory().size());
        assertFalse(session.getHistory().hasPendingPush());
    }

    @Test
    void malformedImportLeavesTheDocumentUntouched() {
        Block block = add(BlockType.PARAGRAPH);

        assertThrows(MalformedInputException.class, () -> session.importHtml("   "));

        assertEquals(List.of(block), firstColumn());
    }

    @Test
    void importReplacesTheDocumentAndCanBeUndone() throws MalformedInputException {
        add(BlockType.DIVIDER);

        ParseResult result = session.importHtml("<h1>Lease</h1><p>Between the parties</p>");

        assertEquals(1, result.getSections().size());
        assertEquals(2, session.getSections().get(0).allBlocks().size());
        assertTrue(session.undo());
        assertEquals(BlockType.DIVIDER, firstColumn().get(0).getType());
    }

    @Test
    void exportThenImportKeepsTheDocument() throws MalformedInputException {
        add(BlockType.HEADING);
        add(BlockType.SIGNATURE);
        List<Section> before = session.snapshot();

        EditorSession other = new EditorSession(FormframeConfig.defaults(), now::get);
        other.importHtml(session.exportHtml().getHtml());

        assertEquals(before.get(0).allBlocks().size(), other.getSections().get(0).allBlocks().size());
        assertEquals(before.get(0).allBlocks().get(1).id, other.getSections().get(0).allBlocks().get(1).id);
    }

    @Test
    void loadStartsAFreshHistoryAndSnapshotsAreCopies() {
        session.load(List.of(section("s9", List.of(paragraph("p1", "Hello")))));

        assertEquals(1, session.getHistory().size());
        List<Section> snapshot = session.snapshot();
        snapshot.get(0).id = "changed";
        assertEquals("s9", session.getSections().get(0).id);
    }

    @Test
    void importedDocumentIsNotSharedWithTheResult() throws MalformedInputException {
        ParseResult result = session.importHtml("<h1>Lease</h1>");

        result.getSections().get(0).column(0).blocks.clear();

        assertEquals(1, session.getSections().get(0).allBlocks().size());
    }
}
