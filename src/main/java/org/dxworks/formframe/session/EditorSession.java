package org.dxworks.formframe.session;

import org.dxworks.formframe.FormframeConfig;
import org.dxworks.formframe.history.HistoryManager;
import org.dxworks.formframe.metadata.Json;
import org.dxworks.formframe.model.BlockDefaults;
import org.dxworks.formframe.model.BlockType;
import org.dxworks.formframe.model.Column;
import org.dxworks.formframe.model.FormDocument;
import org.dxworks.formframe.model.Section;
import org.dxworks.formframe.model.block.Block;
import org.dxworks.formframe.parser.HtmlDocumentParser;
import org.dxworks.formframe.parser.MalformedInputException;
import org.dxworks.formframe.parser.ParseResult;
import org.dxworks.formframe.serializer.ExportResult;
import org.dxworks.formframe.serializer.HtmlDocumentSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * The live document of one editor together with its selection, clipboard and history. The
 * rendering layer drives it through the intent methods below.
 *
 * <p>Structural edits (add, remove, move, reorder, duplicate, paste, import) record a history
 * entry immediately. {@link #updateBlockWithHistory} records a debounced entry so continuous
 * edits collapse into one. Unknown ids and out-of-range positions leave the document unchanged.</p>
 *
 * <p>Not thread-safe: one actor edits a session at a time.</p>
 */
public class EditorSession {
    private static final Logger LOG = LoggerFactory.getLogger(EditorSession.class);

    private final HtmlDocumentParser parser;
    private final HtmlDocumentSerializer serializer;
    private final HistoryManager history;

    private FormDocument document;
    private String selectedBlockId;
    private String selectedSectionId;
    private Block clipboard;

    public EditorSession() {
        this(FormframeConfig.defaults(), System::currentTimeMillis);
    }

    public EditorSession(FormframeConfig config) {
        this(config, System::currentTimeMillis);
    }

    public EditorSession(FormframeConfig config, LongSupplier clock) {
        this.parser = new HtmlDocumentParser(config);
        this.serializer = new HtmlDocumentSerializer(config);
        this.document = new FormDocument(new ArrayList<>(List.of(Section.create(1))));
        this.history = new HistoryManager(() -> document.sections, sections -> document.sections = sections,
                config.getMaxHistoryEntries(), config.getHistoryDebounceMillis(), clock);
        this.history.setOnRestore(this::clearSelection);
        this.history.reset(document.sections);
    }

    // ---- sections ----------------------------------------------------------------------------

    public Section addSection(int columnCount) {
        return addSection(columnCount, document.sections.size());
    }

    /** Inserts a new empty section; an index outside the list appends. */
    public Section addSection(int columnCount, int index) {
        Section section = Section.create(columnCount);
        List<Section> sections = document.sections;
        sections.add(index < 0 || index > sections.size() ? sections.size() : index, section);
        history.push(true);
        return section;
    }

    public boolean removeSection(String sectionId) {
        Optional<Section> section = findSection(sectionId);
        if (section.isEmpty()) {
            return false;
        }
        for (Block block : section.get().allBlocks()) {
            if (block.id.equals(selectedBlockId)) {
                selectedBlockId = null;
            }
        }
        if (sectionId.equals(selectedSectionId)) {
            selectedSectionId = null;
        }
        document.sections.remove(section.get());
        history.push(true);
        return true;
    }

    public boolean reorderSections(int oldIndex, int newIndex) {
        List<Section> sections = document.sections;
        if (!inRange(oldIndex, sections.size()) || !inRange(newIndex, sections.size())) {
            return false;
        }
        sections.add(newIndex, sections.remove(oldIndex));
        history.push(true);
        return true;
    }

    // ---- blocks ------------------------------------------------------------------------------

    public Optional<Block> addBlock(BlockType type, String sectionId, int column) {
        return addBlock(type, sectionId, column, Integer.MAX_VALUE);
    }

    /** Adds a default block of the given type and selects it. An index past the end appends. */
    public Optional<Block> addBlock(BlockType type, String sectionId, int column, int index) {
        return insert(BlockDefaults.create(type), sectionId, column, index);
    }

    private Optional<Block> insert(Block block, String sectionId, int column, int index) {
        Optional<Column> target = findColumn(sectionId, column);
        if (target.isEmpty()) {
            return Optional.empty();
        }
        List<Block> blocks = target.get().blocks;
        blocks.add(index < 0 || index > blocks.size() ? blocks.size() : index, block);
        selectedBlockId = block.id;
        history.push(true);
        return Optional.of(block);
    }

    public boolean removeBlock(String blockId) {
        Optional<BlockLocation> location = locate(blockId);
        if (location.isEmpty()) {
            return false;
        }
        location.get().column.blocks.remove(location.get().index);
        if (blockId.equals(selectedBlockId)) {
            selectedBlockId = null;
        }
        history.push(true);
        return true;
    }

    /** Applies an edit to a block without recording history. */
    public boolean updateBlock(String blockId, Consumer<Block> mutator) {
        Optional<Block> block = findBlock(blockId);
        if (block.isEmpty()) {
            return false;
        }
        mutator.accept(block.get());
        return true;
    }

    /** Applies an edit to a block and records a debounced history entry. */
    public boolean updateBlockWithHistory(String blockId, Consumer<Block> mutator) {
        if (!updateBlock(blockId, mutator)) {
            return false;
        }
        history.push(false);
        return true;
    }

    /**
     * Moves a block to another position, possibly in another section. A missing target leaves the
     * block where it is; an index past the end of the target column appends.
     */
    public boolean moveBlock(String blockId, String toSectionId, int toColumn, int toIndex) {
        Optional<BlockLocation> from = locate(blockId);
        Optional<Column> to = findColumn(toSectionId, toColumn);
        if (from.isEmpty() || to.isEmpty()) {
            return false;
        }
        Block block = from.get().column.blocks.remove(from.get().index);
        List<Block> target = to.get().blocks;
        target.add(toIndex < 0 || toIndex > target.size() ? target.size() : toIndex, block);
        history.push(true);
        return true;
    }

    public boolean reorderBlocks(String sectionId, int column, int oldIndex, int newIndex) {
        Optional<Column> target = findColumn(sectionId, column);
        if (target.isEmpty()) {
            return false;
        }
        List<Block> blocks = target.get().blocks;
        if (!inRange(oldIndex, blocks.size()) || !inRange(newIndex, blocks.size())) {
            return false;
        }
        blocks.add(newIndex, blocks.remove(oldIndex));
        history.push(true);
        return true;
    }

    /** Inserts a copy with a fresh id right after the original and selects it. */
    public Optional<Block> duplicateBlock(String blockId) {
        Optional<BlockLocation> location = locate(blockId);
        if (location.isEmpty()) {
            return Optional.empty();
        }
        Block copy = Json.copy(location.get().block());
        copy.id = BlockDefaults.newId();
        location.get().column.blocks.add(location.get().index + 1, copy);
        selectedBlockId = copy.id;
        history.push(true);
        return Optional.of(copy);
    }

    // ---- clipboard ---------------------------------------------------------------------------

    public boolean copyBlock(String blockId) {
        Optional<Block> block = findBlock(blockId);
        block.ifPresent(b -> clipboard = Json.copy(b));
        return block.isPresent();
    }

    public boolean hasClipboard() {
        return clipboard != null;
    }

    /** Pastes a fresh copy of the clipboard block; the clipboard itself stays reusable. */
    public Optional<Block> pasteBlock(String sectionId, int column, int index) {
        if (clipboard == null) {
            return Optional.empty();
        }
        Block copy = Json.copy(clipboard);
        copy.id = BlockDefaults.newId();
        return insert(copy, sectionId, column, index);
    }

    // ---- selection ---------------------------------------------------------------------------

    public void selectBlock(String blockId) {
        selectedBlockId = blockId;
        selectedSectionId = null;
    }

    public void selectSection(String sectionId) {
        selectedSectionId = sectionId;
        selectedBlockId = null;
    }

    public void clearSelection() {
        selectedBlockId = null;
        selectedSectionId = null;
    }

    public String getSelectedBlockId() {
        return selectedBlockId;
    }

    public String getSelectedSectionId() {
        return selectedSectionId;
    }

    // ---- history -----------------------------------------------------------------------------

    public boolean undo() {
        return history.undo();
    }

    public boolean redo() {
        return history.redo();
    }

    /** Records a debounced history entry once its delay has passed. Call from the event loop. */
    public boolean tick() {
        return history.tick();
    }

    public HistoryManager getHistory() {
        return history;
    }

    // ---- import, export, persistence ---------------------------------------------------------

    /**
     * Replaces the document with parsed HTML. On {@link MalformedInputException} the current
     * document is left untouched.
     */
    public ParseResult importHtml(String html) throws MalformedInputException {
        ParseResult result = parser.parse(html);
        document.sections = Json.copySections(result.getSections());
        clearSelection();
        history.push(true);
        LOG.debug("Imported {} section(s) from {} with {} warning(s)", result.getSections().size(),
                result.getSource(), result.getWarnings().size());
        return result;
    }

    public ExportResult exportHtml() {
        return serializer.export(document.sections, false);
    }

    public ExportResult exportBodyHtml() {
        return serializer.export(document.sections, true);
    }

    /** Loads persisted sections and starts a fresh history from them. */
    public void load(List<Section> sections) {
        document = new FormDocument(Json.copySections(sections));
        clearSelection();
        history.reset(document.sections);
    }

    /** A deep copy of the current sections, safe to hand to persistence. */
    public List<Section> snapshot() {
        return Json.copySections(document.sections);
    }

    public List<Section> getSections() {
        return document.sections;
    }

    // ---- lookup ------------------------------------------------------------------------------

    public Optional<Block> findBlock(String blockId) {
        return locate(blockId).map(BlockLocation::block);
    }

    public Optional<Section> findSection(String sectionId) {
        if (sectionId == null) {
            return Optional.empty();
        }
        for (Section section : document.sections) {
            if (sectionId.equals(section.id)) {
                return Optional.of(section);
            }
        }
        return Optional.empty();
    }

    private Optional<Column> findColumn(String sectionId, int column) {
        return findSection(sectionId)
                .filter(section -> inRange(column, section.columns.size()))
                .map(section -> section.column(column));
    }

    private Optional<BlockLocation> locate(String blockId) {
        if (blockId == null) {
            return Optional.empty();
        }
        for (Section section : document.sections) {
            for (Column column : section.columns) {
                for (int i = 0; i < column.blocks.size(); i++) {
                    if (blockId.equals(column.blocks.get(i).id)) {
                        return Optional.of(new BlockLocation(column, i));
                    }
                }
            }
        }
        return Optional.empty();
    }

    private static boolean inRange(int index, int size) {
        return index >= 0 && index < size;
    }

    private static final class BlockLocation {
        final Column column;
        final int index;

        BlockLocation(Column column, int index) {
            this.column = column;
            this.index = index;
        }

        Block block() {
            return column.blocks.get(index);
        }
    }
}
