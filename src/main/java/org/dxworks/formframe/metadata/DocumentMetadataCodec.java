package org.dxworks.formframe.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxworks.formframe.model.BlockDefaults;
import org.dxworks.formframe.model.BlockType;
import org.dxworks.formframe.model.Column;
import org.dxworks.formframe.model.FormDocument;
import org.dxworks.formframe.model.Section;
import org.dxworks.formframe.model.block.Block;
import org.dxworks.formframe.model.block.HeadingBlock;
import org.dxworks.formframe.model.block.TableBlock;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Writes and reads the round-trip metadata comment
 * {@code <!-- doc-metadata: {"version":"1","sections":[...]} -->}.
 *
 * <h3>Reading is lenient per block:</h3>
 * <ol>
 *   <li>fields missing from a recorded block are taken from {@link BlockDefaults}</li>
 *   <li>fields that cannot be read into the block's type keep their default value</li>
 *   <li>missing or duplicate ids are replaced and column counts are repaired</li>
 * </ol>
 * Each repair is reported as a warning. An unknown block type, an unsupported version or
 * invalid JSON rejects the whole blob so the caller can fall back to parsing the markup.
 */
public class DocumentMetadataCodec {
    private static final Logger LOG = LoggerFactory.getLogger(DocumentMetadataCodec.class);

    public static final String MARKER = "doc-metadata:";

    public String encode(List<Section> sections) {
        try {
            String json = Json.write(new FormDocument(sections));
            // "--" may not appear inside an HTML comment, so the second dash is written as a JSON escape
            return "<!-- " + MARKER + " " + json.replace("--", "-\\u002d") + " -->";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Document metadata could not be written", e);
        }
    }

    /** Comments carrying the metadata marker, in document order. */
    public List<Comment> findMetadataComments(Node root) {
        List<Comment> found = new ArrayList<>();
        collectComments(root, found);
        return found;
    }

    private void collectComments(Node node, List<Comment> found) {
        for (Node child : node.childNodes()) {
            if (child instanceof Comment comment) {
                if (comment.getData().trim().startsWith(MARKER)) {
                    found.add(comment);
                }
            } else {
                collectComments(child, found);
            }
        }
    }

    public Optional<FormDocument> decode(String commentData, List<String> warnings) {
        String json = commentData.trim();
        if (json.startsWith(MARKER)) {
            json = json.substring(MARKER.length()).trim();
        }

        JsonNode root;
        try {
            root = Json.MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            warn(warnings, "Round-trip metadata is not valid JSON (" + e.getOriginalMessage() + "); parsing markup instead");
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            warn(warnings, "Round-trip metadata is not a JSON object; parsing markup instead");
            return Optional.empty();
        }
        String version = root.path("version").asText("");
        if (!FormDocument.CURRENT_VERSION.equals(version)) {
            warn(warnings, "Unsupported round-trip metadata version '" + version + "'; parsing markup instead");
            return Optional.empty();
        }
        JsonNode sectionsNode = root.get("sections");
        if (sectionsNode == null || !sectionsNode.isArray()) {
            warn(warnings, "Round-trip metadata has no sections array; parsing markup instead");
            return Optional.empty();
        }

        try {
            Set<String> seenIds = new HashSet<>();
            List<Section> sections = new ArrayList<>();
            for (JsonNode sectionNode : sectionsNode) {
                sections.add(readSection(sectionNode, seenIds, warnings));
            }
            return Optional.of(new FormDocument(sections));
        } catch (RejectedMetadataException e) {
            warn(warnings, e.getMessage() + "; parsing markup instead");
            return Optional.empty();
        }
    }

    private Section readSection(JsonNode node, Set<String> seenIds, List<String> warnings)
            throws RejectedMetadataException {
        if (!node.isObject()) {
            throw new RejectedMetadataException("Round-trip metadata contains a section that is not an object");
        }
        List<List<Block>> columns = new ArrayList<>();
        JsonNode columnsNode = node.get("columns");
        if (columnsNode != null && columnsNode.isArray()) {
            for (JsonNode columnNode : columnsNode) {
                JsonNode blocksNode = columnNode.isArray() ? columnNode : columnNode.path("blocks");
                columns.add(readBlocks(blocksNode, seenIds, warnings));
            }
        } else if (node.path("blocks").isArray()) {
            // older exports stored the column count under "columns" and a nested block array
            for (JsonNode blocksNode : node.get("blocks")) {
                columns.add(readBlocks(blocksNode, seenIds, warnings));
            }
        }

        Section section = new Section();
        section.id = node.path("id").asText("");
        if (section.id.isBlank()) {
            section.id = BlockDefaults.newId();
            warn(warnings, "Section without id was given id " + section.id);
        }

        int recorded = node.has("columnCount") ? node.get("columnCount").asInt(0)
                : node.path("columns").isInt() ? node.get("columns").asInt(0)
                : columns.size();
        int columnCount = Math.max(Section.MIN_COLUMNS, Math.min(Section.MAX_COLUMNS, recorded));
        if (columnCount != recorded) {
            warn(warnings, "Section " + section.id + " declared " + recorded + " column(s); using " + columnCount);
        }
        if (columns.size() != columnCount) {
            warn(warnings, "Section " + section.id + " had " + columns.size() + " column(s) for a "
                    + columnCount + "-column layout; columns were adjusted");
        }
        while (columns.size() < columnCount) {
            columns.add(new ArrayList<>());
        }
        while (columns.size() > columnCount) {
            List<Block> extra = columns.remove(columns.size() - 1);
            columns.get(columns.size() - 1).addAll(extra);
        }

        section.columnCount = columnCount;
        for (List<Block> blocks : columns) {
            section.columns.add(new Column(blocks));
        }
        return section;
    }

    private List<Block> readBlocks(JsonNode blocksNode, Set<String> seenIds, List<String> warnings)
            throws RejectedMetadataException {
        List<Block> blocks = new ArrayList<>();
        if (blocksNode == null || !blocksNode.isArray()) {
            return blocks;
        }
        for (JsonNode blockNode : blocksNode) {
            Block block = readBlock(blockNode, warnings);
            if (block.id == null || block.id.isBlank() || !seenIds.add(block.id)) {
                String previous = block.id;
                block.id = BlockDefaults.newId();
                seenIds.add(block.id);
                warn(warnings, (previous == null || previous.isBlank() ? "Block without id" : "Duplicate block id " + previous)
                        + " was given id " + block.id);
            }
            blocks.add(block);
        }
        return blocks;
    }

    Block readBlock(JsonNode node, List<String> warnings) throws RejectedMetadataException {
        if (!node.isObject()) {
            throw new RejectedMetadataException("Round-trip metadata contains a block that is not an object");
        }
        String tag = node.path("type").asText("");
        BlockType type = BlockType.find(tag)
                .orElseThrow(() -> new RejectedMetadataException("Round-trip metadata contains unknown block type '" + tag + "'"));

        ObjectNode defaults = defaultsTree(type);
        defaults.remove("id");
        ObjectNode record = ((ObjectNode) node).deepCopy();
        if (record.has("segments")) {
            record.remove("content");
        } else if (record.hasNonNull("content")) {
            defaults.remove("segments");
        }

        List<String> missing = new ArrayList<>();
        for (Iterator<String> it = defaults.fieldNames(); it.hasNext(); ) {
            String field = it.next();
            if (!field.equals("type") && !record.hasNonNull(field)) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            warn(warnings, "Block " + record.path("id").asText("?") + " (" + tag + ") was missing "
                    + String.join(", ", missing) + "; defaults applied");
        }

        ObjectNode merged = defaults.deepCopy();
        for (Iterator<Map.Entry<String, JsonNode>> it = record.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            if (!field.getValue().isNull()) {
                merged.set(field.getKey(), field.getValue());
            }
        }

        Block block;
        try {
            block = Json.MAPPER.treeToValue(merged, Block.class);
        } catch (JsonProcessingException e) {
            block = readFieldByField(defaults, record, tag, warnings);
        }
        return repair(block, warnings);
    }

    private Block readFieldByField(ObjectNode defaults, ObjectNode record, String tag, List<String> warnings)
            throws RejectedMetadataException {
        ObjectNode accepted = defaults.deepCopy();
        for (Iterator<Map.Entry<String, JsonNode>> it = record.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            if (field.getValue().isNull()) {
                continue;
            }
            ObjectNode candidate = accepted.deepCopy();
            candidate.set(field.getKey(), field.getValue());
            try {
                Json.MAPPER.treeToValue(candidate, Block.class);
                accepted = candidate;
            } catch (JsonProcessingException e) {
                warn(warnings, "Field '" + field.getKey() + "' of block " + record.path("id").asText("?")
                        + " (" + tag + ") could not be read; default kept");
            }
        }
        try {
            return Json.MAPPER.treeToValue(accepted, Block.class);
        } catch (JsonProcessingException e) {
            throw new RejectedMetadataException("Block of type '" + tag + "' could not be restored");
        }
    }

    private Block repair(Block block, List<String> warnings) {
        if (block instanceof HeadingBlock heading
                && (heading.level < HeadingBlock.MIN_LEVEL || heading.level > HeadingBlock.MAX_LEVEL)) {
            int level = Math.max(HeadingBlock.MIN_LEVEL, Math.min(HeadingBlock.MAX_LEVEL, heading.level));
            warn(warnings, "Heading " + heading.id + " had level " + heading.level + "; using " + level);
            heading.level = level;
        }
        if (block instanceof TableBlock table && !table.isRectangular()) {
            table.normalize();
            warn(warnings, "Table " + table.id + " was not rectangular; rows were padded");
        }
        return block;
    }

    private ObjectNode defaultsTree(BlockType type) {
        try {
            Block defaults = BlockDefaults.create(type);
            return (ObjectNode) Json.MAPPER.readTree(Json.MAPPER.writerFor(Block.class).writeValueAsBytes(defaults));
        } catch (IOException e) {
            throw new IllegalStateException("Defaults for " + type.getTag() + " could not be written", e);
        }
    }

    private static void warn(List<String> warnings, String message) {
        LOG.warn(message);
        warnings.add(message);
    }

    static class RejectedMetadataException extends Exception {
        RejectedMetadataException(String message) {
            super(message);
        }
    }
}
