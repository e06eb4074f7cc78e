package org.dxworks.formframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.formframe.model.BlockDefaults;
import org.dxworks.formframe.model.BlockType;
import org.dxworks.formframe.model.FormDocument;
import org.dxworks.formframe.model.Placeholders;
import org.dxworks.formframe.model.Section;
import org.dxworks.formframe.model.block.Block;
import org.dxworks.formframe.model.block.HeadingBlock;
import org.dxworks.formframe.model.block.ParagraphBlock;

import java.util.List;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static String json(List<Section> sections) throws JsonProcessingException {
        return APPROVAL_MAPPER.writeValueAsString(new FormDocument(sections));
    }

    public static HeadingBlock heading(String id, String text) {
        HeadingBlock block = BlockDefaults.create(BlockType.HEADING, HeadingBlock.class);
        block.id = id;
        block.segments = Placeholders.segment(text);
        return block;
    }

    public static ParagraphBlock paragraph(String id, String text) {
        ParagraphBlock block = BlockDefaults.create(BlockType.PARAGRAPH, ParagraphBlock.class);
        block.id = id;
        block.segments = Placeholders.segment(text);
        return block;
    }

    /** A section with one column per argument. */
    @SafeVarargs
    public static Section section(String id, List<Block>... columns) {
        Section section = Section.create(columns.length);
        section.id = id;
        for (int i = 0; i < columns.length; i++) {
            section.column(i).blocks.addAll(columns[i]);
        }
        return section;
    }
}
