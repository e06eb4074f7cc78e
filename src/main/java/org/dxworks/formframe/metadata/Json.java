package org.dxworks.formframe.metadata;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.formframe.model.FormDocument;
import org.dxworks.formframe.model.Section;
import org.dxworks.formframe.model.block.Block;

import java.io.IOException;
import java.util.List;

/**
 * The shared Jackson mapper for the document model, plus deep copies built on it.
 */
public final class Json {

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private Json() {
        // utility class
    }

    public static List<Section> copySections(List<Section> sections) {
        return copy(new FormDocument(sections)).sections;
    }

    public static FormDocument copy(FormDocument document) {
        try {
            return MAPPER.readValue(MAPPER.writeValueAsBytes(document), FormDocument.class);
        } catch (IOException e) {
            throw new IllegalStateException("Document could not be copied", e);
        }
    }

    public static Block copy(Block block) {
        try {
            return MAPPER.readValue(MAPPER.writerFor(Block.class).writeValueAsBytes(block), Block.class);
        } catch (IOException e) {
            throw new IllegalStateException("Block " + block.id + " could not be copied", e);
        }
    }

    public static String write(FormDocument document) throws JsonProcessingException {
        return MAPPER.writeValueAsString(document);
    }
}
