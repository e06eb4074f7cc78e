package org.dxworks.formframe.model.block;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.dxworks.formframe.model.BlockType;

import java.util.ArrayList;
import java.util.List;

public class ListBlock extends Block {
    public ListType listType = ListType.UNORDERED;
    public List<String> items = new ArrayList<>();

    @Override
    public BlockType getType() {
        return BlockType.LIST;
    }

    public enum ListType {
        ORDERED("ordered"),
        UNORDERED("unordered");

        private final String value;

        ListType(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static ListType fromValue(String value) {
            return "ordered".equalsIgnoreCase(value) ? ORDERED : UNORDERED;
        }
    }
}
