package org.dxworks.formframe.model.block;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Radio and checkbox groups: a set of options sharing one field name.
 */
public abstract class ChoiceGroupBlock extends ChoiceBlock {
    public Layout layout = Layout.VERTICAL;

    public enum Layout {
        VERTICAL("vertical"),
        HORIZONTAL("horizontal");

        private final String value;

        Layout(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static Layout fromValue(String value) {
            return "horizontal".equalsIgnoreCase(value) ? HORIZONTAL : VERTICAL;
        }
    }
}
