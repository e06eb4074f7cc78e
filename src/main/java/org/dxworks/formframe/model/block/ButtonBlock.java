package org.dxworks.formframe.model.block;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.dxworks.formframe.model.BlockType;

public class ButtonBlock extends Block {
    public String label = "";
    public ButtonType buttonType = ButtonType.SUBMIT;
    public Variant variant = Variant.PRIMARY;

    @Override
    public BlockType getType() {
        return BlockType.BUTTON;
    }

    public enum ButtonType {
        BUTTON("button"),
        SUBMIT("submit"),
        RESET("reset");

        private final String value;

        ButtonType(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static ButtonType fromValue(String value) {
            for (ButtonType type : values()) {
                if (type.value.equalsIgnoreCase(value)) {
                    return type;
                }
            }
            return SUBMIT;
        }
    }

    public enum Variant {
        PRIMARY("primary", "background-color: #3b82f6; color: white; border: none;"),
        SECONDARY("secondary", "background-color: #f1f5f9; color: #1e293b; border: none;"),
        OUTLINE("outline", "background-color: transparent; color: #1e293b; border: 1px solid #e2e8f0;");

        private final String value;
        private final String css;

        Variant(String value, String css) {
            this.value = value;
            this.css = css;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        public String getCss() {
            return css;
        }

        @JsonCreator
        public static Variant fromValue(String value) {
            for (Variant variant : values()) {
                if (variant.value.equalsIgnoreCase(value)) {
                    return variant;
                }
            }
            return PRIMARY;
        }
    }
}
