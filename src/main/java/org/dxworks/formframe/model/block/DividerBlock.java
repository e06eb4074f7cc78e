package org.dxworks.formframe.model.block;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.dxworks.formframe.model.BlockType;

public class DividerBlock extends Block {
    public int thickness = 1;
    public LineStyle style = LineStyle.SOLID;
    public String color = "#000000";

    @Override
    public BlockType getType() {
        return BlockType.DIVIDER;
    }

    public enum LineStyle {
        SOLID("solid"),
        DASHED("dashed"),
        DOTTED("dotted");

        private final String css;

        LineStyle(String css) {
            this.css = css;
        }

        @JsonValue
        public String getCss() {
            return css;
        }

        /** Unknown values fall back to solid. */
        @JsonCreator
        public static LineStyle fromCss(String css) {
            for (LineStyle style : values()) {
                if (style.css.equalsIgnoreCase(css)) {
                    return style;
                }
            }
            return SOLID;
        }
    }
}
