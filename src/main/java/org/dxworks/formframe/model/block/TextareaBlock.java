package org.dxworks.formframe.model.block;

import org.dxworks.formframe.model.BlockType;

public class TextareaBlock extends FormFieldBlock {
    public String placeholder = "";
    public int rows = 4;
    public Integer maxLength; // null when unbounded

    @Override
    public BlockType getType() {
        return BlockType.TEXTAREA;
    }
}
