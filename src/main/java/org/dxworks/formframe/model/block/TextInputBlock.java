package org.dxworks.formframe.model.block;

import org.dxworks.formframe.model.BlockType;

public class TextInputBlock extends FormFieldBlock {
    public String placeholder = "";
    public String validationType = "none"; // none, email, phone, number or url
    public Integer maxLength; // null when unbounded

    @Override
    public BlockType getType() {
        return BlockType.TEXT_INPUT;
    }
}
