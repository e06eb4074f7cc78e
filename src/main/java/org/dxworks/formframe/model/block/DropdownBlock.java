package org.dxworks.formframe.model.block;

import org.dxworks.formframe.model.BlockType;

public class DropdownBlock extends ChoiceBlock {
    public String defaultValue = "";

    @Override
    public BlockType getType() {
        return BlockType.DROPDOWN;
    }
}
