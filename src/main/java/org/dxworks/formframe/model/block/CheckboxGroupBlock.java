package org.dxworks.formframe.model.block;

import org.dxworks.formframe.model.BlockType;

public class CheckboxGroupBlock extends ChoiceGroupBlock {

    @Override
    public BlockType getType() {
        return BlockType.CHECKBOX_GROUP;
    }
}
