package org.dxworks.formframe.model.block;

import org.dxworks.formframe.model.BlockType;

public class RadioGroupBlock extends ChoiceGroupBlock {

    @Override
    public BlockType getType() {
        return BlockType.RADIO_GROUP;
    }
}
