package org.dxworks.formframe.model.block;

import org.dxworks.formframe.model.BlockType;

public class ParagraphBlock extends TextBlock {

    @Override
    public BlockType getType() {
        return BlockType.PARAGRAPH;
    }
}
