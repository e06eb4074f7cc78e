package org.dxworks.formframe.model.block;

import org.dxworks.formframe.model.BlockType;

/** An agreement checkbox; the label may carry placeholder tokens. */
public class SingleCheckboxBlock extends FormFieldBlock {

    @Override
    public BlockType getType() {
        return BlockType.SINGLE_CHECKBOX;
    }
}
