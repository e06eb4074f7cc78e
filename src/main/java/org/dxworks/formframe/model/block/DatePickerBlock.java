package org.dxworks.formframe.model.block;

import org.dxworks.formframe.model.BlockType;

public class DatePickerBlock extends FormFieldBlock {

    @Override
    public BlockType getType() {
        return BlockType.DATE_PICKER;
    }
}
