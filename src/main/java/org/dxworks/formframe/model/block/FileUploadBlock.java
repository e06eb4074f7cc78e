package org.dxworks.formframe.model.block;

import org.dxworks.formframe.model.BlockType;

public class FileUploadBlock extends FormFieldBlock {
    public String acceptTypes = "";
    public String maxSize = "";
    public boolean multiple;

    @Override
    public BlockType getType() {
        return BlockType.FILE_UPLOAD;
    }
}
