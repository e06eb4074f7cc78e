package org.dxworks.formframe.model.block;

import org.dxworks.formframe.model.BlockType;

public class ImageBlock extends Block {
    public String src = "";
    public String alt = "";
    public String alignment = "center"; // left, center or right
    public int borderRadius;
    public int maxHeight;

    @Override
    public BlockType getType() {
        return BlockType.IMAGE;
    }
}
