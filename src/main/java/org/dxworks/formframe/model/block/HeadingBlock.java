package org.dxworks.formframe.model.block;

import org.dxworks.formframe.model.BlockType;

public class HeadingBlock extends TextBlock {
    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 4;

    public int level = 2; // 1-4, rendered as h1..h4

    @Override
    public BlockType getType() {
        return BlockType.HEADING;
    }
}
