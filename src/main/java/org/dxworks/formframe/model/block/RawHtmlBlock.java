package org.dxworks.formframe.model.block;

import org.dxworks.formframe.model.BlockType;

/**
 * Escape hatch for markup no other block can represent. {@link #htmlContent} is emitted
 * verbatim on export and is never dropped.
 */
public class RawHtmlBlock extends Block {
    public String htmlContent = "";
    public String originalStyles = "";

    @Override
    public BlockType getType() {
        return BlockType.RAW_HTML;
    }
}
