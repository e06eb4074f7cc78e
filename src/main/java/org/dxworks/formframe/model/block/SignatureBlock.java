package org.dxworks.formframe.model.block;

import org.dxworks.formframe.model.BlockType;

/** Inert signature-capture area; {@link #signatureUrl} is set once a signature was captured. */
public class SignatureBlock extends FormFieldBlock {
    public String signatureUrl = "";

    @Override
    public BlockType getType() {
        return BlockType.SIGNATURE;
    }
}
