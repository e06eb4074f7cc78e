package org.dxworks.formframe.model.block;

/**
 * Base of every block that produces a form value under {@link #fieldName}.
 */
public abstract class FormFieldBlock extends Block {
    public String label = "";
    public boolean required;
    public String fieldName = "";
    public String helpText = "";
}
