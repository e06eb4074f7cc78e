package org.dxworks.formframe.model.block;

import java.util.ArrayList;
import java.util.List;

public abstract class ChoiceBlock extends FormFieldBlock {
    public List<String> options = new ArrayList<>();
}
