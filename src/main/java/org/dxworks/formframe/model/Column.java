package org.dxworks.formframe.model;

import org.dxworks.formframe.model.block.Block;

import java.util.ArrayList;
import java.util.List;

public class Column {
    public List<Block> blocks = new ArrayList<>();

    public Column() {
    }

    public Column(List<Block> blocks) {
        this.blocks = new ArrayList<>(blocks);
    }
}
