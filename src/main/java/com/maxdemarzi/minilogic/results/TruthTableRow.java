package com.maxdemarzi.minilogic.results;

import com.maxdemarzi.minilogic.ast.Bit;

public class TruthTableRow {
    public final String inputs;
    public final Bit output;

    public TruthTableRow(String inputs, Bit output) {
        this.inputs = inputs;
        this.output = output;
    }

    @Override
    public String toString() {
        return inputs + " " + output;
    }
}
