package com.maxdemarzi.minilogic.show;

import com.maxdemarzi.minilogic.quine.ExpressionedTruthTable;
import com.maxdemarzi.minilogic.results.TruthTableRow;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays a truth table out as a markdown table:
 * <pre>
 * | A B | (A and B) |
 * | --- | --------- |
 * | 00  | 0         |
 * </pre>
 */
public final class TruthTableRenderer {

    private TruthTableRenderer() {
    }

    public static String render(ExpressionedTruthTable table, String title) {
        List<String[]> cells = new ArrayList<>();
        cells.add(new String[]{String.join(" ", table.getVariableNames()), title});
        for (TruthTableRow row : table.getRows()) {
            cells.add(new String[]{row.inputs, row.output.toString()});
        }

        // Widths come from the widest cell in each column
        int[] widths = new int[2];
        for (String[] row : cells) {
            for (int i = 0; i < widths.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }
        for (int i = 0; i < widths.length; i++) {
            widths[i] = Math.max(widths[i], 1);
        }

        StringBuilder out = new StringBuilder();
        appendRow(out, cells.get(0), widths);
        out.append('\n');
        appendRow(out, new String[]{StringUtils.repeat('-', widths[0]), StringUtils.repeat('-', widths[1])}, widths);
        for (String[] row : cells.subList(1, cells.size())) {
            out.append('\n');
            appendRow(out, row, widths);
        }
        return out.toString();
    }

    private static void appendRow(StringBuilder out, String[] row, int[] widths) {
        out.append('|');
        for (int i = 0; i < row.length; i++) {
            out.append(' ').append(StringUtils.rightPad(row[i], widths[i])).append(" |");
        }
    }
}
