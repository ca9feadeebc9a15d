package org.csu.proplogic.engine;

import java.util.List;

/**
 * 完整的真值表。
 *
 * @param variables 列顺序 (即表头)
 * @param rows      2^n 行，第一个变量变化最慢
 */
public record TruthTable(
        List<String> variables,
        List<TruthTableRow> rows
) {

    public TruthTable {
        variables = List.copyOf(variables);
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    public TruthTableRow getRow(int index) {
        return rows.get(index);
    }
}
