package org.csu.proplogic.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 真值表中的一行：按列顺序排列的变量赋值以及表达式结果。
 */
public record TruthTableRow(
        Map<String, Boolean> assignment,
        boolean result
) {

    public TruthTableRow {
        assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
    }

    /**
     * @return 按列顺序排列的变量取值
     */
    public List<Boolean> values() {
        return new ArrayList<>(assignment.values());
    }

    public int resultBit() {
        return result ? 1 : 0;
    }
}
