package org.csu.proplogic.engine;

import lombok.Getter;
import org.csu.proplogic.common.exception.TooManyVariablesException;
import org.csu.proplogic.compiler.parser.ast.ExpressionNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 真值表生成器。
 * 对 n 个变量按 0 .. 2^n-1 的二进制计数枚举全部赋值，列表中第一个变量对应最高位 (变化最慢)。
 */
public class TruthTableEnumerator {

    // int 计数器的上限
    public static final int HARD_VARIABLE_LIMIT = 30;

    private final ExpressionEvaluator evaluator;
    @Getter
    private final int maxVariables;

    public TruthTableEnumerator(ExpressionEvaluator evaluator, int maxVariables) {
        if (maxVariables < 0 || maxVariables > HARD_VARIABLE_LIMIT) {
            throw new IllegalArgumentException("maxVariables must be between 0 and " + HARD_VARIABLE_LIMIT
                    + ", got " + maxVariables);
        }
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.maxVariables = maxVariables;
    }

    /**
     * 以字母顺序作为列顺序生成真值表。
     */
    public TruthTable enumerate(ExpressionNode expression) {
        return enumerate(expression, new ArrayList<>(VariableExtractor.extract(expression)));
    }

    /**
     * @param expression       表达式 AST
     * @param orderedVariables 列顺序；为空时返回没有任何行的表，调用方应直接求值一次
     * @throws TooManyVariablesException 变量个数超过 maxVariables
     * @throws IllegalArgumentException   列名重复
     */
    public TruthTable enumerate(ExpressionNode expression, List<String> orderedVariables) {
        int n = orderedVariables.size();
        if (n > maxVariables) {
            throw new TooManyVariablesException(n, maxVariables);
        }
        if (new HashSet<>(orderedVariables).size() != n) {
            throw new IllegalArgumentException("Duplicate variable in ordering: " + orderedVariables);
        }

        List<TruthTableRow> rows = new ArrayList<>();
        if (n == 0) {
            return new TruthTable(orderedVariables, rows);
        }

        int combinations = 1 << n;
        for (int i = 0; i < combinations; i++) {
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            for (int k = 0; k < n; k++) {
                assignment.put(orderedVariables.get(k), ((i >> (n - 1 - k)) & 1) == 1);
            }
            rows.add(new TruthTableRow(assignment, evaluator.evaluate(expression, assignment)));
        }
        return new TruthTable(orderedVariables, rows);
    }
}
