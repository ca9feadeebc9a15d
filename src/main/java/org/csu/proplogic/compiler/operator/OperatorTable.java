package org.csu.proplogic.compiler.operator;

import org.csu.proplogic.common.exception.EvaluationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 只读的运算符表：符号 -> 运算符。
 * 由词法分析器 (识别符号) 和求值器 (取求值函数) 共享，构造后不可修改，可跨线程共享。
 */
public final class OperatorTable {

    private static volatile OperatorTable standard;

    private final Map<String, LogicOperator> operators;

    public OperatorTable(Collection<LogicOperator> operators) {
        Map<String, LogicOperator> map = new LinkedHashMap<>();
        for (LogicOperator operator : operators) {
            if (map.putIfAbsent(operator.getSymbol(), operator) != null) {
                throw new IllegalArgumentException("Duplicate operator symbol: " + operator.getSymbol());
            }
        }
        this.operators = Collections.unmodifiableMap(map);
    }

    /**
     * 标准运算符表 (NOT, AND, XOR, OR, IMP, IFF)，首次使用时构造。
     */
    public static OperatorTable standard() {
        OperatorTable table = standard;
        if (table == null) {
            synchronized (OperatorTable.class) {
                table = standard;
                if (table == null) {
                    table = new OperatorTable(List.of(LogicOperator.values()));
                    standard = table;
                }
            }
        }
        return table;
    }

    public Optional<LogicOperator> find(String symbol) {
        return Optional.ofNullable(operators.get(symbol));
    }

    public LogicOperator lookup(String symbol) {
        LogicOperator operator = operators.get(symbol);
        if (operator == null) {
            throw new EvaluationException(symbol);
        }
        return operator;
    }

    /**
     * @return 按匹配顺序排列的全部运算符
     */
    public Collection<LogicOperator> operators() {
        return operators.values();
    }

    public List<String> symbols() {
        return List.copyOf(operators.keySet());
    }
}
