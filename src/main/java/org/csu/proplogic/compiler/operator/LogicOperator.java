package org.csu.proplogic.compiler.operator;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

/**
 * 逻辑运算符定义：符号、优先级 (数字越小结合越紧)、结合形式以及求值函数。
 * 声明顺序即词法分析时的匹配顺序。
 */
@Getter
public enum LogicOperator {
    NOT("NOT", 1, a -> !a),
    AND("AND", 2, (a, b) -> a && b),
    XOR("XOR", 3, (a, b) -> !a.equals(b)),
    OR("OR", 4, (a, b) -> a || b),
    IMP("IMP", 5, (a, b) -> !a || b),
    IFF("IFF", 6, (a, b) -> a.equals(b));

    private final String symbol;
    private final int precedence;
    private final Fixity fixity;

    @Getter(AccessLevel.NONE)
    private final UnaryOperator<Boolean> unaryFunction;
    @Getter(AccessLevel.NONE)
    private final BinaryOperator<Boolean> binaryFunction;

    LogicOperator(String symbol, int precedence, UnaryOperator<Boolean> unaryFunction) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.fixity = Fixity.PREFIX;
        this.unaryFunction = unaryFunction;
        this.binaryFunction = null;
    }

    LogicOperator(String symbol, int precedence, BinaryOperator<Boolean> binaryFunction) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.fixity = Fixity.INFIX_LEFT;
        this.unaryFunction = null;
        this.binaryFunction = binaryFunction;
    }

    public boolean isUnary() {
        return unaryFunction != null;
    }

    public boolean isBinary() {
        return binaryFunction != null;
    }

    public boolean apply(boolean operand) {
        if (!isUnary()) {
            throw new IllegalStateException("Operator " + symbol + " is not unary");
        }
        return unaryFunction.apply(operand);
    }

    public boolean apply(boolean left, boolean right) {
        if (!isBinary()) {
            throw new IllegalStateException("Operator " + symbol + " is not binary");
        }
        return binaryFunction.apply(left, right);
    }
}
