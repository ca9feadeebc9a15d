package org.csu.proplogic.compiler.operator;

/**
 * 运算符的结合形式：前缀一元、左结合中缀、右结合中缀。
 */
public enum Fixity {
    PREFIX,
    INFIX_LEFT,
    INFIX_RIGHT;

    public boolean isInfix() {
        return this != PREFIX;
    }

    /**
     * 计算右操作数允许出现的最松优先级 (数字越小结合越紧)。
     * 左结合时右侧必须严格更紧，右结合时允许同级。
     */
    public int rightOperandLimit(int precedence) {
        return switch (this) {
            case INFIX_LEFT -> precedence - 1;
            case INFIX_RIGHT -> precedence;
            case PREFIX -> throw new IllegalStateException("Prefix operators have no right operand");
        };
    }
}
