package org.csu.proplogic.compiler.parser.ast;

/**
 * AST 节点: 前缀一元运算 (e.g., NOT P)
 */
public record UnaryExpressionNode(
        String operator,
        ExpressionNode operand
) implements ExpressionNode {

    @Override
    public String toString() {
        return "(" + operator + " " + operand + ")";
    }
}
