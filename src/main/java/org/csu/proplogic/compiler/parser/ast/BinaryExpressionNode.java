package org.csu.proplogic.compiler.parser.ast;

/**
 * AST 节点: 二元运算 (e.g., P AND Q)
 */
public record BinaryExpressionNode(
        ExpressionNode left,
        String operator,
        ExpressionNode right
) implements ExpressionNode {

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
