package org.csu.proplogic.compiler.parser.ast;

/**
 * AST 节点: 布尔常量 (TRUE / FALSE)
 */
public record ConstantNode(boolean value) implements ExpressionNode {

    @Override
    public String toString() {
        return value ? "TRUE" : "FALSE";
    }
}
