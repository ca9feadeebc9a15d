package org.csu.proplogic.compiler.parser.ast;

/**
 * AST 节点: 单字母命题变量 (e.g., P)
 */
public record VariableNode(String name) implements ExpressionNode {

    @Override
    public String toString() {
        return name;
    }
}
