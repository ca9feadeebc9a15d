package org.csu.proplogic.compiler.parser.ast;

/**
 * 命题表达式 AST 节点的标记接口。
 * 节点都是不可变的 record，toString() 输出完全加括号的形式，便于调试和测试。
 */
public interface ExpressionNode {
}
