package org.csu.proplogic.compiler.lexer;

/**
 * 词法单元（Token）的类型。
 */
public enum TokenType {
    // ---- 操作数 (Operands) ----
    CONSTANT,   // TRUE / FALSE
    VARIABLE,   // 单字母变量, e.g., P

    // ---- 运算符 (Operators) ----
    OPERATOR,   // NOT, AND, XOR, OR, IMP, IFF

    // ---- 括号 (Parentheses) ----
    LPAREN,     // (
    RPAREN,     // )

    // ---- 特殊 Token ----
    EOF;        // 表示输入结束

    public boolean isOperand() {
        return this == CONSTANT || this == VARIABLE;
    }
}
