package org.csu.proplogic.compiler.lexer;

import org.csu.proplogic.compiler.operator.LogicOperator;

/**
 * @param type     词法单元的类型
 * @param lexeme   词素值 (常量为 TRUE/FALSE，变量为单个大写字母，运算符为其符号)
 * @param operator 运算符 Token 携带的运算符定义，其他类型为 null
 * @param position 在规范化 (大写) 输入中的起始位置
 */
public record Token(TokenType type, String lexeme, LogicOperator operator, int position) {

    public Token(TokenType type, String lexeme, int position) {
        this(type, lexeme, null, position);
    }

    public boolean booleanValue() {
        if (type != TokenType.CONSTANT) {
            throw new IllegalStateException("Token " + this + " is not a boolean constant");
        }
        return Boolean.parseBoolean(lexeme);
    }

    @Override
    public String toString() {
        return String.format("Token[Type=%-8s, Lexeme='%s', Position=%d]", type, lexeme, position);
    }
}
