package org.csu.proplogic.common.exception;

import org.csu.proplogic.compiler.lexer.Token;
import org.csu.proplogic.compiler.lexer.TokenType;

/**
 * 语法分析阶段的异常。
 */
public class ParseException extends RuntimeException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(Token token, String expected) {
        super(token.type() == TokenType.EOF
                ? String.format("Syntax Error at position %d: Expected %s, but reached end of expression",
                        token.position(), expected)
                : String.format("Syntax Error at position %d: Expected %s, but found '%s' (%s)",
                        token.position(), expected, token.lexeme(), token.type()));
    }
}
