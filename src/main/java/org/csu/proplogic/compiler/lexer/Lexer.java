package org.csu.proplogic.compiler.lexer;

import org.csu.proplogic.common.exception.LexException;
import org.csu.proplogic.compiler.operator.LogicOperator;
import org.csu.proplogic.compiler.operator.OperatorTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 词法分析器：将命题逻辑表达式分解为 Token 序列。
 *
 * 输入不区分大小写，扫描前统一转为大写。
 * 不属于 TRUE/FALSE 或运算符关键字的连续字母会被逐个切分为单字母变量，例如 "AB" 得到 A、B 两个变量。
 */
public class Lexer {

    private static final String TRUE_LITERAL = "TRUE";
    private static final String FALSE_LITERAL = "FALSE";

    private final String input;
    private final OperatorTable operatorTable;
    private int position = 0;

    public Lexer(String input, OperatorTable operatorTable) {
        this.input = Objects.requireNonNull(input, "input").toUpperCase(Locale.ROOT);
        this.operatorTable = Objects.requireNonNull(operatorTable, "operatorTable");
    }

    public Lexer(String input) {
        this(input, OperatorTable.standard());
    }

    /**
     * 执行词法分析并返回所有Token，最后一个总是 EOF
     * @return Token列表
     * @throws LexException 遇到无法识别的字符
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return List.copyOf(tokens);
    }

    private Token nextToken() {
        skipWhitespace();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", position);
        }

        char currentChar = input.charAt(position);

        if (currentChar == '(') {
            return consumeAndReturn(TokenType.LPAREN, "(");
        }
        if (currentChar == ')') {
            return consumeAndReturn(TokenType.RPAREN, ")");
        }

        // 布尔常量优先于运算符和变量
        if (input.startsWith(TRUE_LITERAL, position)) {
            return consumeAndReturn(TokenType.CONSTANT, TRUE_LITERAL);
        }
        if (input.startsWith(FALSE_LITERAL, position)) {
            return consumeAndReturn(TokenType.CONSTANT, FALSE_LITERAL);
        }

        // 按运算符表顺序匹配
        for (LogicOperator operator : operatorTable.operators()) {
            if (input.startsWith(operator.getSymbol(), position)) {
                Token token = new Token(TokenType.OPERATOR, operator.getSymbol(), operator, position);
                position += operator.getSymbol().length();
                return token;
            }
        }

        // 按码点判断，辅助平面的字母 (如数学粗体字母) 也是合法变量
        int codePoint = input.codePointAt(position);
        if (Character.isLetter(codePoint)) {
            return consumeAndReturn(TokenType.VARIABLE, Character.toString(codePoint));
        }

        throw new LexException(codePoint, position);
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, position);
        position += lexeme.length();
        return token;
    }
}
