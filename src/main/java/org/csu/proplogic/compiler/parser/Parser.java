package org.csu.proplogic.compiler.parser;

import org.csu.proplogic.common.exception.ParseException;
import org.csu.proplogic.compiler.lexer.Token;
import org.csu.proplogic.compiler.lexer.TokenType;
import org.csu.proplogic.compiler.operator.LogicOperator;
import org.csu.proplogic.compiler.parser.ast.BinaryExpressionNode;
import org.csu.proplogic.compiler.parser.ast.ConstantNode;
import org.csu.proplogic.compiler.parser.ast.ExpressionNode;
import org.csu.proplogic.compiler.parser.ast.UnaryExpressionNode;
import org.csu.proplogic.compiler.parser.ast.VariableNode;

import java.util.List;

/**
 * 语法分析器
 * 采用优先级爬升的递归下降法，将Token流转换为抽象语法树(AST)。
 *
 * 优先级数字越小结合越紧；同级的中缀运算符从左到右结合；前缀运算符 (NOT) 只作用于紧随其后的基本表达式。
 * 嵌套深度 (括号、前缀运算符以及生成的语法树高度) 不得超过 maxDepth，后续的求值同样是递归实现。
 * Token 列表本身不会被修改，只移动内部游标。
 */
public class Parser {

    // 顶层和括号内部允许任意优先级
    private static final int LOOSEST = Integer.MAX_VALUE;

    public static final int DEFAULT_MAX_DEPTH = 1000;

    private final List<Token> tokens;
    private final boolean strictParentheses;
    private final int maxDepth;
    private int position = 0;
    // 当前尚未结束的 '(' 与前缀运算符个数
    private int nesting = 0;

    /**
     * @param tokens            以 EOF 结尾的 Token 列表
     * @param strictParentheses 为 true 时缺少 ')' 视为语法错误，否则在输入末尾隐式闭合
     * @param maxDepth          允许的最大嵌套深度
     */
    public Parser(List<Token> tokens, boolean strictParentheses, int maxDepth) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must be terminated by EOF");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.tokens = List.copyOf(tokens);
        this.strictParentheses = strictParentheses;
        this.maxDepth = maxDepth;
    }

    public Parser(List<Token> tokens, boolean strictParentheses) {
        this(tokens, strictParentheses, DEFAULT_MAX_DEPTH);
    }

    public Parser(List<Token> tokens) {
        this(tokens, false);
    }

    public ExpressionNode parse() {
        if (isAtEnd()) {
            throw new ParseException(peek(), "an expression");
        }
        Subtree expression = parseOperator(LOOSEST);
        if (!isAtEnd()) {
            throw new ParseException(peek(), "an infix operator or end of expression");
        }
        return expression.node();
    }

    /**
     * 解析一个表达式，只吸收优先级不超过 limit 的中缀运算符。
     */
    private Subtree parseOperator(int limit) {
        Subtree left = parsePrimary();
        while (checkInfixOperator(limit)) {
            Token operatorToken = advance();
            LogicOperator operator = operatorToken.operator();
            Subtree right = parseOperator(operator.getFixity().rightOperandLimit(operator.getPrecedence()));
            left = subtree(new BinaryExpressionNode(left.node(), operator.getSymbol(), right.node()),
                    Math.max(left.depth(), right.depth()) + 1, operatorToken);
        }
        return left;
    }

    private Subtree parsePrimary() {
        Token token = peek();
        switch (token.type()) {
            case CONSTANT -> {
                advance();
                return new Subtree(new ConstantNode(token.booleanValue()), 0);
            }
            case VARIABLE -> {
                advance();
                return new Subtree(new VariableNode(token.lexeme()), 0);
            }
            case LPAREN -> {
                enter(token);
                advance();
                Subtree expr = parseOperator(LOOSEST);
                if (check(TokenType.RPAREN)) {
                    advance();
                } else if (strictParentheses) {
                    throw new ParseException(peek(), "')' to close the group opened at position " + token.position());
                }
                nesting--;
                return expr;
            }
            case OPERATOR -> {
                if (!token.operator().getFixity().isInfix()) {
                    enter(token);
                    advance();
                    Subtree operand = parsePrimary();
                    nesting--;
                    return subtree(new UnaryExpressionNode(token.operator().getSymbol(), operand.node()),
                            operand.depth() + 1, token);
                }
            }
            default -> {
            }
        }
        throw new ParseException(token, "an operand, '(' or a prefix operator");
    }

    // --- 深度检查 ---

    private void enter(Token token) {
        if (++nesting > maxDepth) {
            throw tooDeep(token);
        }
    }

    private Subtree subtree(ExpressionNode node, int depth, Token token) {
        if (depth > maxDepth) {
            throw tooDeep(token);
        }
        return new Subtree(node, depth);
    }

    private ParseException tooDeep(Token token) {
        return new ParseException(String.format(
                "Syntax Error at position %d: Expression nested too deeply (limit is %d)", token.position(), maxDepth));
    }

    private boolean checkInfixOperator(int limit) {
        if (!check(TokenType.OPERATOR)) return false;
        LogicOperator operator = peek().operator();
        return operator.getFixity().isInfix() && operator.getPrecedence() <= limit;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        Token token = peek();
        if (!isAtEnd()) position++;
        return token;
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    // 语法树节点及其高度，叶子为 0
    private record Subtree(ExpressionNode node, int depth) {
    }
}
