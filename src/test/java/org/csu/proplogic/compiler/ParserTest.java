package org.csu.proplogic.compiler;

import org.csu.proplogic.common.exception.ParseException;
import org.csu.proplogic.compiler.lexer.Lexer;
import org.csu.proplogic.compiler.lexer.Token;
import org.csu.proplogic.compiler.lexer.TokenType;
import org.csu.proplogic.compiler.parser.Parser;
import org.csu.proplogic.compiler.parser.ast.BinaryExpressionNode;
import org.csu.proplogic.compiler.parser.ast.ConstantNode;
import org.csu.proplogic.compiler.parser.ast.ExpressionNode;
import org.csu.proplogic.compiler.parser.ast.UnaryExpressionNode;
import org.csu.proplogic.compiler.parser.ast.VariableNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 类的单元测试
 */
public class ParserTest {

    private ExpressionNode parse(String input) {
        return parse(input, false);
    }

    private ExpressionNode parse(String input, boolean strict) {
        System.out.println("Input: " + input);
        List<Token> tokens = new Lexer(input).tokenize();
        ExpressionNode ast = new Parser(tokens, strict).parse();
        System.out.println("Generated AST: " + ast);
        return ast;
    }

    @Test
    void testAndBindsTighterThanOr() {
        System.out.println("--- Running test: testAndBindsTighterThanOr ---");
        assertEquals("((A AND B) OR C)", parse("A AND B OR C").toString());
        assertEquals("(A OR (B AND C))", parse("A OR B AND C").toString());
    }

    @Test
    void testEqualPrecedenceGroupsLeftToRight() {
        assertEquals("((A IMP B) IMP C)", parse("A IMP B IMP C").toString());
        assertEquals("((A AND B) AND C)", parse("A AND B AND C").toString());
        assertEquals("((A IFF B) IFF C)", parse("A IFF B IFF C").toString());
    }

    @Test
    void testFullPrecedenceLadder() {
        assertEquals("(A IFF (B IMP (C OR (D XOR (E AND F)))))",
                parse("A IFF B IMP C OR D XOR E AND F").toString());
        assertEquals("(((((A AND B) XOR C) OR D) IMP E) IFF F)",
                parse("A AND B XOR C OR D IMP E IFF F").toString());
    }

    @Test
    void testNotIsPrefixAndBindsTightest() {
        assertEquals("(NOT (NOT A))", parse("NOT NOT A").toString());
        assertEquals("((NOT A) OR B)", parse("NOT A OR B").toString());
        assertEquals("(NOT (A AND B))", parse("NOT (A AND B)").toString());

        ExpressionNode node = parse("NOT P");
        assertInstanceOf(UnaryExpressionNode.class, node);
        assertEquals("NOT", ((UnaryExpressionNode) node).operator());
        assertEquals(new VariableNode("P"), ((UnaryExpressionNode) node).operand());
    }

    @Test
    void testParenthesesOverridePrecedence() {
        ExpressionNode node = parse("A AND (B OR C)");
        assertInstanceOf(BinaryExpressionNode.class, node);
        BinaryExpressionNode and = (BinaryExpressionNode) node;
        assertEquals("AND", and.operator());
        assertEquals(new VariableNode("A"), and.left());
        assertEquals("(B OR C)", and.right().toString());

        assertEquals("((A XOR B) IFF C)", parse("(A XOR B) IFF C").toString());
        assertEquals("A", parse("((A))").toString());
    }

    @Test
    void testConstantsBecomeLeaves() {
        assertEquals(new ConstantNode(true), parse("TRUE"));
        assertEquals("(TRUE AND FALSE)", parse("true and false").toString());
    }

    @Test
    void testMalformedExpressionsRaiseParseException() {
        System.out.println("--- Running test: testMalformedExpressionsRaiseParseException ---");
        for (String input : List.of("", "   ", ")", "A AND", "AND A", "A B", "A AN", "A NOT B", "A)", "()", "NOT")) {
            ParseException e = assertThrows(ParseException.class, () -> parse(input), "should reject: '" + input + "'");
            System.out.println("Caught expected exception: " + e.getMessage());
        }
    }

    @Test
    void testMissingClosingParenthesisIsToleratedByDefault() {
        assertEquals("(A AND B)", parse("(A AND B").toString());
        assertEquals("(A OR (B AND C))", parse("(A OR B AND C").toString());
        assertEquals("A", parse("((A").toString());
    }

    @Test
    void testStrictModeRejectsUnterminatedGroup() {
        ParseException e = assertThrows(ParseException.class, () -> parse("(A AND B", true));
        assertTrue(e.getMessage().contains("')'"));
        assertEquals("(A AND B)", parse("(A AND B)", true).toString());
    }

    @Test
    void testParserDoesNotModifyTokenList() {
        List<Token> tokens = new Lexer("A OR B").tokenize();
        new Parser(tokens).parse();
        assertEquals(4, tokens.size());
        assertEquals(TokenType.VARIABLE, tokens.get(0).type());
    }

    @Test
    void testNestingDepthIsLimited() {
        System.out.println("--- Running test: testNestingDepthIsLimited ---");
        List<Token> nots = new Lexer("NOT ".repeat(200_000) + "A").tokenize();
        ParseException e = assertThrows(ParseException.class, () -> new Parser(nots).parse());
        System.out.println("Caught expected exception: " + e.getMessage());
        assertTrue(e.getMessage().contains("nested too deeply (limit is " + Parser.DEFAULT_MAX_DEPTH + ")"));

        List<Token> groups = new Lexer("(".repeat(200_000) + "TRUE").tokenize();
        assertThrows(ParseException.class, () -> new Parser(groups).parse());

        // 二元运算符链构成的左深树同样计入深度
        List<Token> chain = new Lexer("A" + " OR A".repeat(5)).tokenize();
        assertThrows(ParseException.class, () -> new Parser(chain, false, 4).parse());
        assertEquals("((((A OR A) OR A) OR A) OR A)",
                new Parser(new Lexer("A" + " OR A".repeat(4)).tokenize(), false, 4).parse().toString());

        // 括号和 NOT 共享同一个计数
        assertEquals("(NOT (NOT A))", new Parser(new Lexer("((NOT NOT A))").tokenize(), false, 4).parse().toString());
        ParseException mixed = assertThrows(ParseException.class,
                () -> new Parser(new Lexer("((NOT (NOT A)))").tokenize(), false, 4).parse());
        assertTrue(mixed.getMessage().startsWith("Syntax Error at position 7"));
    }

    @Test
    void testTokenListWithoutEofIsRejected() {
        List<Token> tokens = List.of(new Token(TokenType.VARIABLE, "A", 0));
        assertThrows(IllegalArgumentException.class, () -> new Parser(tokens));
        assertThrows(IllegalArgumentException.class, () -> new Parser(new Lexer("A").tokenize(), false, 0));
    }
}
