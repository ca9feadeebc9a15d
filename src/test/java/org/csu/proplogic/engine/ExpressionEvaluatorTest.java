package org.csu.proplogic.engine;

import org.csu.proplogic.common.exception.EvaluationException;
import org.csu.proplogic.compiler.lexer.Lexer;
import org.csu.proplogic.compiler.operator.LogicOperator;
import org.csu.proplogic.compiler.operator.OperatorTable;
import org.csu.proplogic.compiler.parser.Parser;
import org.csu.proplogic.compiler.parser.ast.BinaryExpressionNode;
import org.csu.proplogic.compiler.parser.ast.ConstantNode;
import org.csu.proplogic.compiler.parser.ast.ExpressionNode;
import org.csu.proplogic.compiler.parser.ast.UnaryExpressionNode;
import org.csu.proplogic.compiler.parser.ast.VariableNode;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionEvaluatorTest {

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator(OperatorTable.standard());

    private ExpressionNode compile(String expression) {
        return new Parser(new Lexer(expression).tokenize()).parse();
    }

    private static String literal(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    @Test
    void testConstantExpressionsFollowPlainBooleanLogic() {
        System.out.println("--- Test: constant-only expressions ---");
        boolean[] values = {false, true};
        for (boolean a : values) {
            assertEquals(!a, evaluator.evaluate(compile("NOT " + literal(a))));
            for (boolean b : values) {
                String l = literal(a);
                String r = literal(b);
                assertEquals(a && b, evaluator.evaluate(compile(l + " AND " + r)), l + " AND " + r);
                assertEquals(a ^ b, evaluator.evaluate(compile(l + " XOR " + r)), l + " XOR " + r);
                assertEquals(a || b, evaluator.evaluate(compile(l + " OR " + r)), l + " OR " + r);
                assertEquals(!a || b, evaluator.evaluate(compile(l + " IMP " + r)), l + " IMP " + r);
                assertEquals(a == b, evaluator.evaluate(compile(l + " IFF " + r)), l + " IFF " + r);
            }
        }
    }

    @Test
    void testVariableAssignment() {
        ExpressionNode ast = compile("A AND B");
        assertFalse(evaluator.evaluate(ast, Map.of("A", true, "B", false)));
        assertTrue(evaluator.evaluate(ast, Map.of("A", true, "B", true)));
    }

    @Test
    void testNotOrWithAllFalse() {
        assertTrue(evaluator.evaluate(compile("NOT A OR B"), Map.of("A", false, "B", false)));
    }

    @Test
    void testUnassignedVariablesDefaultToFalse() {
        assertFalse(evaluator.evaluate(compile("P")));
        assertFalse(evaluator.evaluate(compile("P"), Map.of("Q", true)));
        assertTrue(evaluator.evaluate(compile("NOT P")));

        Map<String, Boolean> withNull = new HashMap<>();
        withNull.put("P", null);
        assertFalse(evaluator.evaluate(compile("P"), withNull));
    }

    @Test
    void testLowerCaseInputUsesUpperCaseNames() {
        assertTrue(evaluator.evaluate(compile("p imp q"), Map.of("P", true, "Q", true)));
        assertFalse(evaluator.evaluate(compile("p imp q"), Map.of("P", true)));
    }

    @Test
    void testEvaluationIsRepeatable() {
        ExpressionNode ast = compile("(A XOR B) IFF NOT C");
        Map<String, Boolean> assignment = Map.of("A", true, "C", false);
        boolean first = evaluator.evaluate(ast, assignment);
        assertEquals(first, evaluator.evaluate(ast, assignment));
        assertTrue(first);
    }

    @Test
    void testUnknownOperatorRaisesEvaluationException() {
        ExpressionNode nand = new BinaryExpressionNode(new ConstantNode(true), "NAND", new ConstantNode(false));
        EvaluationException e = assertThrows(EvaluationException.class, () -> evaluator.evaluate(nand));
        assertEquals("NAND", e.getOperator());

        ExpressionEvaluator restricted = new ExpressionEvaluator(
                new OperatorTable(List.of(LogicOperator.NOT, LogicOperator.AND)));
        assertThrows(EvaluationException.class, () -> restricted.evaluate(compile("A XOR B")));
        assertTrue(restricted.evaluate(compile("NOT FALSE AND TRUE")));
    }

    @Test
    void testArityMismatchRaisesEvaluationException() {
        ExpressionNode unaryAnd = new UnaryExpressionNode("AND", new VariableNode("A"));
        assertThrows(EvaluationException.class, () -> evaluator.evaluate(unaryAnd));

        ExpressionNode binaryNot = new BinaryExpressionNode(new VariableNode("A"), "NOT", new VariableNode("B"));
        assertThrows(EvaluationException.class, () -> evaluator.evaluate(binaryNot));
    }
}
