package org.csu.proplogic.engine;

import org.csu.proplogic.compiler.parser.ast.BinaryExpressionNode;
import org.csu.proplogic.compiler.parser.ast.ExpressionNode;
import org.csu.proplogic.compiler.parser.ast.UnaryExpressionNode;
import org.csu.proplogic.compiler.parser.ast.VariableNode;

import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 收集 AST 中出现的全部变量名，结果按字母升序排列 (真值表的默认列顺序)。
 */
public final class VariableExtractor {

    private VariableExtractor() {
    }

    public static SortedSet<String> extract(ExpressionNode expression) {
        SortedSet<String> variables = new TreeSet<>();
        collect(expression, variables);
        return variables;
    }

    private static void collect(ExpressionNode node, SortedSet<String> variables) {
        if (node instanceof VariableNode variable) {
            variables.add(variable.name());
        } else if (node instanceof UnaryExpressionNode unary) {
            collect(unary.operand(), variables);
        } else if (node instanceof BinaryExpressionNode binary) {
            collect(binary.left(), variables);
            collect(binary.right(), variables);
        }
    }
}
