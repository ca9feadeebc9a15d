package org.csu.proplogic.engine;

import org.csu.proplogic.common.exception.EvaluationException;
import org.csu.proplogic.compiler.operator.LogicOperator;
import org.csu.proplogic.compiler.operator.OperatorTable;
import org.csu.proplogic.compiler.parser.ast.BinaryExpressionNode;
import org.csu.proplogic.compiler.parser.ast.ConstantNode;
import org.csu.proplogic.compiler.parser.ast.ExpressionNode;
import org.csu.proplogic.compiler.parser.ast.UnaryExpressionNode;
import org.csu.proplogic.compiler.parser.ast.VariableNode;

import java.util.Map;
import java.util.Objects;

/**
 * 表达式求值器。
 * 在给定的变量赋值下递归计算 AST 的布尔值，没有副作用。未赋值的变量按 false 处理。
 */
public class ExpressionEvaluator {

    private final OperatorTable operatorTable;

    public ExpressionEvaluator(OperatorTable operatorTable) {
        this.operatorTable = Objects.requireNonNull(operatorTable, "operatorTable");
    }

    public boolean evaluate(ExpressionNode expression) {
        return evaluate(expression, Map.of());
    }

    /**
     * @param expression 待求值的 AST
     * @param assignment 变量名 -> 布尔值，缺失的变量视为 false
     * @throws EvaluationException 运算符不在运算符表中，或元数与节点形状不符
     */
    public boolean evaluate(ExpressionNode expression, Map<String, Boolean> assignment) {
        if (expression instanceof ConstantNode constant) {
            return constant.value();
        }
        if (expression instanceof VariableNode variable) {
            return Boolean.TRUE.equals(assignment.get(variable.name()));
        }
        if (expression instanceof UnaryExpressionNode node) {
            LogicOperator operator = operatorTable.lookup(node.operator());
            if (!operator.isUnary()) {
                throw new EvaluationException(node.operator(), "Operator '" + node.operator() + "' is not unary");
            }
            return operator.apply(evaluate(node.operand(), assignment));
        }
        if (expression instanceof BinaryExpressionNode node) {
            LogicOperator operator = operatorTable.lookup(node.operator());
            if (!operator.isBinary()) {
                throw new EvaluationException(node.operator(), "Operator '" + node.operator() + "' is not binary");
            }
            boolean leftValue = evaluate(node.left(), assignment);
            boolean rightValue = evaluate(node.right(), assignment);
            return operator.apply(leftValue, rightValue);
        }
        throw new IllegalStateException("Unsupported expression type: "
                + (expression == null ? "null" : expression.getClass().getSimpleName()));
    }
}
