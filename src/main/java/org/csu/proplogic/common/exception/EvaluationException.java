package org.csu.proplogic.common.exception;

import lombok.Getter;

/**
 * 求值阶段的异常。
 * 运算符表中找不到 AST 节点上的运算符，或运算符的元数与节点形状不符。
 * 这说明语法分析器与运算符表不一致，属于内部错误而不是用户输入错误。
 */
@Getter
public class EvaluationException extends RuntimeException {

    private final String operator;

    public EvaluationException(String operator) {
        this(operator, "Unknown operator '" + operator + "'");
    }

    public EvaluationException(String operator, String message) {
        super(message);
        this.operator = operator;
    }
}
