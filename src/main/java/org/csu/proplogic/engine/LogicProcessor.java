package org.csu.proplogic.engine;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.csu.proplogic.cli.tool.TruthTableFormatter;
import org.csu.proplogic.common.exception.EvaluationException;
import org.csu.proplogic.common.exception.LexException;
import org.csu.proplogic.common.exception.ParseException;
import org.csu.proplogic.common.exception.TooManyVariablesException;
import org.csu.proplogic.compiler.lexer.Lexer;
import org.csu.proplogic.compiler.lexer.Token;
import org.csu.proplogic.compiler.operator.OperatorTable;
import org.csu.proplogic.compiler.parser.Parser;
import org.csu.proplogic.compiler.parser.ast.ExpressionNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * 命题表达式处理入口：词法分析 -> 语法分析 -> 求值 / 真值表。
 */
@Slf4j
public class LogicProcessor {

    @Getter
    private final OperatorTable operatorTable;
    private final ExpressionEvaluator evaluator;
    @Getter
    private final TruthTableEnumerator enumerator;
    private final boolean strictParentheses;
    @Getter
    private final int maxDepth;

    public LogicProcessor(OperatorTable operatorTable, int maxVariables, boolean strictParentheses, int maxDepth) {
        this.operatorTable = operatorTable;
        this.evaluator = new ExpressionEvaluator(operatorTable);
        this.enumerator = new TruthTableEnumerator(evaluator, maxVariables);
        this.strictParentheses = strictParentheses;
        this.maxDepth = maxDepth;
    }

    public LogicProcessor(OperatorTable operatorTable, int maxVariables, boolean strictParentheses) {
        this(operatorTable, maxVariables, strictParentheses, Parser.DEFAULT_MAX_DEPTH);
    }

    public LogicProcessor() {
        this(OperatorTable.standard(), 16, false);
    }

    /**
     * 将表达式文本编译为 AST。
     * @throws LexException   出现无法识别的字符
     * @throws ParseException 表达式不符合语法或嵌套过深
     */
    public ExpressionNode compile(String expression) {
        List<Token> tokens = new Lexer(expression, operatorTable).tokenize();
        log.debug("Tokens: {}", tokens);
        ExpressionNode ast = new Parser(tokens, strictParentheses, maxDepth).parse();
        log.debug("AST: {}", ast);
        return ast;
    }

    public boolean evaluate(String expression, Map<String, Boolean> assignment) {
        return evaluator.evaluate(compile(expression), assignment);
    }

    /**
     * 不含变量的表达式直接求值一次，否则按变量字母顺序生成真值表。
     */
    public CalculationResult calculate(String expression) {
        ExpressionNode ast = compile(expression);
        SortedSet<String> variables = VariableExtractor.extract(ast);
        if (variables.isEmpty()) {
            return CalculationResult.newValueResult(evaluator.evaluate(ast));
        }
        return CalculationResult.newTableResult(enumerator.enumerate(ast, new ArrayList<>(variables)));
    }

    /**
     * 计算表达式并返回可直接打印的文本，错误信息以 "Err: " 开头。
     */
    public String executeAndGetResult(String expression) {
        try {
            CalculationResult result = calculate(expression);
            if (result.isTable()) {
                return TruthTableFormatter.format(result.truthTable());
            }
            return "Result: " + (result.value() ? "TRUE" : "FALSE");
        } catch (LexException | ParseException | TooManyVariablesException e) {
            return "Err: " + e.getMessage();
        } catch (EvaluationException e) {
            log.error("Internal error while evaluating '{}'", expression, e);
            return "Err: " + e.getMessage();
        }
    }
}
