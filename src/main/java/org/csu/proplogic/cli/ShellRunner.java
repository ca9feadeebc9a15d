package org.csu.proplogic.cli;

import lombok.RequiredArgsConstructor;
import org.csu.proplogic.compiler.operator.OperatorTable;
import org.csu.proplogic.config.PropLogicProperties;
import org.csu.proplogic.engine.LogicProcessor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * 启动入口：命令行参数中的表达式逐个求值后退出，没有参数时进入交互模式。
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "proplogic.shell", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ShellRunner implements CommandLineRunner {

    private final LogicProcessor processor;
    private final OperatorTable operatorTable;
    private final PropLogicProperties properties;

    @Override
    public void run(String... args) throws Exception {
        // 以 -- 开头的是 Spring 的配置参数
        List<String> expressions = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .toList();

        if (!expressions.isEmpty()) {
            for (String expression : expressions) {
                System.out.println("> " + expression);
                System.out.println(processor.executeAndGetResult(expression));
            }
            return;
        }

        InteractiveShell shell = new InteractiveShell(processor, operatorTable, properties.getShell().getPrompt());
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        shell.run(in, System.out);
    }
}
