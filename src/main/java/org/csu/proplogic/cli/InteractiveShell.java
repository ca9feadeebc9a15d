package org.csu.proplogic.cli;

import lombok.extern.slf4j.Slf4j;
import org.csu.proplogic.compiler.operator.OperatorTable;
import org.csu.proplogic.engine.LogicProcessor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Set;

/**
 * 交互式命令行：逐行读取命题表达式并打印结果或真值表。
 * Q / X / QUIT / EXIT 退出，H / HELP 列出可用运算符。
 */
@Slf4j
public class InteractiveShell {

    private static final Set<String> QUIT_COMMANDS = Set.of("Q", "X", "QUIT", "EXIT");
    private static final Set<String> HELP_COMMANDS = Set.of("H", "HELP");

    private final LogicProcessor processor;
    private final OperatorTable operatorTable;
    private final String prompt;

    public InteractiveShell(LogicProcessor processor, OperatorTable operatorTable, String prompt) {
        this.processor = processor;
        this.operatorTable = operatorTable;
        this.prompt = prompt;
    }

    public void run(BufferedReader in, PrintStream out) throws IOException {
        while (true) {
            out.print(prompt);
            out.flush();
            String line = in.readLine();
            if (line == null) {
                break;
            }
            String command = line.trim().toUpperCase(Locale.ROOT);
            if (QUIT_COMMANDS.contains(command)) {
                break;
            }
            if (HELP_COMMANDS.contains(command)) {
                out.println(helpText());
                continue;
            }
            if (command.isEmpty()) {
                continue;
            }
            log.debug("Evaluating '{}'", command);
            out.println(processor.executeAndGetResult(command));
        }
        out.println("Bye!");
    }

    public String helpText() {
        StringBuilder sb = new StringBuilder();
        for (String symbol : operatorTable.symbols()) {
            sb.append(symbol).append("; ");
        }
        return sb.toString().trim();
    }
}
