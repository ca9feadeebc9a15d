package org.csu.proplogic.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * application.properties 中以 proplogic 为前缀的配置项。
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "proplogic")
public class PropLogicProperties {

    private final TruthTable truthTable = new TruthTable();
    private final Parser parser = new Parser();
    private final Shell shell = new Shell();

    @Getter
    @Setter
    public static class TruthTable {
        // 枚举代价为 2^n，需要限制变量个数
        private int maxVariables = 16;
    }

    @Getter
    @Setter
    public static class Parser {
        // 缺少 ')' 时是否报错
        private boolean strictParentheses = false;
        // 括号、NOT 与运算符链的最大嵌套层数
        private int maxDepth = 1000;
    }

    @Getter
    @Setter
    public static class Shell {
        private boolean enabled = true;
        private String prompt = "Prop Exp? ";
    }
}
