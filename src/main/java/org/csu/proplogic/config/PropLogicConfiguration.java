package org.csu.proplogic.config;

import org.csu.proplogic.compiler.operator.OperatorTable;
import org.csu.proplogic.engine.LogicProcessor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PropLogicProperties.class)
public class PropLogicConfiguration {

    @Bean
    public OperatorTable operatorTable() {
        return OperatorTable.standard();
    }

    @Bean
    public LogicProcessor logicProcessor(OperatorTable operatorTable, PropLogicProperties properties) {
        return new LogicProcessor(operatorTable,
                properties.getTruthTable().getMaxVariables(),
                properties.getParser().isStrictParentheses(),
                properties.getParser().getMaxDepth());
    }
}
