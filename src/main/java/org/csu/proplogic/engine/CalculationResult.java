package org.csu.proplogic.engine;

/**
 * 封装一次计算的结果：表达式不含变量时为单个布尔值，否则为完整真值表。
 */
public record CalculationResult(
        Boolean value,          // 不含变量时的结果，否则为 null
        TruthTable truthTable   // 含变量时的真值表，否则为 null
) {
    public static CalculationResult newValueResult(boolean value) {
        return new CalculationResult(value, null);
    }

    public static CalculationResult newTableResult(TruthTable truthTable) {
        return new CalculationResult(null, truthTable);
    }

    public boolean isTable() {
        return truthTable != null;
    }
}
