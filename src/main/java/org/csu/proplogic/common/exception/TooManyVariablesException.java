package org.csu.proplogic.common.exception;

import lombok.Getter;

/**
 * 表达式中的变量个数超过真值表允许的上限 (枚举代价为 2^n)。
 */
@Getter
public class TooManyVariablesException extends RuntimeException {

    private final int count;
    private final int limit;

    public TooManyVariablesException(int count, int limit) {
        super("Too many variables for a truth table: " + count + " (limit is " + limit + ")");
        this.count = count;
        this.limit = limit;
    }
}
