package org.csu.proplogic.common.exception;

import lombok.Getter;

/**
 * 词法分析阶段的异常：遇到无法识别的字符。
 * character 保存完整的 Unicode 字符 (辅助平面字符占两个 char)，position 为其在输入中的 char 下标。
 */
@Getter
public class LexException extends RuntimeException {

    private final String character;
    private final int position;

    public LexException(int codePoint, int position) {
        super(String.format("Lexical Error at position %d: Unknown character '%s'",
                position, Character.toString(codePoint)));
        this.character = Character.toString(codePoint);
        this.position = position;
    }
}
