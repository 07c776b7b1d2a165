package org.ltlspec.parser;

import lombok.Getter;

import java.util.Objects;

/**
 * 词法诊断：无法识别的字符。该字符被跳过，词法分析继续进行。
 */
@Getter
public final class LexDiagnostic {

    private final int offset;
    private final char character;
    private final int line;

    public LexDiagnostic(int offset, char character, int line) {
        this.offset = offset;
        this.character = character;
        this.line = line;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LexDiagnostic that = (LexDiagnostic) o;
        return offset == that.offset && character == that.character && line == that.line;
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, character, line);
    }

    @Override
    public String toString() {
        return "非法字符 '" + character + "' (第 " + line + " 行, 位置 " + offset + ")";
    }
}
