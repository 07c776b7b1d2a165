package org.ltlspec.expressions.terminals;

import org.ltlspec.expressions.Terminal;

import java.util.Objects;

/**
 * 字符串常量终结符，在输入语法中以单引号包围。
 */
public final class Str extends Terminal {

    public static final char QUOTE = '\'';

    private final String value;

    private Str(String value) {
        this.value = Objects.requireNonNull(value, "Str-构造函数: value 不能为 null");
    }

    public static Str of(String value) {
        return new Str(value);
    }

    @Override
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value.equals(((Str) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return QUOTE + value + QUOTE;
    }
}
