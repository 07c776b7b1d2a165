package org.ltlspec.expressions.terminals;

import org.ltlspec.expressions.Terminal;

/**
 * 整数终结符。
 */
public final class Num extends Terminal {

    private final long value;

    private Num(long value) {
        this.value = value;
    }

    public static Num of(long value) {
        return new Num(value);
    }

    @Override
    public Long getValue() {
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
        return value == ((Num) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
