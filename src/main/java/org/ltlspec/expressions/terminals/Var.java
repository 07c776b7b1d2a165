package org.ltlspec.expressions.terminals;

import org.ltlspec.expressions.Terminal;

import java.util.Objects;

/**
 * 变量终结符。
 */
public final class Var extends Terminal {

    private final String name;

    private Var(String name) {
        this.name = Objects.requireNonNull(name, "Var-构造函数: name 不能为 null");
    }

    public static Var of(String name) {
        return new Var(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public String getValue() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((Var) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
