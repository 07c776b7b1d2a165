package org.ltlspec.core;

import lombok.Getter;
import org.ltlspec.expressions.Terminal;
import org.ltlspec.expressions.terminals.Bool;
import org.ltlspec.expressions.terminals.Num;
import org.ltlspec.expressions.terminals.Str;

import java.util.Objects;

/**
 * 代入变量的值：布尔、整数或字符串常量三者之一。
 * 值的种类在构造时确定，替换时据此选择终结符的种类。
 * 此类是不可变的。
 */
@Getter
public final class SubstitutionValue {

    /**
     * 值的种类。
     */
    public enum Kind {
        BOOLEAN,
        INTEGER,
        STRING
    }

    private final Kind kind;
    private final Object value;

    private SubstitutionValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    // --- 工厂方法 ---
    public static SubstitutionValue ofBoolean(boolean value) {
        return new SubstitutionValue(Kind.BOOLEAN, value);
    }

    public static SubstitutionValue ofInteger(long value) {
        return new SubstitutionValue(Kind.INTEGER, value);
    }

    public static SubstitutionValue ofString(String value) {
        return new SubstitutionValue(Kind.STRING, Objects.requireNonNull(value, "字符串值不能为 null"));
    }

    /**
     * 从普通 Java 值创建：Boolean、整数类型的 Number 或 String。
     * 只在调用边界使用一次，之后一律按 {@link Kind} 分派。
     * @param value Java 值。
     * @return 对应的 SubstitutionValue。
     * @throws IllegalArgumentException 如果值的类型不受支持。
     */
    public static SubstitutionValue from(Object value) {
        if (value instanceof SubstitutionValue) {
            return (SubstitutionValue) value;
        }
        if (value instanceof Boolean) {
            return ofBoolean((Boolean) value);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ofInteger(((Number) value).longValue());
        }
        if (value instanceof String) {
            return ofString((String) value);
        }
        throw new IllegalArgumentException("不支持的代入值: " + value
                + (value == null ? "" : " (类型 " + value.getClass().getSimpleName() + ")"));
    }

    /**
     * @return 与该值种类对应的终结符。
     */
    public Terminal toTerminal() {
        return switch (kind) {
            case BOOLEAN -> Bool.of((Boolean) value);
            case INTEGER -> Num.of((Long) value);
            case STRING -> Str.of((String) value);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SubstitutionValue that = (SubstitutionValue) o;
        return kind == that.kind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == Kind.STRING ? "'" + value + "'" : String.valueOf(value);
    }
}
