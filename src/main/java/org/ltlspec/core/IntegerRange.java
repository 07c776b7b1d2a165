package org.ltlspec.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 闭区间整数定义域 [low, high]。
 */
@Getter
public final class IntegerRange extends Domain {

    private final long low;
    private final long high;

    private IntegerRange(long low, long high) {
        if (low > high) {
            throw new IllegalArgumentException("IntegerRange-构造函数: 下界 " + low + " 大于上界 " + high);
        }
        this.low = low;
        this.high = high;
    }

    public static IntegerRange of(long low, long high) {
        return new IntegerRange(low, high);
    }

    /**
     * @return value 是否落在闭区间内。
     */
    public boolean contains(long value) {
        return low <= value && value <= high;
    }

    @Override
    public Kind getKind() {
        return Kind.INTEGER_RANGE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IntegerRange that = (IntegerRange) o;
        return low == that.low && high == that.high;
    }

    @Override
    public int hashCode() {
        return Objects.hash(low, high);
    }

    @Override
    public String toString() {
        return "(" + low + ", " + high + ")";
    }
}
