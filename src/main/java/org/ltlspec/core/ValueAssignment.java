package org.ltlspec.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 变量名到代入值的赋值。
 * 此类是不可变的。
 */
public final class ValueAssignment {

    private static final Logger logger = LoggerFactory.getLogger(ValueAssignment.class);

    private final SortedMap<String, SubstitutionValue> values;

    private ValueAssignment(Map<String, SubstitutionValue> values) {
        logger.debug("创建 ValueAssignment: {}", values);
        this.values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
    }

    /**
     * 工厂方法：从 Java 值映射创建赋值，值按 {@link SubstitutionValue#from(Object)} 转换。
     * @param values 变量名到 Boolean、整数或 String 的映射。
     * @return ValueAssignment 实例。
     */
    public static ValueAssignment of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values 不能为 null");
        SortedMap<String, SubstitutionValue> converted = new TreeMap<>();
        values.forEach((name, value) -> converted.put(name, SubstitutionValue.from(value)));
        return new ValueAssignment(converted);
    }

    public static ValueAssignment empty() {
        return new ValueAssignment(Collections.emptyMap());
    }

    /**
     * 获取指定变量的值。
     * @param name 变量名。
     * @return 变量的值，未赋值时为空。
     */
    public Optional<SubstitutionValue> getValue(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> getNames() {
        return values.keySet();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return values.equals(((ValueAssignment) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "{" +
                values.entrySet().stream()
                        .map(entry -> entry.getKey() + "=" + entry.getValue())
                        .collect(Collectors.joining(", ")) +
                "}";
    }
}
