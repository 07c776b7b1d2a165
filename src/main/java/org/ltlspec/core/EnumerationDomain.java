package org.ltlspec.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 有限字符串枚举定义域。
 * 取值的顺序决定了替换为整数时使用的编码：第 i 个取值编码为 i。
 * 此类是不可变的。
 */
public final class EnumerationDomain extends Domain {

    private static final Logger logger = LoggerFactory.getLogger(EnumerationDomain.class);

    @Getter
    private final List<String> values;
    private final Map<String, Integer> indexByValue;
    private final int hashCode;

    /**
     * 私有构造函数，通过有序取值列表创建枚举定义域。
     * @param values 有序取值列表。
     * @throws IllegalArgumentException 如果取值重复。
     */
    private EnumerationDomain(List<String> values) {
        Objects.requireNonNull(values, "EnumerationDomain-构造函数: values 不能为 null");
        Map<String, Integer> tempIndex = new HashMap<>();
        for (int i = 0; i < values.size(); i++) {
            String value = Objects.requireNonNull(values.get(i), "EnumerationDomain-构造函数: 取值不能为 null");
            if (tempIndex.putIfAbsent(value, i) != null) {
                logger.warn("枚举定义域包含重复的取值 {}: {}", value, values);
                throw new IllegalArgumentException("枚举定义域包含重复的取值: " + value);
            }
        }
        this.values = List.copyOf(values);
        this.indexByValue = Collections.unmodifiableMap(tempIndex);
        this.hashCode = this.values.hashCode();
        logger.debug("创建 EnumerationDomain，包含 {} 个取值。详情：{}", this.values.size(), this.values);
    }

    public static EnumerationDomain of(List<String> values) {
        return new EnumerationDomain(values);
    }

    public static EnumerationDomain of(String... values) {
        return new EnumerationDomain(List.of(values));
    }

    public boolean contains(String value) {
        return indexByValue.containsKey(value);
    }

    /**
     * 获取取值的整数编码。
     * @param value 取值。
     * @return 该取值在枚举中的下标，不存在时返回 -1。
     */
    public int indexOf(String value) {
        Integer index = indexByValue.get(value);
        logger.debug("请求了取值 {} 的编码: {}", value, index);
        return index == null ? -1 : index;
    }

    public int size() {
        return values.size();
    }

    @Override
    public Kind getKind() {
        return Kind.ENUMERATION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return values.equals(((EnumerationDomain) o).values);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
