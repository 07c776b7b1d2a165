package org.ltlspec.core;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 变量的定义域：布尔、闭区间整数范围或有限字符串枚举。
 * 三种变体都是不可变的。
 */
public abstract class Domain {

    private static final Logger logger = LoggerFactory.getLogger(Domain.class);

    /**
     * 定义域种类。
     */
    public enum Kind {
        BOOLEAN,
        INTEGER_RANGE,
        ENUMERATION
    }

    Domain() {
    }

    public abstract Kind getKind();

    /**
     * 将定义域映射格式中的一个条目转换为 Domain。
     * 接受：
     * <ul>
     *     <li>字符串 "boolean" 或 "bool" (不区分大小写)</li>
     *     <li>由两个整数构成的 {@link Pair}、int[]、long[] 或 List (闭区间上下界)</li>
     *     <li>字符串列表 (枚举，顺序决定整数编码)</li>
     *     <li>已经构造好的 Domain</li>
     * </ul>
     * @param spec 定义域描述。
     * @return 对应的 Domain。
     * @throws IllegalArgumentException 如果无法识别该描述。
     */
    public static Domain of(Object spec) {
        Objects.requireNonNull(spec, "Domain.of: 定义域描述不能为 null");
        if (spec instanceof Domain) {
            return (Domain) spec;
        }
        if (spec instanceof String) {
            String tag = (String) spec;
            if (tag.equalsIgnoreCase("boolean") || tag.equalsIgnoreCase("bool")) {
                return BooleanDomain.INSTANCE;
            }
        } else if (spec instanceof Pair) {
            Pair<?, ?> bounds = (Pair<?, ?>) spec;
            if (bounds.getLeft() instanceof Number && bounds.getRight() instanceof Number) {
                return IntegerRange.of(((Number) bounds.getLeft()).longValue(), ((Number) bounds.getRight()).longValue());
            }
        } else if (spec instanceof int[] && ((int[]) spec).length == 2) {
            int[] bounds = (int[]) spec;
            return IntegerRange.of(bounds[0], bounds[1]);
        } else if (spec instanceof long[] && ((long[]) spec).length == 2) {
            long[] bounds = (long[]) spec;
            return IntegerRange.of(bounds[0], bounds[1]);
        } else if (spec instanceof List) {
            List<?> items = (List<?>) spec;
            if (items.stream().allMatch(String.class::isInstance)) {
                return EnumerationDomain.of(items.stream().map(String.class::cast).toList());
            }
            if (items.size() == 2 && items.stream().allMatch(Number.class::isInstance)) {
                return IntegerRange.of(((Number) items.get(0)).longValue(), ((Number) items.get(1)).longValue());
            }
        }
        logger.error("Domain.of: 无法识别的定义域描述 {}", spec);
        throw new IllegalArgumentException("无法识别的定义域描述: " + spec);
    }

    /**
     * 转换整个定义域映射，保留变量的插入顺序。
     * @param specs 变量名到定义域描述的映射。
     * @return 变量名到 Domain 的不可修改映射。
     */
    public static Map<String, Domain> ofMap(Map<String, ?> specs) {
        Map<String, Domain> domains = new LinkedHashMap<>();
        specs.forEach((name, spec) -> domains.put(name, of(spec)));
        logger.debug("转换了定义域映射: {}", domains);
        return Collections.unmodifiableMap(domains);
    }
}
