package org.ltlspec.transform;

import org.ltlspec.core.Domain;
import org.ltlspec.core.EnumerationDomain;
import org.ltlspec.exceptions.NameConflictException;
import org.ltlspec.parser.LTLParser;
import org.ltlspec.tree.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 名称冲突检查：变量名与所有枚举定义域中的取值必须全局唯一。
 */
public final class NameConflicts {

    private static final Logger logger = LoggerFactory.getLogger(NameConflicts.class);

    private NameConflicts() {
    }

    /**
     * @param candidates 候选名称。
     * @param domains 已有变量的定义域。
     * @throws NameConflictException 如果候选名称已是变量名，或出现在某个枚举定义域的取值中。
     */
    public static void checkNameConflicts(Set<String> candidates, Map<String, Domain> domains) {
        Set<String> redefined = new TreeSet<>();
        for (String name : candidates) {
            if (domains.containsKey(name)) {
                redefined.add(name);
            }
        }
        if (!redefined.isEmpty()) {
            logger.error("变量被重复定义: {}", redefined);
            throw new NameConflictException(redefined, NameConflictException.Kind.VARIABLE);
        }
        for (Map.Entry<String, Domain> entry : domains.entrySet()) {
            if (entry.getValue().getKind() != Domain.Kind.ENUMERATION) {
                continue;
            }
            EnumerationDomain enumeration = (EnumerationDomain) entry.getValue();
            Set<String> conflicting = new TreeSet<>();
            for (String name : candidates) {
                if (enumeration.contains(name)) {
                    conflicting.add(name);
                }
            }
            if (!conflicting.isEmpty()) {
                logger.error("取值被重复定义: {} (变量 {} 的定义域 {})", conflicting, entry.getKey(), enumeration);
                throw new NameConflictException(conflicting, NameConflictException.Kind.VALUE);
            }
        }
    }

    /**
     * 解析公式，检查 candidate 是否已被用作变量名。
     * @param formula 公式文本。
     * @param candidate 候选变量名。
     * @return 公式中出现的变量名。
     * @throws NameConflictException 如果 candidate 已出现在公式中。
     */
    public static Set<String> checkVarNameConflict(String formula, String candidate) {
        Tree tree = Tree.fromRecursiveAst(LTLParser.parse(formula));
        Set<String> names = tree.variableNames();
        if (names.contains(candidate)) {
            logger.error("变量名 {} 已在公式 {} 中使用", candidate, formula);
            throw new NameConflictException(Set.of(candidate), NameConflictException.Kind.VARIABLE);
        }
        return names;
    }
}
