package org.ltlspec.transform;

import org.ltlspec.core.Domain;
import org.ltlspec.exceptions.NameConflictException;
import org.ltlspec.expressions.terminals.Str;
import org.ltlspec.expressions.terminals.Var;
import org.ltlspec.parser.LTLParser;
import org.ltlspec.tree.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 常量推断：把公式中不是已知变量的名称加上引号，变为字符串常量。
 */
public final class ConstantInference {

    private static final Logger logger = LoggerFactory.getLogger(ConstantInference.class);

    private ConstantInference() {
    }

    /**
     * 只给出变量名时无法检查歧义 (是否为变量取决于将来使用的定义域)，只记录警告。
     * @param formula 合法的 LTL 公式。
     * @param variables 变量名集合。
     * @return 重新输出的公式文本，非变量名称已加引号。
     */
    public static String inferConstants(String formula, Set<String> variables) {
        logger.warn("inferConstants 不知道变量的定义域, 结果可能因定义域不同而不正确; 传入定义域映射可检查歧义");
        return infer(formula, variables);
    }

    /**
     * 先检查每个变量名与其他变量的名称及枚举取值是否冲突，再进行推断。
     * @param formula 合法的 LTL 公式。
     * @param domains 变量定义域。
     * @return 重新输出的公式文本，非变量名称已加引号。
     * @throws NameConflictException 如果某个变量名与其他变量名或取值冲突。
     */
    public static String inferConstants(String formula, Map<String, Domain> domains) {
        for (String variable : domains.keySet()) {
            Map<String, Domain> others = new LinkedHashMap<>(domains);
            others.remove(variable);
            NameConflicts.checkNameConflicts(Set.of(variable), others);
        }
        return infer(formula, domains.keySet());
    }

    private static String infer(String formula, Set<String> variables) {
        Tree tree = Tree.fromRecursiveAst(LTLParser.parse(formula));
        for (int handle : tree.variables()) {
            String name = ((Var) tree.getLabel(handle)).getName();
            if (!variables.contains(name)) {
                logger.debug("名称 {} 不是变量, 推断为字符串常量", name);
                tree.relabel(handle, Str.of(name));
            }
        }
        String result = tree.toString();
        logger.debug("常量推断: {} -> {}", formula, result);
        return result;
    }
}
