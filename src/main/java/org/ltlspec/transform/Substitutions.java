package org.ltlspec.transform;

import org.ltlspec.core.EnumerationDomain;
import org.ltlspec.core.SubstitutionValue;
import org.ltlspec.core.ValueAssignment;
import org.ltlspec.exceptions.OutOfDomainException;
import org.ltlspec.exceptions.UndefinedVariableException;
import org.ltlspec.expressions.Node;
import org.ltlspec.expressions.terminals.Num;
import org.ltlspec.expressions.terminals.Str;
import org.ltlspec.expressions.terminals.Var;
import org.ltlspec.tree.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 在语法树上原地进行的代入改写。
 */
public final class Substitutions {

    private static final Logger logger = LoggerFactory.getLogger(Substitutions.class);

    private Substitutions() {
    }

    /**
     * 将赋值中出现的变量替换为对应种类的终结符 (布尔、整数或字符串常量)。
     * 未出现在赋值中的变量保持不变。
     * @param tree 语法树，原地修改。
     * @param assignment 变量名到值的赋值。
     */
    public static void substituteValues(Tree tree, ValueAssignment assignment) {
        int replaced = 0;
        for (int handle : tree.variables()) {
            String name = ((Var) tree.getLabel(handle)).getName();
            Optional<SubstitutionValue> value = assignment.getValue(name);
            if (value.isPresent()) {
                tree.relabel(handle, value.get().toTerminal());
                replaced++;
            }
        }
        logger.debug("代入了 {} 个变量, 结果: {}", replaced, tree);
    }

    /**
     * 同 {@link #substituteValues(Tree, ValueAssignment)}，值为 Boolean、整数或 String。
     */
    public static void substituteValues(Tree tree, Map<String, ?> assignment) {
        substituteValues(tree, ValueAssignment.of(assignment));
    }

    /**
     * 将字符串常量替换为整数：整数为常量在其配对变量的枚举表中的下标。
     * 所有查找都成功后才修改树，失败时树保持不变。
     * @param tree 语法树，原地修改。
     * @param enumTables 变量名到有序取值列表的映射。
     * @throws UndefinedVariableException 配对的变量没有枚举表。
     * @throws OutOfDomainException 常量不在枚举表中。
     */
    public static void substituteStringConstants(Tree tree, Map<String, List<String>> enumTables) {
        Map<String, EnumerationDomain> tables = new LinkedHashMap<>();
        enumTables.forEach((name, values) -> tables.put(name, EnumerationDomain.of(values)));

        Map<Integer, Num> replacements = new LinkedHashMap<>();
        for (int handle : tree.vertices()) {
            Node label = tree.getLabel(handle);
            if (!(label instanceof Str)) {
                continue;
            }
            Str constant = (Str) label;
            String variable = VariablePairing.pairedVariableName(tree, handle);
            EnumerationDomain table = tables.get(variable);
            if (table == null) {
                logger.error("变量 {} 没有枚举表, 无法替换常量 {}", variable, constant);
                throw new UndefinedVariableException(variable, tree.toString());
            }
            int index = table.indexOf(constant.getValue());
            if (index < 0) {
                logger.error("常量 {} 不在变量 {} 的枚举表 {} 中", constant, variable, table);
                throw new OutOfDomainException(variable, constant, table);
            }
            replacements.put(handle, Num.of(index));
        }
        replacements.forEach(tree::relabel);
        logger.debug("将 {} 个字符串常量替换为整数, 结果: {}", replacements.size(), tree);
    }

    /**
     * 将映射中出现的变量替换为给定的子树 (通过 {@link Tree#addSubtree(int, Tree)} 嫁接)。
     * 替换用的树不会被修改，同一棵树可以嫁接到多个位置。
     * @param tree 语法树，原地修改。
     * @param replacements 变量名到等价公式的映射。
     */
    public static void substituteSubtrees(Tree tree, Map<String, Tree> replacements) {
        int grafted = 0;
        for (int handle : tree.variables()) {
            String name = ((Var) tree.getLabel(handle)).getName();
            Tree replacement = replacements.get(name);
            if (replacement != null) {
                tree.addSubtree(handle, replacement);
                grafted++;
            }
        }
        logger.debug("嫁接了 {} 棵子树, 结果: {}", grafted, tree);
    }
}
