package org.ltlspec.transform;

import org.apache.commons.lang3.tuple.Pair;
import org.ltlspec.exceptions.MalformedTreeException;
import org.ltlspec.expressions.Node;
import org.ltlspec.expressions.Operator;
import org.ltlspec.expressions.terminals.Var;
import org.ltlspec.tree.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalInt;

/**
 * 为常量或整数叶子找到与之比较的变量。
 */
public final class VariablePairing {

    private static final Logger logger = LoggerFactory.getLogger(VariablePairing.class);

    private VariablePairing() {
    }

    /**
     * 先从 leaf 向上走，停在第一个二元比较运算符 (关系或算术) 处；
     * 再从该运算符另一侧的运算数向下走，直到遇到变量。
     * <p>
     * 前提 (不在内部重新验证)：比较运算符与常量、变量之间只有一元运算符。
     * 向下走时若遇到二元运算符，沿位置 0 的运算数继续。
     *
     * @param tree 语法树。
     * @param leaf 字符串常量或整数所在的顶点。
     * @return (变量顶点, 运算符顶点)。
     * @throws MalformedTreeException 如果上方没有比较运算符，或另一侧找不到变量。
     */
    public static Pair<Integer, Integer> pairWithVariable(Tree tree, int leaf) {
        int current = leaf;
        int operator;
        while (true) {
            OptionalInt parent = tree.getParent(current);
            if (parent.isEmpty()) {
                logger.error("常量 {} 上方没有二元比较运算符, 公式: {}", tree.getLabel(leaf), tree);
                throw new MalformedTreeException("常量 " + tree.getLabel(leaf) + " 上方没有二元比较运算符");
            }
            int candidate = parent.getAsInt();
            Node label = tree.getLabel(candidate);
            if (label instanceof Operator && ((Operator) label).getType().isComparison()) {
                operator = candidate;
                break;
            }
            current = candidate;
        }

        List<Integer> operands = tree.getChildren(operator);
        int side = operands.get(0) == current ? operands.get(1) : operands.get(0);
        while (!(tree.getLabel(side) instanceof Var)) {
            if (tree.isLeaf(side)) {
                logger.error("常量 {} 所在比较 {} 的另一侧没有变量", tree.getLabel(leaf), tree.toRecursiveAst(operator));
                throw new MalformedTreeException("常量 " + tree.getLabel(leaf) + " 所在比较 "
                        + tree.toRecursiveAst(operator) + " 的另一侧没有变量");
            }
            side = tree.getChildren(side).get(0);
        }
        logger.debug("常量 {} 与变量 {} 配对, 运算符 {}", tree.getLabel(leaf), tree.getLabel(side), tree.getLabel(operator));
        return Pair.of(side, operator);
    }

    /**
     * @return 与 leaf 配对的变量名。
     */
    public static String pairedVariableName(Tree tree, int leaf) {
        return ((Var) tree.getLabel(pairWithVariable(tree, leaf).getLeft())).getName();
    }
}
