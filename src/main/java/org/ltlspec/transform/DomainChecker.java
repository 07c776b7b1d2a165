package org.ltlspec.transform;

import org.ltlspec.core.Domain;
import org.ltlspec.core.EnumerationDomain;
import org.ltlspec.core.IntegerRange;
import org.ltlspec.exceptions.DomainMismatchException;
import org.ltlspec.exceptions.OutOfDomainException;
import org.ltlspec.exceptions.OutOfRangeException;
import org.ltlspec.exceptions.SpecException;
import org.ltlspec.exceptions.UndefinedVariableException;
import org.ltlspec.expressions.Node;
import org.ltlspec.expressions.terminals.Num;
import org.ltlspec.expressions.terminals.Str;
import org.ltlspec.expressions.terminals.Var;
import org.ltlspec.tree.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 检查公式中的变量与常量是否符合定义域。不修改树。
 * <ul>
 *     <li>每个变量都必须在定义域映射中。</li>
 *     <li>字符串常量所配对的变量必须是枚举定义域，且常量是其成员。</li>
 *     <li>整数所配对的变量必须是整数范围，且整数落在闭区间内。</li>
 * </ul>
 */
public final class DomainChecker {

    private static final Logger logger = LoggerFactory.getLogger(DomainChecker.class);

    private DomainChecker() {
    }

    /**
     * 检查并在第一个违规处失败。
     * @param tree 语法树。
     * @param domains 变量名到定义域的映射。
     * @throws UndefinedVariableException 变量不在 domains 中。
     * @throws DomainMismatchException 常量种类与定义域种类不符。
     * @throws OutOfDomainException 字符串常量不在枚举中。
     * @throws OutOfRangeException 整数超出范围。
     */
    public static void checkDomains(Tree tree, Map<String, Domain> domains) {
        check(tree, domains, true);
        logger.debug("公式 {} 通过了定义域检查", tree);
    }

    /**
     * 检查整棵树并收集所有违规，按顶点顺序，变量未定义的违规在前。
     * @return 违规列表，全部合规时为空。
     */
    public static List<SpecException> collectViolations(Tree tree, Map<String, Domain> domains) {
        return check(tree, domains, false);
    }

    private static List<SpecException> check(Tree tree, Map<String, Domain> domains, boolean failFast) {
        List<SpecException> violations = new ArrayList<>();
        for (int handle : tree.variables()) {
            String name = ((Var) tree.getLabel(handle)).getName();
            if (!domains.containsKey(name)) {
                report(violations, new UndefinedVariableException(name, tree.toString()), failFast);
            }
        }
        for (int handle : tree.vertices()) {
            Node label = tree.getLabel(handle);
            if (!(label instanceof Str) && !(label instanceof Num)) {
                continue;
            }
            String variable = VariablePairing.pairedVariableName(tree, handle);
            Domain domain = domains.get(variable);
            if (domain == null) {
                // 已在第一遍报告过
                continue;
            }
            if (label instanceof Str) {
                checkString(variable, (Str) label, domain, violations, failFast);
            } else {
                checkNumber(variable, (Num) label, domain, violations, failFast);
            }
        }
        return violations;
    }

    private static void checkString(String variable, Str constant, Domain domain,
                                    List<SpecException> violations, boolean failFast) {
        if (domain.getKind() != Domain.Kind.ENUMERATION) {
            report(violations, new DomainMismatchException(variable, constant, domain), failFast);
            return;
        }
        EnumerationDomain enumeration = (EnumerationDomain) domain;
        if (!enumeration.contains(constant.getValue())) {
            report(violations, new OutOfDomainException(variable, constant, enumeration), failFast);
        }
    }

    private static void checkNumber(String variable, Num number, Domain domain,
                                    List<SpecException> violations, boolean failFast) {
        if (domain.getKind() != Domain.Kind.INTEGER_RANGE) {
            report(violations, new DomainMismatchException(variable, number, domain), failFast);
            return;
        }
        IntegerRange range = (IntegerRange) domain;
        if (!range.contains(number.getValue())) {
            report(violations, new OutOfRangeException(variable, number, range), failFast);
        }
    }

    private static void report(List<SpecException> violations, SpecException violation, boolean failFast) {
        logger.error("定义域检查失败: {}", violation.getMessage());
        if (failFast) {
            throw violation;
        }
        violations.add(violation);
    }
}
