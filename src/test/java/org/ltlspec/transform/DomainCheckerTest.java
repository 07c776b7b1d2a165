package org.ltlspec.transform;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.ltlspec.core.BooleanDomain;
import org.ltlspec.core.Domain;
import org.ltlspec.core.EnumerationDomain;
import org.ltlspec.core.IntegerRange;
import org.ltlspec.exceptions.DomainMismatchException;
import org.ltlspec.exceptions.OutOfDomainException;
import org.ltlspec.exceptions.OutOfRangeException;
import org.ltlspec.exceptions.SpecException;
import org.ltlspec.exceptions.UndefinedVariableException;
import org.ltlspec.parser.LTLParser;
import org.ltlspec.tree.Tree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DomainCheckerTest {

    private Map<String, Domain> domains;

    @BeforeEach
    void setUp() {
        domains = new LinkedHashMap<>();
        domains.put("x", IntegerRange.of(0, 10));
        domains.put("color", EnumerationDomain.of("red", "green"));
        domains.put("flag", BooleanDomain.INSTANCE);
    }

    private static Tree treeOf(String formula) {
        return Tree.fromRecursiveAst(LTLParser.parse(formula));
    }

    @Nested
    @DisplayName("立即失败 (Fail-fast)")
    class CheckDomainsTests {

        @Test
        @DisplayName("合规的公式不抛异常且不修改树")
        void testValidFormula() {
            Tree tree = treeOf("x = 7 && color = 'red' && flag U x + 3 <= 10");
            String before = tree.toString();
            assertDoesNotThrow(() -> DomainChecker.checkDomains(tree, domains));
            assertEquals(before, tree.toString());
        }

        @Test
        @DisplayName("未定义的变量")
        void testUndefinedVariable() {
            UndefinedVariableException e = assertThrows(UndefinedVariableException.class,
                    () -> DomainChecker.checkDomains(treeOf("x = 7 && z"), domains));
            assertEquals("z", e.getVariable());
        }

        @Test
        @DisplayName("整数超出范围，边界值合规")
        void testOutOfRange() {
            OutOfRangeException e = assertThrows(OutOfRangeException.class,
                    () -> DomainChecker.checkDomains(treeOf("x = 11"), domains));
            assertAll("out of range",
                    () -> assertEquals("x", e.getVariable()),
                    () -> assertEquals(11, e.getValue()),
                    () -> assertEquals(IntegerRange.of(0, 10), e.getRange())
            );
            assertDoesNotThrow(() -> DomainChecker.checkDomains(treeOf("x = 0 || x = 10"), domains));

            Map<String, Domain> small = Map.of("x", IntegerRange.of(0, 5));
            assertThrows(OutOfRangeException.class, () -> DomainChecker.checkDomains(treeOf("x = 7"), small));
            assertDoesNotThrow(() -> DomainChecker.checkDomains(treeOf("x = 3"), small));
        }

        @Test
        @DisplayName("字符串常量不在枚举中")
        void testOutOfDomain() {
            OutOfDomainException e = assertThrows(OutOfDomainException.class,
                    () -> DomainChecker.checkDomains(treeOf("color = 'pink'"), domains));
            assertEquals("pink", e.getValue());
            assertEquals("color", e.getVariable());
        }

        @Test
        @DisplayName("常量种类与定义域种类不符")
        void testKindMismatch() {
            assertAll("mismatch",
                    () -> assertEquals(DomainMismatchException.class, assertThrows(DomainMismatchException.class,
                            () -> DomainChecker.checkDomains(treeOf("x = 'red'"), domains)).getClass()),
                    () -> assertEquals(DomainMismatchException.class, assertThrows(DomainMismatchException.class,
                            () -> DomainChecker.checkDomains(treeOf("color = 1"), domains)).getClass()),
                    () -> assertEquals(DomainMismatchException.class, assertThrows(DomainMismatchException.class,
                            () -> DomainChecker.checkDomains(treeOf("flag = 1"), domains)).getClass())
            );
        }

        @Test
        @DisplayName("未定义变量先于常量违规报告")
        void testUndefinedReportedFirst() {
            assertThrows(UndefinedVariableException.class,
                    () -> DomainChecker.checkDomains(treeOf("color = 'pink' && z"), domains));
        }
    }

    @Nested
    @DisplayName("收集全部违规 (Collect)")
    class CollectViolationsTests {

        @Test
        @DisplayName("按顶点顺序收集，未定义变量在前")
        void testCollectAll() {
            List<SpecException> violations =
                    DomainChecker.collectViolations(treeOf("x = 11 && color = 'pink' && z"), domains);
            assertEquals(3, violations.size());
            assertInstanceOf(UndefinedVariableException.class, violations.get(0));
            assertInstanceOf(OutOfRangeException.class, violations.get(1));
            assertInstanceOf(OutOfDomainException.class, violations.get(2));
        }

        @Test
        @DisplayName("合规时为空")
        void testNoViolations() {
            assertTrue(DomainChecker.collectViolations(treeOf("flag -> X color = 'green'"), domains).isEmpty());
        }
    }
}
