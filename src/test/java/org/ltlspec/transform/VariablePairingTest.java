package org.ltlspec.transform;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.ltlspec.exceptions.MalformedTreeException;
import org.ltlspec.parser.LTLParser;
import org.ltlspec.tree.Tree;

import static org.junit.jupiter.api.Assertions.*;

class VariablePairingTest {

    private static Tree treeOf(String formula) {
        return Tree.fromRecursiveAst(LTLParser.parse(formula));
    }

    @Test
    @DisplayName("常量在比较的任意一侧都能找到变量")
    void testPairing_EitherSide() {
        // (x = 'red'): 0 =, 1 x, 2 'red'
        assertEquals(Pair.of(1, 0), VariablePairing.pairWithVariable(treeOf("x = 'red'"), 2));
        // ('red' = x): 0 =, 1 'red', 2 x
        assertEquals(Pair.of(2, 0), VariablePairing.pairWithVariable(treeOf("'red' = x"), 1));
    }

    @Test
    @DisplayName("算术运算符也是配对点，向下时沿位置 0 继续")
    void testPairing_ThroughArithmetic() {
        // ((x + 1) = 3): 0 =, 1 +, 2 x, 3 1, 4 3
        Tree tree = treeOf("x + 1 = 3");
        assertEquals(Pair.of(2, 1), VariablePairing.pairWithVariable(tree, 3));
        assertEquals(Pair.of(2, 0), VariablePairing.pairWithVariable(tree, 4));
    }

    @Test
    @DisplayName("向下经过一元运算符")
    void testPairing_ThroughPrime() {
        // (! ((x') = 3)): 0 !, 1 =, 2 ', 3 x, 4 3
        Tree tree = treeOf("!(x' = 3)");
        assertEquals(Pair.of(3, 1), VariablePairing.pairWithVariable(tree, 4));
        assertEquals("x", VariablePairing.pairedVariableName(tree, 4));
    }

    @Test
    @DisplayName("上方没有比较运算符或另一侧没有变量")
    void testPairing_Malformed() {
        assertThrows(MalformedTreeException.class, () -> VariablePairing.pairWithVariable(treeOf("X 'red'"), 1));
        assertThrows(MalformedTreeException.class, () -> VariablePairing.pairWithVariable(treeOf("'red'"), 0));
        assertThrows(MalformedTreeException.class, () -> VariablePairing.pairWithVariable(treeOf("1 = 'red'"), 2));
    }
}
