package org.ltlspec.transform;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.ltlspec.core.BooleanDomain;
import org.ltlspec.core.Domain;
import org.ltlspec.core.EnumerationDomain;
import org.ltlspec.core.IntegerRange;
import org.ltlspec.exceptions.NameConflictException;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NameConflictsTest {

    private final Map<String, Domain> domains = Map.of(
            "flag", BooleanDomain.INSTANCE,
            "speed", IntegerRange.of(0, 120),
            "color", EnumerationDomain.of("red", "green"));

    @Test
    @DisplayName("候选名称已是变量名")
    void testVariableConflict() {
        NameConflictException e = assertThrows(NameConflictException.class,
                () -> NameConflicts.checkNameConflicts(Set.of("flag", "gear"), domains));
        assertEquals(NameConflictException.Kind.VARIABLE, e.getKind());
        assertEquals(Set.of("flag"), e.getNames());
    }

    @Test
    @DisplayName("候选名称是某个枚举的取值")
    void testValueConflict() {
        NameConflictException e = assertThrows(NameConflictException.class,
                () -> NameConflicts.checkNameConflicts(Set.of("green"), domains));
        assertEquals(NameConflictException.Kind.VALUE, e.getKind());
        assertEquals(Set.of("green"), e.getNames());
    }

    @Test
    @DisplayName("从定义域映射格式构造")
    void testWithDomainMapFormat() {
        Map<String, Domain> booleans = Domain.ofMap(Map.of("x", "boolean"));
        assertThrows(NameConflictException.class, () -> NameConflicts.checkNameConflicts(Set.of("x"), booleans));
        assertDoesNotThrow(() -> NameConflicts.checkNameConflicts(Set.of("y"), booleans));
    }

    @Test
    @DisplayName("没有冲突")
    void testNoConflict() {
        assertDoesNotThrow(() -> NameConflicts.checkNameConflicts(Set.of("gear", "blue"), domains));
    }

    @Test
    @DisplayName("公式中已使用的变量名")
    void testCheckVarNameConflict() {
        assertEquals(Set.of("a", "b"), NameConflicts.checkVarNameConflict("a && b = 'c'", "d"));
        NameConflictException e = assertThrows(NameConflictException.class,
                () -> NameConflicts.checkVarNameConflict("a U b", "a"));
        assertEquals(Set.of("a"), e.getNames());
    }
}
