package com.phonepe.memoria.core.scope;

import com.phonepe.memoria.core.utils.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScopeSelectorTest {

    @Test
    void testExactSelectorMatchesOnlyItsScope() {
        final var scope = Scope.of("project", "p1", "agent", "a1");
        final var selector = ScopeSelector.exact(scope);
        assertTrue(selector.isSingleExact());
        assertTrue(selector.matches(scope));
        assertTrue(selector.matches(Scope.of("agent", "a1", "project", "p1")));
        assertFalse(selector.matches(Scope.of("project", "p2", "agent", "a1")));
        assertFalse(selector.matches(Scope.of("project", "p1")));
        assertEquals(scope, selector.toExactScope());
    }

    @Test
    void testSetAndWildcardSelectors() {
        final var selector = ScopeSelector.builder()
                .anyOf("project", "p1", "p2")
                .wildcard("agent")
                .build();
        assertFalse(selector.isSingleExact());
        assertTrue(selector.hasWildcard());
        assertFalse(selector.isAllWildcard());
        assertEquals(2, selector.combinationCount());
        assertTrue(selector.matches(Scope.of("project", "p2", "agent", "anything")));
        assertFalse(selector.matches(Scope.of("project", "p3", "agent", "a1")));
        assertThrows(IllegalStateException.class, selector::expand);
        assertThrows(IllegalStateException.class, selector::toExactScope);
    }

    @Test
    void testExpandListsEveryCombination() {
        final var selector = ScopeSelector.builder()
                .anyOf("project", "p1", "p2")
                .anyOf("agent", "a1", "a2", "a3")
                .build();
        assertEquals(6, selector.combinationCount());
        final var scopes = selector.expand();
        assertEquals(6, scopes.size());
        assertEquals(6, Set.copyOf(scopes).size());
        assertTrue(scopes.contains(Scope.of("project", "p2", "agent", "a3")));
    }

    @Test
    void testSingleValueSetCollapsesToExact() {
        final var selector = ScopeSelector.builder().anyOf("project", List.of("p1", "p1")).build();
        assertTrue(selector.isSingleExact());
        assertEquals(FieldSelector.Mode.EXACT, selector.field("project").getMode());
    }

    @Test
    void testInvalidFieldSelectorsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FieldSelector(FieldSelector.Mode.EXACT, List.of()));
        assertThrows(IllegalArgumentException.class,
                     () -> new FieldSelector(FieldSelector.Mode.WILDCARD, List.of("x")));
        assertThrows(IllegalArgumentException.class, () -> ScopeSelector.builder().build());
    }

    @Test
    void testJsonForm() throws Exception {
        final var mapper = JsonUtils.createMapper();
        final var scope = Scope.of("project", "p1", "agent", "a1");
        assertEquals("{\"project\":\"p1\",\"agent\":\"a1\"}", mapper.writeValueAsString(scope));
        assertEquals(scope, mapper.readValue(mapper.writeValueAsString(scope), Scope.class));
        final var selector = ScopeSelector.builder().anyOf("project", "p1", "p2").wildcard("agent").build();
        assertEquals(selector, mapper.readValue(mapper.writeValueAsString(selector), ScopeSelector.class));
        assertEquals("project=p1|agent=a1", scope.key());
    }
}
