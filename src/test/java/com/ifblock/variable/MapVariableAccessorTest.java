package com.ifblock.variable;

import com.ifblock.value.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MapVariableAccessor.
 */
class MapVariableAccessorTest {

    @Test
    @DisplayName("Should resolve names case-insensitively")
    void caseInsensitiveNames() {
        VariableAccessor accessor = new MapVariableAccessor(Map.of("Role", "REPORT"));

        assertEquals(Optional.of(Value.of("REPORT")), accessor.tryGet("ROLE"));
        assertEquals(Optional.of(Value.of("REPORT")), accessor.tryGet("role"));
    }

    @Test
    @DisplayName("Should resolve dot-paths through nested maps")
    void nestedPaths() {
        VariableAccessor accessor = new MapVariableAccessor(
                Map.of("user", Map.of("Name", "bob", "address", Map.of("city", "Oslo"))));

        assertEquals(Optional.of(Value.of("bob")), accessor.tryGet("USER.NAME"));
        assertEquals(Optional.of(Value.of("Oslo")), accessor.tryGet("user.address.CITY"));
        assertTrue(accessor.tryGet("user.age").isEmpty());
        assertTrue(accessor.tryGet("user.name.first").isEmpty());
    }

    @Test
    @DisplayName("Should resolve flattened dotted keys")
    void flattenedKeys() {
        VariableAccessor accessor = new MapVariableAccessor(Map.of("user.name", "alice"));

        assertEquals(Optional.of(Value.of("alice")), accessor.tryGet("User.Name"));
    }

    @Test
    @DisplayName("Should map scalars to their value kinds")
    void scalarConversion() {
        VariableAccessor accessor = new MapVariableAccessor(Map.of(
                "count", 3,
                "ratio", 0.5,
                "flag", true));

        assertEquals(Optional.of(Value.of(3.0)), accessor.tryGet("count"));
        assertEquals(Optional.of(Value.of(0.5)), accessor.tryGet("ratio"));
        assertEquals(Optional.of(Value.TRUE), accessor.tryGet("flag"));
    }

    @Test
    @DisplayName("Should render lists and maps as compact JSON text")
    void structuredValuesAsJson() {
        VariableAccessor accessor = new MapVariableAccessor(Map.of(
                "tags", List.of("a", "b"),
                "owner", Map.of("id", 7)));

        assertEquals(Optional.of(Value.of("[\"a\",\"b\"]")), accessor.tryGet("tags"));
        assertEquals(Optional.of(Value.of("{\"id\":7}")), accessor.tryGet("owner"));
    }

    @Test
    @DisplayName("Null values and blank paths do not resolve")
    void nullAndBlank() {
        Map<String, Object> vars = new HashMap<>();
        vars.put("nothing", null);
        VariableAccessor accessor = new MapVariableAccessor(vars);

        assertFalse(accessor.contains("nothing"));
        assertTrue(accessor.tryGet("").isEmpty());
        assertTrue(accessor.tryGet(null).isEmpty());
        assertTrue(new MapVariableAccessor(null).tryGet("x").isEmpty());
    }

    @Test
    @DisplayName("Should snapshot the source map")
    void snapshot() {
        Map<String, Object> vars = new HashMap<>();
        vars.put("a", "1");
        MapVariableAccessor accessor = new MapVariableAccessor(vars);
        vars.put("b", "2");

        assertEquals(1, accessor.size());
        assertFalse(accessor.contains("b"));
    }
}
