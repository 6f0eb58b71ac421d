package org.drakulus.core.id;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilIDMapperTest {

    private List<String> labels;

    @BeforeEach
    void setUp() {
        labels = List.of("a", "b", "c");
    }

    @Test
    @DisplayName("Baseline Correctness: labels map to their declaration index")
    void testSimpleMapping() {
        IDMapper mapper = IDMapper.createImmutable(labels);

        assertEquals(0, mapper.toInternal("a"));
        assertEquals(2, mapper.toInternal("c"));
        assertEquals("b", mapper.toExternal(1));

        assertTrue(mapper.containsExternal("a"));
        assertFalse(mapper.containsExternal("z"));
        assertFalse(mapper.containsExternal(null));
        assertEquals(3, mapper.size());
    }

    @Test
    @DisplayName("indexOf returns -1 for unknown or null labels")
    void testIndexOfMissing() {
        IDMapper mapper = new FastUtilIDMapper(labels);
        assertEquals(1, mapper.indexOf("b"));
        assertEquals(-1, mapper.indexOf("z"));
        assertEquals(-1, mapper.indexOf(null));
    }

    @Test
    @DisplayName("Exception Path: Unknown label")
    void testUnknownLabel() {
        IDMapper mapper = new FastUtilIDMapper(labels);
        assertThrows(IDMapper.UnknownIDException.class, () -> mapper.toInternal("z"),
                "Should throw UnknownIDException for missing labels");
    }

    @Test
    @DisplayName("Exception Path: Invalid internal id")
    void testInvalidInternalId() {
        IDMapper mapper = new FastUtilIDMapper(labels);
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(3));
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(-1));
    }

    @Test
    @DisplayName("Validation: null input, null label and duplicate label are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(null));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(Arrays.asList("a", null)));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(List.of("a", "b", "a")));
    }

    @Test
    @DisplayName("Scale: 100k labels round-trip")
    void testLargeMapping() {
        List<String> many = new ArrayList<>();
        for (int i = 0; i < 100_000; i++) {
            many.add(Integer.toString(i));
        }
        IDMapper mapper = IDMapper.createImmutable(many);
        for (int i = 0; i < 100_000; i += 997) {
            assertEquals(i, mapper.toInternal(Integer.toString(i)));
            assertEquals(Integer.toString(i), mapper.toExternal(i));
        }
    }
}
