package com.raditha.approx.search;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SearchModeTest {

    @ParameterizedTest
    @ValueSource(strings = {"brute-force", "BRUTE_FORCE", "bruteforce"})
    void testBruteForce(String value) {
        assertEquals(SearchMode.BRUTE_FORCE, SearchMode.fromString(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"pruning-tree", "pruning_tree", "Tree"})
    void testPruningTree(String value) {
        assertEquals(SearchMode.PRUNING_TREE, SearchMode.fromString(value));
    }

    @Test
    void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> SearchMode.fromString("greedy"));
        assertThrows(IllegalArgumentException.class, () -> SearchMode.fromString(null));
        assertEquals("pruning-tree", SearchMode.PRUNING_TREE.toCliString());
    }
}
