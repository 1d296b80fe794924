package com.bko.delegation.orchestration.parsing;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonRepairsTest {

    @Test
    void testBalancedObjects_LargestFirst() {
        assertEquals(List.of("{\"a\":1}", "{b}"), JsonRepairs.balancedObjects("Here you go: {\"a\":1} thanks {b}"));
        assertEquals(List.of("{\"a\": \"}\"}"), JsonRepairs.balancedObjects("{\"a\": \"}\"} tail"));
        assertTrue(JsonRepairs.balancedObjects("no braces here").isEmpty());
        assertTrue(JsonRepairs.balancedObjects("} backwards {").isEmpty());
    }

    @Test
    void testRepairBase() {
        assertEquals("{\"a\": [1, 2", JsonRepairs.repairBase("Sure: {\"a\": [1, 2"));
        assertEquals("{\"long\": \"truncated", JsonRepairs.repairBase("{x} then {\"long\": \"truncated"));
        assertEquals("{'a': 1,}", JsonRepairs.repairBase("Result: {'a': 1,} done"));
        assertEquals("plain", JsonRepairs.repairBase("plain"));
    }

    @Test
    void testRemoveTrailingCommas() {
        assertEquals("{\"a\":[1,2]}", JsonRepairs.removeTrailingCommas("{\"a\":[1,2,],}"));
    }

    @Test
    void testQuoteBareKeys() {
        assertEquals("{\"analysis\": \"x\", \"count\": 2}", JsonRepairs.quoteBareKeys("{analysis: \"x\", count: 2}"));
    }

    @Test
    void testConvertSingleQuotes_KeepsApostrophesInDoubleQuotedStrings() {
        assertEquals("{\"a\": \"it's fine\", \"b\": \"x\"}",
                JsonRepairs.convertSingleQuotes("{\"a\": \"it's fine\", 'b': 'x'}"));
    }

    @Test
    void testConvertSingleQuotes_EscapesEmbeddedDoubleQuotes() {
        assertEquals("{\"a\": \"say \\\"hi\\\"\"}", JsonRepairs.convertSingleQuotes("{'a': 'say \"hi\"'}"));
    }

    @Test
    void testBalanceBrackets() {
        assertEquals("{\"a\": [1, 2]}", JsonRepairs.balanceBrackets("{\"a\": [1, 2"));
        assertEquals("{\"a\": \"trunc\"}", JsonRepairs.balanceBrackets("{\"a\": \"trunc"));
        String balanced = "{\"a\": \"{not a brace\"}";
        assertSame(balanced, JsonRepairs.balanceBrackets(balanced));
    }

    @Test
    void testBalanceBrackets_DropsDanglingSeparators() {
        assertEquals("{\"a\": [1, 2]}", JsonRepairs.balanceBrackets("{\"a\": [1, 2,"));
        assertEquals("{\"a\": [\"x\"]}", JsonRepairs.balanceBrackets("{\"a\": [\"x\",  \n"));
        assertEquals("{\"a\": 1, \"b\": null}", JsonRepairs.balanceBrackets("{\"a\": 1, \"b\":"));
    }

    @Test
    void testEscapeNewlinesInStrings() {
        assertEquals("{\"a\": \"line1\\nline2\"}\n", JsonRepairs.escapeNewlinesInStrings("{\"a\": \"line1\nline2\"}\n"));
    }
}
