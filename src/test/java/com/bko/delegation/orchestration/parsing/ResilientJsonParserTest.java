package com.bko.delegation.orchestration.parsing;

import com.bko.delegation.error.ParseRecoveryExhaustedException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResilientJsonParserTest {

    private final ResilientJsonParser parser = new ResilientJsonParser(new ObjectMapper());

    @Test
    void testParse_ValidJsonNeedsNoFixes() {
        ParseOutcome outcome = parser.parse("{\"deliverables\": {\"analysis\": \"ok\"}}");

        assertFalse(outcome.recovered());
        assertFalse(outcome.fallback());
        assertEquals("ok", outcome.structure().path("deliverables").path("analysis").asText());
    }

    @Test
    void testParse_ExtractsFromSurroundingProse() {
        ParseOutcome outcome = parser.parse("Sure! Here is the result:\n```json\n{\"metadata\": {\"confidence_level\": \"high\"}}\n```");

        assertEquals(1, outcome.fixesApplied().size());
        assertEquals(ResilientJsonParser.FIX_EXTRACTED, outcome.fixesApplied().get(0));
        assertEquals("high", outcome.structure().path("metadata").path("confidence_level").asText());
    }

    @Test
    void testParse_RepairsAreCumulative() {
        ParseOutcome outcome = parser.parse("{deliverables: {'analysis': 'fine', recommendations: ['a', 'b',],},}");

        assertFalse(outcome.fallback());
        assertTrue(outcome.fixesApplied().contains(ResilientJsonParser.FIX_TRAILING_COMMAS));
        assertTrue(outcome.fixesApplied().contains(ResilientJsonParser.FIX_BARE_KEYS));
        assertTrue(outcome.fixesApplied().contains(ResilientJsonParser.FIX_SINGLE_QUOTES));
        JsonNode deliverables = outcome.structure().path("deliverables");
        assertEquals("fine", deliverables.path("analysis").asText());
        assertEquals(2, deliverables.path("recommendations").size());
    }

    @Test
    void testParse_TruncatedOutputIsClosed() {
        ParseOutcome outcome = parser.parse("{\"deliverables\": {\"analysis\": \"cut off mid");

        assertTrue(outcome.fixesApplied().contains(ResilientJsonParser.FIX_BALANCED));
        assertEquals("cut off mid", outcome.structure().path("deliverables").path("analysis").asText());
    }

    @Test
    void testParse_TruncatedAfterCommaKeepsContent() {
        ParseOutcome outcome = parser.parse("{\"deliverables\":{\"analysis\":\"SQL injection in src/db/Query.java line 42\","
                + "\"recommendations\":[\"Use prepared statements\",");

        assertEquals(List.of(ResilientJsonParser.FIX_BALANCED), outcome.fixesApplied());
        JsonNode deliverables = outcome.structure().path("deliverables");
        assertEquals("SQL injection in src/db/Query.java line 42", deliverables.path("analysis").asText());
        assertEquals(1, deliverables.path("recommendations").size());
    }

    @Test
    void testParse_IgnoresBracesInTrailingProse() {
        String json = "{\"deliverables\": {\"analysis\": \"Cache misses in src/cache/Store.java\"}}";

        ParseOutcome outcome = parser.parse(json + " Let me know if you want me to expand on {section}.");

        assertEquals(List.of(ResilientJsonParser.FIX_EXTRACTED), outcome.fixesApplied());
        assertEquals("Cache misses in src/cache/Store.java",
                outcome.structure().path("deliverables").path("analysis").asText());
    }

    @Test
    void testParse_PartialExtractionReachesNestedValues() {
        ParseOutcome outcome = parser.parse("{\"deliverables\": {\"analysis\": \"Found SQL injection in src/db/Query.java\" "
                + "\"recommendations\": [\"Use prepared statements\"]}}");

        assertEquals(List.of(ResilientJsonParser.FIX_PARTIAL), outcome.fixesApplied());
        assertFalse(outcome.fallback());
        assertEquals("Found SQL injection in src/db/Query.java", outcome.structure().path("analysis").asText());
        assertEquals("Use prepared statements", outcome.structure().path("recommendations").path(0).asText());
        assertFalse(outcome.structure().has("deliverables"));
    }

    @Test
    void testParse_ProseFallsBackToSynthesizedStructure() {
        String prose = """
                I looked through the authentication module and found several weak spots in the session handling.
                - Rotate session identifiers after login succeeds
                - Add rate limiting to the password reset endpoint
                """;

        ParseOutcome outcome = parser.parse(prose);

        assertTrue(outcome.fallback());
        assertEquals(ResilientJsonParser.FIX_FALLBACK, outcome.fixesApplied().get(outcome.fixesApplied().size() - 1));
        JsonNode root = outcome.structure();
        assertTrue(root.path("deliverables").path("analysis").asText().startsWith("I looked through"));
        assertEquals(2, root.path("deliverables").path("recommendations").size());
        assertEquals("partial", root.path("metadata").path("task_completion_status").asText());
        assertEquals("low", root.path("metadata").path("confidence_level").asText());
    }

    @Test
    void testParse_EmptyInputIsRejected() {
        assertThrows(ParseRecoveryExhaustedException.class, () -> parser.parse("   "));
        assertThrows(ParseRecoveryExhaustedException.class, () -> parser.parse(null));
    }

    @Test
    void testExtractProperties() {
        assertNotNull(parser.extractProperties("\"analysis\": \"x\", \"count\": 3"));
        assertEquals(3, parser.extractProperties("\"analysis\": \"x\", \"count\": 3").path("count").asInt());
        assertNull(parser.extractProperties("nothing keyed here"));
        assertEquals("x", parser.extractProperties("{\"deliverables\": {\"analysis\": \"x\", \"n\": 2").path("analysis").asText());
    }
}
