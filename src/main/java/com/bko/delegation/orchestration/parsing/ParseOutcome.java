package com.bko.delegation.orchestration.parsing;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Result of a recovery run.
 *
 * @param structure     recovered JSON object, never null
 * @param fixesApplied  names of the repairs that fired, in order
 * @param fallback      true when nothing parseable was found and the structure was synthesized from prose
 */
public record ParseOutcome(JsonNode structure, List<String> fixesApplied, boolean fallback) {

    public ParseOutcome {
        fixesApplied = fixesApplied == null ? List.of() : List.copyOf(fixesApplied);
    }

    public boolean recovered() {
        return !fixesApplied.isEmpty();
    }
}
