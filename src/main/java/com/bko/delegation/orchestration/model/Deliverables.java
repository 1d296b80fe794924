package com.bko.delegation.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

/**
 * @param additional any further deliverable keys the worker returned, kept verbatim
 */
public record Deliverables(
        String analysis,
        List<String> recommendations,
        List<String> documents,
        @Nullable String technicalDetails,
        Map<String, Object> additional
) {
    public Deliverables {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        documents = documents == null ? List.of() : List.copyOf(documents);
        additional = additional == null ? Map.of() : Map.copyOf(additional);
    }
}
