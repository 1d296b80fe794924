package com.bko.delegation.api;

import jakarta.validation.constraints.NotBlank;

/**
 * @param enableRefinement defaults to true when omitted
 */
public record ValidateOutputRequest(
        @NotBlank String response,
        @NotBlank String requirements,
        @NotBlank String qualityCriteria,
        String role,
        String sessionId,
        Boolean enableRefinement
) {
    public boolean refinementEnabled() {
        return enableRefinement == null || enableRefinement;
    }
}
