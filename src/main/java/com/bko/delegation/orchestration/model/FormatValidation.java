package com.bko.delegation.orchestration.model;

import java.util.List;

public record FormatValidation(
        boolean valid,
        boolean deliverablesPresent,
        int memoryOperationsCount,
        boolean metadataComplete,
        List<String> structureIssues,
        List<String> fixesApplied
) {
}
