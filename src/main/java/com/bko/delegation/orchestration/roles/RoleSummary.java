package com.bko.delegation.orchestration.roles;

import java.util.List;

public record RoleSummary(String name, String description, List<String> tools, double qualityThreshold) {
}
