package com.bko.delegation.orchestration.model;

import java.util.Map;

/**
 * A knowledge write proposed by a worker. Never applied by the engine itself.
 */
public record MemoryOperation(String operation, Map<String, Object> data) {
}
