package com.bko.delegation.orchestration.service;

public record ToolCallRecord(String name, String input, String output, boolean success) {
}
