package com.bko.delegation.orchestration.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AgentStatus {
    SUCCESS, FAILED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
