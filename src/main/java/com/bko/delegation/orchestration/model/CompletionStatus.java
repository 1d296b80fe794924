package com.bko.delegation.orchestration.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CompletionStatus {
    COMPLETE, PARTIAL, FAILED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CompletionStatus fromWire(String value, CompletionStatus fallback) {
        if (value == null) {
            return fallback;
        }
        for (CompletionStatus status : values()) {
            if (status.wireValue().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return fallback;
    }
}
