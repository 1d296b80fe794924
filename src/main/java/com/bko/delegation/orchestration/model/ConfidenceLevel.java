package com.bko.delegation.orchestration.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConfidenceLevel {
    LOW, MEDIUM, HIGH;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConfidenceLevel fromWire(String value, ConfidenceLevel fallback) {
        if (value == null) {
            return fallback;
        }
        for (ConfidenceLevel level : values()) {
            if (level.wireValue().equalsIgnoreCase(value.trim())) {
                return level;
            }
        }
        return fallback;
    }
}
