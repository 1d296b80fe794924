package com.bko.delegation.orchestration.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    /**
     * Reads tool-call arguments. Blank or unreadable input yields an empty map so the tool itself reports
     * the missing parameters to the worker.
     */
    public Map<String, Object> readArguments(String label, @Nullable String raw) {
        if (!StringUtils.hasText(raw)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(raw, ARGUMENTS_TYPE);
            return parsed == null ? new LinkedHashMap<>() : parsed;
        } catch (JsonProcessingException ex) {
            log.warn("Failed to parse {} arguments as JSON. Snippet: {}", label, truncate(raw, 240));
            return new LinkedHashMap<>();
        }
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return "\"serialization-failed-" + UUID.randomUUID() + "\"";
        }
    }

    public String toCompactJson(Object value) throws JsonProcessingException {
        return objectMapper.writeValueAsString(value);
    }

    public static String truncate(@Nullable String value, int maxLength) {
        if (value == null) {
            return "";
        }
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }
}
