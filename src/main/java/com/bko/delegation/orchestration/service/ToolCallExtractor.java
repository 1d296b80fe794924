package com.bko.delegation.orchestration.service;

import com.bko.delegation.orchestration.model.ToolRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds an inline tool request ({@code {"tool": "...", "arguments": {...}}}) inside free model text,
 * for models that do not use native tool calling.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolCallExtractor {

    private static final Pattern TOOL_OBJECT_START = Pattern.compile("\\{\\s*\"tool\"\\s*:");

    private final ObjectMapper objectMapper;

    public Optional<ToolRequest> extract(@Nullable String text) {
        if (!StringUtils.hasText(text)) {
            return Optional.empty();
        }
        Matcher matcher = TOOL_OBJECT_START.matcher(text);
        while (matcher.find()) {
            String candidate = balancedObject(text, matcher.start());
            if (candidate == null) {
                continue;
            }
            Optional<ToolRequest> request = toRequest(candidate);
            if (request.isPresent()) {
                return request;
            }
        }
        return Optional.empty();
    }

    private Optional<ToolRequest> toRequest(String json) {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            log.debug("Inline tool request is not valid JSON. Snippet: {}", JsonProcessingService.truncate(json, 240));
            return Optional.empty();
        }
        JsonNode tool = node.path("tool");
        if (!tool.isTextual() || !StringUtils.hasText(tool.asText())) {
            return Optional.empty();
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        JsonNode args = node.path("arguments");
        if (args.isObject()) {
            arguments = objectMapper.convertValue(args, new TypeReference<LinkedHashMap<String, Object>>() {});
        }
        return Optional.of(new ToolRequest(tool.asText().trim(), arguments, null));
    }

    /**
     * Returns the object starting at {@code start} up to its matching closing brace, or null when unbalanced.
     */
    @Nullable
    static String balancedObject(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        return null;
    }
}
