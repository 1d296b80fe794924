package com.bko.delegation.orchestration.parsing;

import com.bko.delegation.error.ParseRecoveryExhaustedException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a JSON object from worker output that may be wrapped in prose, truncated or hand-written.
 * <p>
 * Strategies run in order and stop at the first one that yields an object: direct parse, extraction of the
 * largest balanced object, cumulative text repairs, key/value scraping, and finally a synthesized object built
 * from whatever prose fragments can be found. Only empty input is rejected.
 */
@Component
@Slf4j
public class ResilientJsonParser {

    static final String FIX_EXTRACTED = "Extracted JSON from surrounding text";
    static final String FIX_TRAILING_COMMAS = "Removed trailing commas";
    static final String FIX_BARE_KEYS = "Added quotes to property names";
    static final String FIX_SINGLE_QUOTES = "Converted single quotes to double quotes";
    static final String FIX_BALANCED = "Added missing closing brackets";
    static final String FIX_NEWLINES = "Escaped newlines inside strings";
    static final String FIX_PARTIAL = "Partial property extraction";
    static final String FIX_FALLBACK = "Created fallback object from content";

    // Object values are not captured, so their own pairs are matched instead. Arrays are taken only when flat.
    private static final Pattern PROPERTY = Pattern.compile(
            "\"([^\"]+)\"\\s*:\\s*(\"(?:[^\"\\\\]|\\\\.)*\"|\\[[^\\[\\]{}]*]|[^\\s,{}\\[\\]\"][^,}\\]]*)");
    private static final Pattern ANALYSIS = Pattern.compile("\"analysis\"\\s*:\\s*\"((?:[^\"\\\\]|\\\\.)+)\"");
    private static final Pattern RECOMMENDATIONS = Pattern.compile("\"recommendations\"\\s*:\\s*\\[([^\\]]+)]");
    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*•]|\\d+[.)])\\s+(.+)$");
    private static final int MAX_FALLBACK_RECOMMENDATIONS = 5;
    private static final int FALLBACK_ANALYSIS_CHARS = 500;

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;
    private final List<Repair> repairs = List.of(
            new Repair(FIX_TRAILING_COMMAS, JsonRepairs::removeTrailingCommas),
            new Repair(FIX_BARE_KEYS, JsonRepairs::quoteBareKeys),
            new Repair(FIX_SINGLE_QUOTES, JsonRepairs::convertSingleQuotes),
            new Repair(FIX_BALANCED, JsonRepairs::balanceBrackets),
            new Repair(FIX_NEWLINES, JsonRepairs::escapeNewlinesInStrings));

    public ResilientJsonParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ParseOutcome parse(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ParseRecoveryExhaustedException("Worker response is empty; nothing to parse.");
        }
        String text = raw.trim();
        JsonNode direct = tryObject(text);
        if (direct != null) {
            return new ParseOutcome(direct, List.of(), false);
        }

        List<String> fixes = new ArrayList<>();
        for (String object : JsonRepairs.balancedObjects(text)) {
            if (object.equals(text)) {
                continue;
            }
            JsonNode node = tryObject(object);
            if (node != null) {
                fixes.add(FIX_EXTRACTED);
                return recovered(node, fixes, raw);
            }
        }
        String candidate = JsonRepairs.repairBase(text);
        if (!candidate.equals(text)) {
            fixes.add(FIX_EXTRACTED);
        }

        for (Repair repair : repairs) {
            String repaired = repair.apply(candidate);
            if (repaired.equals(candidate)) {
                continue;
            }
            candidate = repaired;
            fixes.add(repair.name());
            JsonNode node = tryObject(candidate);
            if (node != null) {
                return recovered(node, fixes, raw);
            }
        }

        ObjectNode partial = extractProperties(candidate);
        if (partial != null) {
            fixes.add(FIX_PARTIAL);
            return recovered(partial, fixes, raw);
        }

        fixes.add(FIX_FALLBACK);
        log.warn("All JSON recovery strategies failed; using fallback structure. Snippet: {}", truncate(raw, 240));
        return new ParseOutcome(fallbackObject(raw), fixes, true);
    }

    @Nullable
    private JsonNode tryObject(String text) {
        try {
            JsonNode node = strictReader.readTree(text);
            return node != null && node.isObject() ? node : null;
        } catch (Exception ex) {
            return null;
        }
    }

    @Nullable
    ObjectNode extractProperties(String text) {
        ObjectNode result = objectMapper.createObjectNode();
        Matcher matcher = PROPERTY.matcher(text);
        while (matcher.find()) {
            String key = matcher.group(1);
            String value = matcher.group(2).trim();
            if (!value.isEmpty()) {
                result.set(key, scalar(value));
            }
        }
        return result.isEmpty() ? null : result;
    }

    private JsonNode scalar(String value) {
        JsonNode node = tryValue(value);
        if (node != null) {
            return node;
        }
        if (value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
            return objectMapper.getNodeFactory().textNode(value.substring(1, value.length() - 1));
        }
        return objectMapper.getNodeFactory().textNode(value);
    }

    @Nullable
    private JsonNode tryValue(String text) {
        try {
            JsonNode node = strictReader.readTree(text);
            return node == null || node.isMissingNode() ? null : node;
        } catch (Exception ex) {
            return null;
        }
    }

    ObjectNode fallbackObject(String raw) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode deliverables = root.putObject("deliverables");
        deliverables.put("analysis", fallbackAnalysis(raw));
        ArrayNode recommendations = deliverables.putArray("recommendations");
        fallbackRecommendations(raw).forEach(recommendations::add);
        deliverables.putArray("documents");
        root.putArray("memory_operations");
        ObjectNode metadata = root.putObject("metadata");
        metadata.put("task_completion_status", "partial");
        metadata.put("confidence_level", "low");
        metadata.put("processing_time", "parsing_recovery");
        return root;
    }

    private String fallbackAnalysis(String raw) {
        Matcher matcher = ANALYSIS.matcher(raw);
        if (matcher.find()) {
            JsonNode unescaped = tryValue("\"" + matcher.group(1) + "\"");
            return unescaped != null ? unescaped.asText() : matcher.group(1);
        }
        List<String> meaningful = new ArrayList<>();
        for (String line : raw.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.length() > 30 && !trimmed.startsWith("#") && !trimmed.startsWith("```")) {
                meaningful.add(trimmed);
                if (meaningful.size() == 3) {
                    break;
                }
            }
        }
        if (!meaningful.isEmpty()) {
            return String.join(" ", meaningful);
        }
        String trimmed = raw.trim();
        return trimmed.length() <= FALLBACK_ANALYSIS_CHARS ? trimmed : trimmed.substring(0, FALLBACK_ANALYSIS_CHARS);
    }

    private List<String> fallbackRecommendations(String raw) {
        List<String> recommendations = new ArrayList<>();
        Matcher listMatcher = RECOMMENDATIONS.matcher(raw);
        if (listMatcher.find()) {
            JsonNode array = tryValue("[" + listMatcher.group(1) + "]");
            if (array != null && array.isArray()) {
                array.forEach(item -> recommendations.add(item.asText()));
                return limit(recommendations);
            }
        }
        for (String line : raw.split("\\R")) {
            Matcher bullet = BULLET.matcher(line);
            if (bullet.matches()) {
                String item = bullet.group(1).trim();
                if (item.length() > 10) {
                    recommendations.add(item);
                }
            }
            if (recommendations.size() == MAX_FALLBACK_RECOMMENDATIONS) {
                break;
            }
        }
        return limit(recommendations);
    }

    private ParseOutcome recovered(JsonNode node, List<String> fixes, String raw) {
        log.info("Recovered worker output with fixes={}, originalLength={}", fixes, raw.length());
        return new ParseOutcome(node, fixes, false);
    }

    private static List<String> limit(List<String> values) {
        return values.size() <= MAX_FALLBACK_RECOMMENDATIONS ? values : values.subList(0, MAX_FALLBACK_RECOMMENDATIONS);
    }

    private static String truncate(String value, int maxLength) {
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }

    private record Repair(String name, UnaryOperator<String> operator) {
        String apply(String text) {
            return operator.apply(text);
        }
    }
}
