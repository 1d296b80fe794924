package com.bko.delegation.orchestration.parsing;

import com.bko.delegation.orchestration.model.CompletionStatus;
import com.bko.delegation.orchestration.model.ConfidenceLevel;
import com.bko.delegation.orchestration.model.Deliverables;
import com.bko.delegation.orchestration.model.MemoryOperation;
import com.bko.delegation.orchestration.model.ResponseMetadata;
import com.bko.delegation.orchestration.model.ToolRequest;
import com.bko.delegation.orchestration.model.WorkerResponse;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Normalizes a recovered JSON structure into a {@link WorkerResponse}. Both snake_case and camelCase keys are
 * accepted; every missing field is filled with a low-confidence default and recorded in
 * {@link WorkerResponse#defaultedFields()}.
 */
@Component
@RequiredArgsConstructor
public class WorkerResponseAssembler {

    public static final String DEFAULT_ANALYSIS = "Analysis extracted from malformed response";
    public static final String DEFAULT_PROCESSING_TIME = "parsing_recovery";

    public static final String FIELD_DELIVERABLES = "deliverables";
    public static final String FIELD_ANALYSIS = "deliverables.analysis";
    public static final String FIELD_RECOMMENDATIONS = "deliverables.recommendations";
    public static final String FIELD_DOCUMENTS = "deliverables.documents";
    public static final String FIELD_MEMORY_OPERATIONS = "memory_operations";
    public static final String FIELD_METADATA = "metadata";
    public static final String FIELD_COMPLETION_STATUS = "metadata.task_completion_status";
    public static final String FIELD_CONFIDENCE = "metadata.confidence_level";
    public static final String FIELD_PROCESSING_TIME = "metadata.processing_time";

    private static final Set<String> KNOWN_DELIVERABLE_KEYS = Set.of(
            "analysis", "recommendations", "documents", "technical_details", "technicalDetails");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    /**
     * @param role executing role; overrides whatever role the worker claimed. When null the claimed role is kept.
     */
    public WorkerResponse assemble(ParseOutcome outcome, @Nullable String role) {
        JsonNode root = outcome.structure();
        List<String> defaulted = new ArrayList<>();
        if (outcome.fallback()) {
            defaulted.add(FIELD_DELIVERABLES);
            defaulted.add(FIELD_MEMORY_OPERATIONS);
            defaulted.add(FIELD_METADATA);
        }

        JsonNode deliverablesNode = root.path("deliverables");
        boolean nested = deliverablesNode.isObject();
        if (!nested) {
            // scraped or flattened output keeps deliverable keys at the top level
            addOnce(defaulted, FIELD_DELIVERABLES);
            deliverablesNode = root;
        }
        Deliverables deliverables = readDeliverables(deliverablesNode, nested, defaulted);

        List<MemoryOperation> memoryOperations = new ArrayList<>();
        JsonNode memoryNode = first(root, "memory_operations", "memoryOperations");
        if (memoryNode != null && memoryNode.isArray()) {
            memoryNode.forEach(op -> {
                if (op.isObject()) {
                    memoryOperations.add(new MemoryOperation(text(op, "operation", "type"), toMap(op.path("data"))));
                }
            });
        } else {
            addOnce(defaulted, FIELD_MEMORY_OPERATIONS);
        }

        JsonNode metadataNode = root.path("metadata");
        if (!metadataNode.isObject()) {
            addOnce(defaulted, FIELD_METADATA);
            metadataNode = root;
        }
        ResponseMetadata metadata = readMetadata(metadataNode, role, defaulted);

        return new WorkerResponse(deliverables, memoryOperations, metadata, readToolRequest(root), null, defaulted);
    }

    /**
     * Lists structural problems of a recovered worker response. An empty list means the structure is complete.
     */
    public List<String> validateStructure(JsonNode root) {
        List<String> issues = new ArrayList<>();
        if (root == null || !root.isObject()) {
            issues.add("Response is not a JSON object");
            return issues;
        }
        if (!root.path("deliverables").isObject()) {
            issues.add("Missing or invalid deliverables object");
        }
        JsonNode memory = first(root, "memory_operations", "memoryOperations");
        if (memory != null && !memory.isArray()) {
            issues.add("memory_operations must be an array");
        }
        JsonNode metadata = root.path("metadata");
        if (!metadata.isObject()) {
            issues.add("Missing or invalid metadata object");
        } else {
            if (first(metadata, "chatmode", "role") == null) {
                issues.add("Missing metadata.chatmode");
            }
            if (first(metadata, "task_completion_status", "completionStatus", "completion_status") == null) {
                issues.add("Missing metadata.task_completion_status");
            }
        }
        return issues;
    }

    /**
     * True when the worker itself reported both a completion status and a confidence level.
     */
    public boolean metadataComplete(ParseOutcome outcome) {
        if (outcome.fallback()) {
            return false;
        }
        JsonNode metadata = outcome.structure().path("metadata");
        return metadata.isObject()
                && first(metadata, "task_completion_status", "completionStatus", "completion_status") != null
                && first(metadata, "confidence_level", "confidenceLevel") != null;
    }

    private Deliverables readDeliverables(JsonNode node, boolean nested, List<String> defaulted) {
        String analysis = text(node, "analysis");
        if (!StringUtils.hasText(analysis)) {
            analysis = DEFAULT_ANALYSIS;
            defaulted.add(FIELD_ANALYSIS);
        }
        JsonNode recommendationsNode = node.get("recommendations");
        if (recommendationsNode == null || !recommendationsNode.isArray()) {
            defaulted.add(FIELD_RECOMMENDATIONS);
        }
        JsonNode documentsNode = node.get("documents");
        if (documentsNode == null || !documentsNode.isArray()) {
            defaulted.add(FIELD_DOCUMENTS);
        }
        JsonNode technical = first(node, "technical_details", "technicalDetails");
        String technicalDetails = technical == null ? null : technical.isTextual() ? technical.asText() : technical.toString();

        Map<String, Object> additional = new LinkedHashMap<>();
        if (nested) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!KNOWN_DELIVERABLE_KEYS.contains(field.getKey()) && !field.getValue().isNull()) {
                    additional.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
                }
            }
        }
        return new Deliverables(analysis, strings(recommendationsNode), strings(documentsNode), technicalDetails, additional);
    }

    private ResponseMetadata readMetadata(JsonNode node, @Nullable String role, List<String> defaulted) {
        String status = text(node, "task_completion_status", "completionStatus", "completion_status");
        if (status == null) {
            defaulted.add(FIELD_COMPLETION_STATUS);
        }
        String confidence = text(node, "confidence_level", "confidenceLevel");
        if (confidence == null) {
            defaulted.add(FIELD_CONFIDENCE);
        }
        String processingTime = text(node, "processing_time", "processingTime");
        if (processingTime == null) {
            processingTime = DEFAULT_PROCESSING_TIME;
            defaulted.add(FIELD_PROCESSING_TIME);
        }
        String claimedRole = text(node, "chatmode", "role");
        String effectiveRole = StringUtils.hasText(role) ? role : StringUtils.hasText(claimedRole) ? claimedRole : "unknown";
        return new ResponseMetadata(
                effectiveRole,
                CompletionStatus.fromWire(status, CompletionStatus.PARTIAL),
                ConfidenceLevel.fromWire(confidence, ConfidenceLevel.LOW),
                processingTime);
    }

    @Nullable
    private ToolRequest readToolRequest(JsonNode root) {
        JsonNode tool = root.get("tool");
        if (tool == null || !tool.isTextual() || !StringUtils.hasText(tool.asText())) {
            return null;
        }
        return new ToolRequest(tool.asText(), toMap(root.path("arguments")), null);
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private static List<String> strings(@Nullable JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        node.forEach(item -> {
            String value = item.isTextual() ? item.asText() : item.toString();
            if (StringUtils.hasText(value)) {
                values.add(value);
            }
        });
        return values;
    }

    @Nullable
    private static JsonNode first(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    @Nullable
    private static String text(JsonNode node, String... names) {
        JsonNode value = first(node, names);
        if (value == null) {
            return null;
        }
        String text = value.isValueNode() ? value.asText() : value.toString();
        return StringUtils.hasText(text) ? text : null;
    }

    private static void addOnce(List<String> values, String value) {
        if (!values.contains(value)) {
            values.add(value);
        }
    }
}
