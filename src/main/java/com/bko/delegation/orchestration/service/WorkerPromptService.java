package com.bko.delegation.orchestration.service;

import com.bko.delegation.config.DelegationProperties;
import com.bko.delegation.error.TemplateRenderingFailedException;
import com.bko.delegation.orchestration.model.TaskSpec;
import com.bko.delegation.orchestration.model.ToolDescriptor;
import com.bko.delegation.orchestration.roles.RoleDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.ai.template.st.StTemplateRenderer;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.bko.delegation.orchestration.OrchestrationConstants.*;

/**
 * Composes the worker's system instructions from its role, the task and the tools it may use.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkerPromptService {

    private static final StTemplateRenderer RENDERER = StTemplateRenderer.builder()
            .startDelimiterToken('<')
            .endDelimiterToken('>')
            .build();

    private final DelegationProperties properties;
    private final ObjectMapper objectMapper;

    public String workerSystemPrompt(RoleDefinition role, TaskSpec task, String sessionId, List<ToolDescriptor> tools) {
        if (!StringUtils.hasText(role.instructions())) {
            throw new TemplateRenderingFailedException(
                    "Role " + role.name() + " has no instructions (" + role.source() + ")", sessionId, null);
        }
        Map<String, Object> variables = new HashMap<>();
        variables.put("role", role.name());
        variables.put("sessionId", sessionId);
        variables.put("maxIterations", String.valueOf(properties.getExecution().getMaxIterations()));
        variables.put("toolCallFormat", TOOL_CALL_FORMAT);
        variables.put("toolDocumentation", toolDocumentation(tools));
        variables.put("instructions", role.instructions().trim());
        variables.put("outputSchema", WORKER_OUTPUT_SCHEMA.formatted(role.name()));
        variables.put("task", orNone(task.task()));
        variables.put("context", orNone(task.context()));
        variables.put("expectedDeliverables", orNone(task.expectedDeliverables()));
        String rendered;
        try {
            rendered = PromptTemplate.builder()
                    .renderer(RENDERER)
                    .template(WORKER_PROMPT_TEMPLATE)
                    .build()
                    .render(variables);
        } catch (RuntimeException ex) {
            throw new TemplateRenderingFailedException(
                    "Worker instructions for role " + role.name() + " could not be rendered: " + ex.getMessage(), sessionId, ex);
        }
        if (!StringUtils.hasText(rendered)) {
            throw new TemplateRenderingFailedException(
                    "Worker instructions for role " + role.name() + " rendered empty", sessionId, null);
        }
        return rendered;
    }

    String toolDocumentation(List<ToolDescriptor> tools) {
        if (tools == null || tools.isEmpty()) {
            return NO_TOOLS_DOCUMENTATION;
        }
        Map<String, List<ToolDescriptor>> sections = new LinkedHashMap<>();
        for (String section : List.of("FILE OPERATIONS", "SEARCH OPERATIONS", "VERSION CONTROL", "MEMORY OPERATIONS", "OTHER TOOLS")) {
            sections.put(section, new ArrayList<>());
        }
        for (ToolDescriptor tool : tools) {
            sections.get(sectionFor(tool.name())).add(tool);
        }
        StringBuilder sb = new StringBuilder();
        sb.append("AVAILABLE TOOLS (").append(tools.size()).append(" tools available):\n\n");
        sections.forEach((section, entries) -> {
            if (entries.isEmpty()) {
                return;
            }
            sb.append(section).append(":\n");
            for (ToolDescriptor tool : entries) {
                sb.append("- ").append(tool.name()).append(": ").append(tool.description()).append('\n');
                String example = exampleArguments(tool.inputSchema());
                if (example != null) {
                    sb.append("  Example: {\"tool\": \"").append(tool.name()).append("\", \"arguments\": ")
                            .append(example).append("}\n");
                }
            }
            sb.append('\n');
        });
        sb.append("Use EXACT tool names from the list above. Calling a tool that does not exist returns an error with suggestions.");
        return sb.toString();
    }

    static String sectionFor(String toolName) {
        String name = toolName.toLowerCase(Locale.ROOT);
        if (name.contains("file") || name.contains("read") || name.contains("write")) {
            return "FILE OPERATIONS";
        }
        if (name.contains("search") || name.contains("grep") || name.contains("find")) {
            return "SEARCH OPERATIONS";
        }
        if (name.contains("git")) {
            return "VERSION CONTROL";
        }
        if (name.contains("memory")) {
            return "MEMORY OPERATIONS";
        }
        return "OTHER TOOLS";
    }

    /**
     * Example arguments derived from a JSON schema's properties, or null when the schema declares none.
     */
    @Nullable
    String exampleArguments(@Nullable String inputSchema) {
        if (!StringUtils.hasText(inputSchema)) {
            return null;
        }
        JsonNode schema;
        try {
            schema = objectMapper.readTree(inputSchema);
        } catch (JsonProcessingException ex) {
            log.debug("Tool input schema is not valid JSON. Snippet: {}", JsonProcessingService.truncate(inputSchema, 240));
            return null;
        }
        JsonNode props = schema.path("properties");
        if (!props.isObject() || props.isEmpty()) {
            return null;
        }
        ObjectNode example = objectMapper.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String type = field.getValue().path("type").asText("");
            switch (type) {
                case "string" -> example.put(field.getKey(), "example_" + field.getKey());
                case "number", "integer" -> example.put(field.getKey(), 1);
                case "boolean" -> example.put(field.getKey(), true);
                case "array" -> example.putArray(field.getKey());
                case "object" -> example.putObject(field.getKey());
                default -> example.put(field.getKey(), "value");
            }
        }
        return example.toString();
    }

    private static String orNone(@Nullable String value) {
        return StringUtils.hasText(value) ? value : "None provided";
    }
}
