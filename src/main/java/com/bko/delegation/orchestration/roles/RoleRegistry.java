package com.bko.delegation.orchestration.roles;

import com.bko.delegation.config.DelegationProperties;
import com.bko.delegation.error.UnknownRoleException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable index of worker roles, loaded once from Markdown files with a YAML front matter block:
 * <pre>
 * ---
 * name: Security Engineer
 * description: Finds and fixes vulnerabilities
 * tools: [read_file, grep_search]
 * quality-threshold: 0.8
 * ---
 * instructions...
 * </pre>
 * Lookups are case-insensitive.
 */
@Service
@Slf4j
public class RoleRegistry {

    private static final String FRONT_MATTER_DELIMITER = "---";
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final Map<String, RoleDefinition> roles;
    private final DelegationProperties properties;

    public RoleRegistry(DelegationProperties properties) {
        this.properties = properties;
        this.roles = Collections.unmodifiableMap(load(properties.getRoles().getLocation()));
    }

    public RoleDefinition getRole(String name) {
        RoleDefinition role = name == null ? null : roles.get(key(name));
        if (role == null) {
            throw new UnknownRoleException(
                    "Unknown role: " + name,
                    null,
                    Map.of("availableRoles", roles.size()),
                    "Use one of: " + String.join(", ", roleNames()));
        }
        return role;
    }

    public boolean hasRole(String name) {
        return name != null && roles.containsKey(key(name));
    }

    public List<String> roleNames() {
        return roles.values().stream().map(RoleDefinition::name).sorted().toList();
    }

    public List<RoleSummary> listRoles() {
        return roles.values().stream()
                .sorted((a, b) -> a.name().compareToIgnoreCase(b.name()))
                .map(role -> new RoleSummary(role.name(), role.description(), role.tools(), thresholdFor(role)))
                .toList();
    }

    private double thresholdFor(RoleDefinition role) {
        return role.qualityThreshold() != null
                ? role.qualityThreshold()
                : properties.getQuality().thresholdFor(role.name());
    }

    private Map<String, RoleDefinition> load(String location) {
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources(location);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read role definitions from " + location, ex);
        }
        Map<String, RoleDefinition> loaded = new LinkedHashMap<>();
        for (Resource resource : resources) {
            RoleDefinition role = parse(resource);
            if (role == null) {
                continue;
            }
            RoleDefinition previous = loaded.put(key(role.name()), role);
            if (previous != null) {
                log.warn("Duplicate role definition replaced. role={}, previous={}, current={}",
                        role.name(), previous.source(), role.source());
            }
            if (role.qualityThreshold() != null) {
                properties.getQuality().getRoleThresholds().put(key(role.name()), role.qualityThreshold());
            }
        }
        if (loaded.isEmpty()) {
            throw new IllegalStateException("No valid role definitions found at " + location);
        }
        log.info("Loaded worker roles. count={}, roles={}", loaded.size(),
                loaded.values().stream().map(RoleDefinition::name).toList());
        return loaded;
    }

    @Nullable
    RoleDefinition parse(Resource resource) {
        String source = resource.getFilename() != null ? resource.getFilename() : resource.getDescription();
        String content;
        try (InputStream in = resource.getInputStream()) {
            content = new String(in.readAllBytes(), StandardCharsets.UTF_8).replace("\r\n", "\n");
        } catch (IOException ex) {
            log.warn("Failed to read role file. file={}, error={}", source, ex.getMessage());
            return null;
        }
        if (!content.startsWith(FRONT_MATTER_DELIMITER + "\n")) {
            log.warn("Skipping role file without front matter. file={}", source);
            return null;
        }
        int end = content.indexOf("\n" + FRONT_MATTER_DELIMITER, FRONT_MATTER_DELIMITER.length());
        if (end < 0) {
            log.warn("Skipping role file with unterminated front matter. file={}", source);
            return null;
        }
        JsonNode header = readHeader(content.substring(FRONT_MATTER_DELIMITER.length() + 1, end), source);
        if (header == null) {
            return null;
        }
        String body = content.substring(end + FRONT_MATTER_DELIMITER.length() + 1).trim();

        String description = text(header, "description");
        if (description == null) {
            log.warn("Skipping role file without description. file={}", source);
            return null;
        }
        String name = text(header, "name");
        return new RoleDefinition(name != null ? name : nameFromFile(source), description, body, tools(header),
                threshold(header, source), source);
    }

    @Nullable
    private static JsonNode readHeader(String block, String source) {
        try {
            JsonNode header = YAML.readTree(block);
            if (header == null || !header.isObject()) {
                log.warn("Skipping role file whose front matter is not a mapping. file={}", source);
                return null;
            }
            return header;
        } catch (JsonProcessingException ex) {
            log.warn("Skipping role file with invalid front matter. file={}, error={}", source, ex.getOriginalMessage());
            return null;
        }
    }

    @Nullable
    private static String text(JsonNode header, String field) {
        JsonNode value = header.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static List<String> tools(JsonNode header) {
        JsonNode value = header.get("tools");
        if (value == null || value.isNull()) {
            return List.of();
        }
        List<String> tools = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(item -> addTool(tools, item.asText()));
        } else {
            for (String item : value.asText().split(",")) {
                addTool(tools, item);
            }
        }
        return tools;
    }

    private static void addTool(List<String> tools, String name) {
        if (StringUtils.hasText(name)) {
            tools.add(name.trim());
        }
    }

    @Nullable
    private static Double threshold(JsonNode header, String source) {
        JsonNode value = header.get("quality-threshold");
        if (value == null || value.isNull()) {
            return null;
        }
        double threshold;
        if (value.isNumber()) {
            threshold = value.doubleValue();
        } else {
            try {
                threshold = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException ex) {
                log.warn("Ignoring invalid quality threshold. file={}, value={}", source, value.asText());
                return null;
            }
        }
        if (threshold < 0.0 || threshold > 1.0) {
            log.warn("Ignoring out-of-range quality threshold. file={}, value={}", source, threshold);
            return null;
        }
        return threshold;
    }

    private static String nameFromFile(String fileName) {
        String base = fileName;
        int dot = base.indexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        StringBuilder name = new StringBuilder();
        for (String part : base.split("[-_\\s]+")) {
            if (part.isEmpty()) {
                continue;
            }
            if (name.length() > 0) {
                name.append(' ');
            }
            name.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return name.toString();
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
