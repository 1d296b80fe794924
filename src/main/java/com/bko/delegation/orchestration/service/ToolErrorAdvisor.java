package com.bko.delegation.orchestration.service;

import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

import static com.bko.delegation.orchestration.OrchestrationConstants.TOOL_FAILED_MESSAGE;
import static com.bko.delegation.orchestration.OrchestrationConstants.TOOL_NOT_AVAILABLE_MESSAGE;
import static com.bko.delegation.orchestration.OrchestrationConstants.TOOL_NOT_FOUND;

/**
 * Builds the corrective message appended to a worker conversation after a failed tool call.
 */
@Component
public class ToolErrorAdvisor {

    private static final int MAX_SUGGESTIONS = 3;
    private static final double MIN_SIMILARITY = 0.5;

    public String advise(String toolName, @Nullable String error, Collection<String> availableTools) {
        String available = availableTools.isEmpty() ? "none" : String.join(", ", availableTools);
        if (isNotFound(error)) {
            List<String> similar = similarTools(toolName, availableTools);
            String suggestion = similar.isEmpty() ? "" : " Did you mean: " + String.join(", ", similar) + "?";
            return String.format(TOOL_NOT_AVAILABLE_MESSAGE, toolName, suggestion, available);
        }
        String reason = StringUtils.hasText(error) ? error : "unknown error";
        return String.format(TOOL_FAILED_MESSAGE, toolName, reason, available);
    }

    public List<String> similarTools(String toolName, Collection<String> availableTools) {
        String target = toolName == null ? "" : toolName.toLowerCase(Locale.ROOT);
        List<String> matches = new ArrayList<>();
        if (target.isEmpty()) {
            return matches;
        }
        for (String candidate : availableTools) {
            String name = candidate.toLowerCase(Locale.ROOT);
            if (name.contains(target) || target.contains(name) || similarity(target, name) > MIN_SIMILARITY) {
                matches.add(candidate);
                if (matches.size() == MAX_SUGGESTIONS) {
                    break;
                }
            }
        }
        return matches;
    }

    static boolean isNotFound(@Nullable String error) {
        if (error == null) {
            return false;
        }
        return error.contains(TOOL_NOT_FOUND) || error.contains("-32601");
    }

    static double similarity(String a, String b) {
        int longer = Math.max(a.length(), b.length());
        if (longer == 0) {
            return 1.0;
        }
        return (longer - levenshtein(a, b)) / (double) longer;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
