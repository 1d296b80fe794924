package com.bko.delegation.orchestration.service;

import com.bko.delegation.error.InvalidTaskSpecificationException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rejects tasks that tell a worker which tool to use. Workers may have a different tool set than the caller
 * assumes, so a task has to describe what to do rather than how.
 */
@Component
public class TaskSpecificationValidator {

    private static final String IDENT = "([a-zA-Z_][a-zA-Z0-9_]*)";

    private static final List<Pattern> TOOL_MENTION_PATTERNS = List.of(
            Pattern.compile("use\\s+the\\s+" + IDENT + "\\s+tool", Pattern.CASE_INSENSITIVE),
            Pattern.compile("call\\s+the\\s+" + IDENT + "\\s+(tool|function)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("execute\\s+the\\s+" + IDENT + "\\s+(tool|function)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("run\\s+the\\s+" + IDENT + "\\s+tool", Pattern.CASE_INSENSITIVE),
            Pattern.compile("call\\s+" + IDENT + "\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("execute\\s+" + IDENT + "\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("use\\s+" + IDENT + "\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("use\\s+" + IDENT + "\\s+to\\s+(read|write|search|find|analyze)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("with\\s+the\\s+" + IDENT + "\\s+tool", Pattern.CASE_INSENSITIVE),
            Pattern.compile("via\\s+the\\s+" + IDENT + "\\s+tool", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(read_file|write_file|list_dir|file_search|grep_search|git_diff|git_status"
                    + "|memory_search|spawn_agent|validate_output)\\b", Pattern.CASE_INSENSITIVE));

    private static final String REMEDIATION = "Describe WHAT needs to be done, not HOW. Instead of \"Use the read_file "
            + "tool to analyze code\", say \"Analyze the code structure and identify issues\".";

    public void validate(@Nullable String task, @Nullable String context, @Nullable String sessionId) {
        List<String> detected = detectToolMentions(task, context);
        if (!detected.isEmpty()) {
            throw new InvalidTaskSpecificationException(
                    "Task description contains tool call mentions: " + String.join(", ", detected)
                            + ". Sub-agents have different tool capabilities.",
                    sessionId, detected, REMEDIATION);
        }
    }

    public List<String> detectToolMentions(@Nullable String task, @Nullable String context) {
        String text = (task == null ? "" : task) + " " + (context == null ? "" : context);
        List<String> detected = new ArrayList<>();
        for (Pattern pattern : TOOL_MENTION_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                detected.add(matcher.group());
            }
        }
        return detected;
    }
}
