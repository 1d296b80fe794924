package com.bko.delegation.orchestration.quality.rules;

import com.bko.delegation.orchestration.model.RuleResult;
import com.bko.delegation.orchestration.model.Severity;
import com.bko.delegation.orchestration.model.WorkerResponse;
import com.bko.delegation.orchestration.quality.ValidationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@Order(6)
public class FilePathSpecificityRule extends AbstractQualityRule {

    private static final List<Pattern> FILE_PATHS = List.of(
            Pattern.compile("[a-zA-Z0-9_-]+/[a-zA-Z0-9_/-]+\\.[a-zA-Z0-9]+"),
            Pattern.compile("src/[a-zA-Z0-9_/-]+"),
            Pattern.compile("config/[a-zA-Z0-9_/-]+"),
            Pattern.compile("\\./[a-zA-Z0-9_/-]+"),
            Pattern.compile("/[a-zA-Z0-9_/-]+\\.[a-zA-Z0-9]+"));
    private static final List<Pattern> LINE_REFERENCES = List.of(
            Pattern.compile("lines?\\s+\\d+(-\\d+)?", Pattern.CASE_INSENSITIVE),
            Pattern.compile(":\\d+"));
    private static final List<Pattern> DIRECTORIES = List.of(
            Pattern.compile("src/[a-zA-Z0-9_-]+"),
            Pattern.compile("components?/[a-zA-Z0-9_-]+"),
            Pattern.compile("utils?/[a-zA-Z0-9_-]+"),
            Pattern.compile("services?/[a-zA-Z0-9_-]+"));

    public FilePathSpecificityRule() {
        super("file_path_specificity", "specificity", 0.25);
    }

    @Override
    public boolean technicalOnly() {
        return true;
    }

    @Override
    public RuleResult evaluate(WorkerResponse response, ValidationContext context) {
        String text = analysisAndRecommendations(response);
        int points = 0;
        List<String> issues = new ArrayList<>();

        Set<String> paths = new HashSet<>();
        for (Pattern pattern : FILE_PATHS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                paths.add(matcher.group());
            }
        }
        if (paths.size() >= 3) {
            points += 50;
        } else if (!paths.isEmpty()) {
            points += 25;
        } else {
            issues.add("no specific file paths found");
        }
        if (LINE_REFERENCES.stream().anyMatch(p -> p.matcher(text).find())) {
            points += 30;
        } else {
            issues.add("no line number references found");
        }
        if (DIRECTORIES.stream().anyMatch(p -> p.matcher(text).find())) {
            points += 20;
        }

        String feedback = issues.isEmpty()
                ? "Good file specificity: Found " + paths.size() + " specific file paths"
                : "File specificity issues: " + String.join(", ", issues) + ". Found " + paths.size() + " file references.";
        return result(points >= 50, points, points < 25 ? Severity.CRITICAL : Severity.IMPORTANT, feedback);
    }
}
