package com.bko.delegation.orchestration.quality.rules;

import com.bko.delegation.orchestration.model.RuleResult;
import com.bko.delegation.orchestration.model.Severity;
import com.bko.delegation.orchestration.model.WorkerResponse;
import com.bko.delegation.orchestration.quality.ValidationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Component
@Order(7)
public class CodeSnippetPresenceRule extends AbstractQualityRule {

    private static final List<Pattern> CODE = List.of(
            Pattern.compile("```[\\s\\S]*?```"),
            Pattern.compile("`[^`\\n]+`"),
            Pattern.compile("\\{\\s*[\\s\\S]*?\\s*}"),
            Pattern.compile("function\\s+[a-zA-Z_][a-zA-Z0-9_]*\\s*\\("),
            Pattern.compile("class\\s+[a-zA-Z_][a-zA-Z0-9_]*"),
            Pattern.compile("const\\s+[a-zA-Z_][a-zA-Z0-9_]*\\s*="),
            Pattern.compile("if\\s*\\([^)]+\\)\\s*\\{"),
            Pattern.compile("SELECT\\s+[\\s\\S]*FROM", Pattern.CASE_INSENSITIVE),
            Pattern.compile("CREATE\\s+TABLE", Pattern.CASE_INSENSITIVE));
    private static final List<String> GENERIC_TERMS = List.of("example", "pseudo", "sample", "template", "placeholder");

    public CodeSnippetPresenceRule() {
        super("code_snippet_presence", "specificity", 0.25);
    }

    @Override
    public boolean technicalOnly() {
        return true;
    }

    @Override
    public Set<String> excludedRoles() {
        return Set.of("test engineer");
    }

    @Override
    public RuleResult evaluate(WorkerResponse response, ValidationContext context) {
        String text = analysisAndRecommendations(response);
        int points = 0;
        List<String> issues = new ArrayList<>();

        int snippets = CODE.stream().mapToInt(p -> countMatches(p, text)).sum();
        if (snippets >= 3) {
            points += 60;
        } else if (snippets >= 1) {
            points += 30;
        } else {
            issues.add("no code snippets found");
        }
        boolean generic = countContained(GENERIC_TERMS, text.toLowerCase(Locale.ROOT)) > 0;
        if (snippets > 0 && !generic) {
            points += 40;
        } else if (snippets > 0) {
            points += 20;
            issues.add("appears to use generic examples rather than actual code");
        }

        String feedback = issues.isEmpty()
                ? "Good code specificity: Found " + snippets + " actual code snippets"
                : "Code snippet issues: " + String.join(", ", issues) + ". Found " + snippets + " code references.";
        return result(points >= 50, points, points < 30 ? Severity.CRITICAL : Severity.IMPORTANT, feedback);
    }
}
