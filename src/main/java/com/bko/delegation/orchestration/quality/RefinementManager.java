package com.bko.delegation.orchestration.quality;

import com.bko.delegation.config.DelegationProperties;
import com.bko.delegation.orchestration.model.QualityAssessment;
import com.bko.delegation.orchestration.model.QualityTrend;
import com.bko.delegation.orchestration.model.RefinementOutcome;
import com.bko.delegation.orchestration.model.RefinementState;
import com.bko.delegation.orchestration.model.RefinementStats;
import com.bko.delegation.orchestration.model.RuleResult;
import com.bko.delegation.orchestration.model.Severity;
import com.bko.delegation.orchestration.session.SessionLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.bko.delegation.orchestration.OrchestrationConstants.REFINEMENT_PROMPT_TEMPLATE;

/**
 * Decides whether a failed assessment is worth another worker attempt and writes the instruction for it.
 * Attempt history lives in the {@link SessionLedger}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RefinementManager {

    private static final double WEAK_CATEGORY = 0.70;
    private static final double SUCCESSFUL_GAIN = 0.10;
    private static final int MAX_QUOTED_RESPONSE = 4000;

    private final SessionLedger sessionLedger;
    private final DelegationProperties properties;

    public boolean needsRefinement(QualityAssessment assessment, ValidationContext context, String sessionId) {
        if (assessment.passed() || !assessment.canRefine()) {
            return false;
        }
        int attempts = sessionLedger.getRefinementCount(sessionId, context.role());
        int cap = maxAttempts();
        if (attempts >= cap) {
            log.info("Maximum refinement attempts reached. sessionId={}, role={}, attempts={}", sessionId, context.role(), attempts);
            return false;
        }
        Optional<RefinementState> state = sessionLedger.getRefinementState(sessionId, context.role());
        if (state.isPresent() && state.get().trend() == QualityTrend.DEGRADING) {
            log.info("Refinement abandoned, quality is degrading. sessionId={}, role={}", sessionId, context.role());
            return false;
        }
        return true;
    }

    public String generateRefinementPrompt(QualityAssessment assessment,
                                           ValidationContext context,
                                           String originalTask,
                                           String priorResponse) {
        return String.format(Locale.ROOT, REFINEMENT_PROMPT_TEMPLATE,
                assessment.overallScore(),
                assessment.threshold(),
                bullets(refinementAreas(assessment)),
                bullets(specificFeedback(assessment)),
                bullets(assessment.refinementSuggestions()),
                originalTask,
                quoted(priorResponse),
                context.qualityCriteria().isBlank() ? "Meet the original requirements." : context.qualityCriteria());
    }

    private static String quoted(String priorResponse) {
        String trimmed = priorResponse == null ? "" : priorResponse.trim();
        if (trimmed.isEmpty()) {
            return "(empty)";
        }
        if (trimmed.length() > MAX_QUOTED_RESPONSE) {
            trimmed = trimmed.substring(0, MAX_QUOTED_RESPONSE) + "\n[truncated]";
        }
        return trimmed;
    }

    public RefinementState trackRefinementAttempt(String sessionId, String role, double score, String reason) {
        return sessionLedger.trackRefinementAttempt(sessionId, role, score, reason);
    }

    /**
     * Compares a new assessment against the last recorded attempt without recording it.
     */
    public RefinementOutcome assessRefinementSuccess(String sessionId, String role, QualityAssessment newAssessment) {
        Optional<RefinementState> state = sessionLedger.getRefinementState(sessionId, role);
        if (state.isEmpty() || state.get().scoreHistory().isEmpty()) {
            return new RefinementOutcome(newAssessment.passed(), 0.0, QualityTrend.STABLE, !newAssessment.passed());
        }
        List<Double> history = state.get().scoreHistory();
        double previous = history.get(history.size() - 1);
        double improvement = newAssessment.overallScore() - previous;
        QualityTrend trend = trend(improvement);
        boolean successful = newAssessment.passed() || improvement > SUCCESSFUL_GAIN;
        boolean shouldContinue = !newAssessment.passed()
                && state.get().attemptNumber() < maxAttempts()
                && newAssessment.canRefine()
                && trend != QualityTrend.DEGRADING;
        log.info("Refinement success assessed. sessionId={}, role={}, successful={}, improvement={}, trend={}",
                sessionId, role, successful, String.format(Locale.ROOT, "%.2f", improvement), trend);
        return new RefinementOutcome(successful, improvement, trend, shouldContinue);
    }

    public RefinementStats getRefinementStats(String sessionId) {
        List<RefinementState> states = sessionLedger.getRefinementStates(sessionId);
        if (states.isEmpty()) {
            return new RefinementStats(0, Map.of(), 0.0, 0.0);
        }
        int total = 0;
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        double totalImprovement = 0;
        int improved = 0;
        for (RefinementState state : states) {
            total += state.attemptNumber();
            breakdown.merge(state.role(), state.attemptNumber(), Integer::sum);
            List<Double> scores = state.scoreHistory();
            if (scores.size() > 1) {
                double gain = scores.get(scores.size() - 1) - scores.get(0);
                totalImprovement += gain;
                if (gain > 0) {
                    improved++;
                }
            }
        }
        return new RefinementStats(total, breakdown, totalImprovement / states.size(), (double) improved / states.size());
    }

    public int maxAttempts() {
        return properties.getQuality().getMaxRefinementAttempts();
    }

    List<String> refinementAreas(QualityAssessment assessment) {
        List<String> areas = new ArrayList<>();
        assessment.categoryScores().forEach((category, score) -> {
            if (score < WEAK_CATEGORY) {
                areas.add(String.format(Locale.ROOT, "%s (score: %.2f)", category, score));
            }
        });
        Set<String> failedCategories = new LinkedHashSet<>();
        for (RuleResult result : assessment.ruleResults()) {
            if (!result.passed() && result.severity() != Severity.CRITICAL) {
                failedCategories.add(result.category());
            }
        }
        for (String category : failedCategories) {
            if (areas.stream().noneMatch(area -> area.startsWith(category))) {
                areas.add(category);
            }
        }
        return areas;
    }

    private List<String> specificFeedback(QualityAssessment assessment) {
        List<String> feedback = new ArrayList<>();
        for (RuleResult result : assessment.ruleResults()) {
            if (!result.passed() && result.severity() != Severity.CRITICAL) {
                feedback.add(result.rule() + ": " + result.feedback());
            }
        }
        assessment.criticalIssues().forEach(issue -> feedback.add("Critical: " + issue));
        if (assessment.overallScore() < 0.5) {
            feedback.add("Response needs significant improvement to meet quality standards");
        } else if (assessment.overallScore() < assessment.threshold()) {
            feedback.add("Response is close to quality threshold - minor improvements needed");
        }
        return feedback;
    }

    private QualityTrend trend(double delta) {
        double minDelta = properties.getQuality().getTrendMinDelta();
        if (delta > minDelta) {
            return QualityTrend.IMPROVING;
        }
        if (delta < -minDelta) {
            return QualityTrend.DEGRADING;
        }
        return QualityTrend.STABLE;
    }

    private static String bullets(List<String> items) {
        if (items.isEmpty()) {
            return "- none";
        }
        StringBuilder out = new StringBuilder();
        for (String item : items) {
            if (!out.isEmpty()) {
                out.append('\n');
            }
            out.append("- ").append(item);
        }
        return out.toString();
    }
}
