package com.bko.delegation.orchestration.quality;

import com.bko.delegation.config.DelegationProperties;
import com.bko.delegation.orchestration.model.ConfidenceLevel;
import com.bko.delegation.orchestration.model.QualityAssessment;
import com.bko.delegation.orchestration.model.QualityTrend;
import com.bko.delegation.orchestration.model.RefinementOutcome;
import com.bko.delegation.orchestration.model.RefinementStats;
import com.bko.delegation.orchestration.model.RuleResult;
import com.bko.delegation.orchestration.model.Severity;
import com.bko.delegation.orchestration.session.SessionLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RefinementManagerTest {

    private static final String ROLE = "Software Engineer";

    private SessionLedger ledger;
    private RefinementManager manager;
    private String sessionId;
    private final ValidationContext context = new ValidationContext(ROLE, "review", "Cite file paths", null);

    @BeforeEach
    void setUp() {
        DelegationProperties properties = new DelegationProperties();
        ledger = new SessionLedger(properties);
        manager = new RefinementManager(ledger, properties);
        sessionId = ledger.createSession(false, null);
    }

    @Test
    void testNeedsRefinement_PassedAssessment() {
        assertFalse(manager.needsRefinement(assessment(0.9, true, true), context, sessionId));
    }

    @Test
    void testNeedsRefinement_NotRefinable() {
        assertFalse(manager.needsRefinement(assessment(0.3, false, false), context, sessionId));
    }

    @Test
    void testNeedsRefinement_FailedAndRefinable() {
        assertTrue(manager.needsRefinement(assessment(0.6, false, true), context, sessionId));
    }

    @Test
    void testNeedsRefinement_StopsAtCap() {
        manager.trackRefinementAttempt(sessionId, ROLE, 0.50, "r1");
        manager.trackRefinementAttempt(sessionId, ROLE, 0.60, "r2");
        assertTrue(manager.needsRefinement(assessment(0.6, false, true), context, sessionId));

        manager.trackRefinementAttempt(sessionId, ROLE, 0.65, "r3");

        assertFalse(manager.needsRefinement(assessment(0.6, false, true), context, sessionId));
    }

    @Test
    void testNeedsRefinement_StopsWhenDegrading() {
        manager.trackRefinementAttempt(sessionId, ROLE, 0.65, "r1");
        manager.trackRefinementAttempt(sessionId, ROLE, 0.50, "r2");

        assertFalse(manager.needsRefinement(assessment(0.5, false, true), context, sessionId));
    }

    @Test
    void testGenerateRefinementPrompt() {
        String prompt = manager.generateRefinementPrompt(assessment(0.55, false, true), context, "Review the login flow",
                "{\"deliverables\": {\"analysis\": \"Login looks fine\"}}");

        assertTrue(prompt.startsWith("REFINEMENT REQUEST"));
        assertTrue(prompt.contains("scored 0.55 (threshold: 0.70)"));
        assertTrue(prompt.contains("- specificity (score: 0.40)"));
        assertTrue(prompt.contains("- file_path_specificity: no specific file paths found"));
        assertTrue(prompt.contains("Review the login flow"));
        assertTrue(prompt.contains("Cite file paths"));
        assertTrue(prompt.contains("minor improvements needed"));
        assertTrue(prompt.contains("YOUR PREVIOUS RESPONSE:\n{\"deliverables\": {\"analysis\": \"Login looks fine\"}}"));
    }

    @Test
    void testGenerateRefinementPrompt_LongPreviousResponseIsCut() {
        String previous = "x".repeat(5000);

        String prompt = manager.generateRefinementPrompt(assessment(0.55, false, true), context, "Review the login flow", previous);

        assertTrue(prompt.contains("x".repeat(4000) + "\n[truncated]"));
        assertFalse(prompt.contains("x".repeat(4001)));
        assertTrue(manager.generateRefinementPrompt(assessment(0.55, false, true), context, "t", "  ")
                .contains("YOUR PREVIOUS RESPONSE:\n(empty)"));
    }

    @Test
    void testAssessRefinementSuccess() {
        RefinementOutcome first = manager.assessRefinementSuccess(sessionId, ROLE, assessment(0.6, false, true));
        assertFalse(first.successful());
        assertTrue(first.shouldContinue());
        assertEquals(QualityTrend.STABLE, first.trend());

        manager.trackRefinementAttempt(sessionId, ROLE, 0.50, "r1");
        RefinementOutcome improved = manager.assessRefinementSuccess(sessionId, ROLE, assessment(0.68, false, true));

        assertTrue(improved.successful());
        assertEquals(0.18, improved.improvement(), 1e-9);
        assertEquals(QualityTrend.IMPROVING, improved.trend());
        assertTrue(improved.shouldContinue());
        assertEquals(1, ledger.getRefinementCount(sessionId, ROLE));
    }

    @Test
    void testGetRefinementStats() {
        manager.trackRefinementAttempt(sessionId, ROLE, 0.40, "r1");
        manager.trackRefinementAttempt(sessionId, ROLE, 0.60, "r2");
        manager.trackRefinementAttempt(sessionId, "Test Engineer", 0.50, "r1");

        RefinementStats stats = manager.getRefinementStats(sessionId);

        assertEquals(3, stats.totalRefinements());
        assertEquals(2, stats.roleBreakdown().get(ROLE));
        assertEquals(1, stats.roleBreakdown().get("Test Engineer"));
        assertEquals(0.10, stats.averageImprovement(), 1e-9);
        assertEquals(0.5, stats.successRate(), 1e-9);
    }

    @Test
    void testGetRefinementStats_NoAttempts() {
        RefinementStats stats = manager.getRefinementStats(sessionId);

        assertEquals(0, stats.totalRefinements());
        assertTrue(stats.roleBreakdown().isEmpty());
    }

    private static QualityAssessment assessment(double score, boolean passed, boolean canRefine) {
        Map<String, Double> categories = new LinkedHashMap<>();
        categories.put("format", 1.0);
        categories.put("specificity", 0.4);
        RuleResult failed = new RuleResult("file_path_specificity", "specificity", false, 0.25,
                Severity.IMPORTANT, "no specific file paths found");
        return new QualityAssessment(score, 0.70, passed, categories, List.of(failed), List.of(),
                List.of(failed.feedback()), List.of("Improve specificity: no specific file paths found"),
                canRefine, ConfidenceLevel.MEDIUM, 3);
    }
}
