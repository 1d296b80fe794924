package com.bko.delegation.orchestration.quality;

import com.bko.delegation.config.DelegationProperties;
import com.bko.delegation.orchestration.model.CompletionStatus;
import com.bko.delegation.orchestration.model.ConfidenceLevel;
import com.bko.delegation.orchestration.model.Deliverables;
import com.bko.delegation.orchestration.model.MemoryOperation;
import com.bko.delegation.orchestration.model.QualityAssessment;
import com.bko.delegation.orchestration.model.ResponseMetadata;
import com.bko.delegation.orchestration.model.RuleResult;
import com.bko.delegation.orchestration.model.Severity;
import com.bko.delegation.orchestration.model.WorkerResponse;
import com.bko.delegation.orchestration.parsing.WorkerResponseAssembler;
import com.bko.delegation.orchestration.quality.rules.CodeSnippetPresenceRule;
import com.bko.delegation.orchestration.quality.rules.ConcreteAnalysisDepthRule;
import com.bko.delegation.orchestration.quality.rules.DeliverablesCompletenessRule;
import com.bko.delegation.orchestration.quality.rules.FilePathSpecificityRule;
import com.bko.delegation.orchestration.quality.rules.FormatComplianceRule;
import com.bko.delegation.orchestration.quality.rules.MemoryOperationsRule;
import com.bko.delegation.orchestration.quality.rules.ResponseQualityRule;
import com.bko.delegation.orchestration.quality.rules.TaskCompletionRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QualityValidatorTest {

    private final DelegationProperties properties = new DelegationProperties();
    private final QualityValidator validator = new QualityValidator(List.of(
            new FormatComplianceRule(),
            new DeliverablesCompletenessRule(),
            new MemoryOperationsRule(),
            new TaskCompletionRule(),
            new ResponseQualityRule(),
            new FilePathSpecificityRule(),
            new CodeSnippetPresenceRule(),
            new ConcreteAnalysisDepthRule()), properties);

    @Test
    void testApplicableRules_DependOnRole() {
        assertEquals(5, validator.applicableRules("Technical Writer").size());
        assertEquals(8, validator.applicableRules("Software Engineer").size());
        List<QualityRule> testEngineerRules = validator.applicableRules("Test Engineer");
        assertEquals(7, testEngineerRules.size());
        assertTrue(testEngineerRules.stream().noneMatch(rule -> rule.name().equals("code_snippet_presence")));
    }

    @Test
    void testValidate_WellFormedResponsePasses() {
        String analysis = "The public endpoints are documented with request and response examples. ".repeat(8);
        WorkerResponse response = response(analysis, List.of("Add pagination notes", "Document error codes", "Link the changelog"));

        QualityAssessment assessment = validator.validate(response,
                new ValidationContext("Technical Writer", "document endpoints", "", null));

        assertEquals(0.70, assessment.threshold());
        assertTrue(assessment.passed());
        assertEquals(1.0, assessment.overallScore(), 1e-9);
        assertTrue(assessment.criticalIssues().isEmpty());
        assertEquals(ConfidenceLevel.HIGH, assessment.confidence());
        assertEquals(5, assessment.ruleResults().size());
        assertTrue(assessment.processingTimeMs() >= 1);
    }

    @Test
    void testValidate_SkeletalResponseFailsWithCriticalIssue() {
        WorkerResponse response = new WorkerResponse(
                new Deliverables("x", List.of(), List.of(), null, Map.of()),
                List.of(),
                new ResponseMetadata("Security Engineer", CompletionStatus.PARTIAL, ConfidenceLevel.LOW,
                        WorkerResponseAssembler.DEFAULT_PROCESSING_TIME),
                null,
                null,
                List.of(WorkerResponseAssembler.FIELD_MEMORY_OPERATIONS, WorkerResponseAssembler.FIELD_METADATA));

        QualityAssessment assessment = validator.validate(response,
                new ValidationContext("Security Engineer", "audit login", "", null));

        assertEquals(0.80, assessment.threshold());
        assertFalse(assessment.passed());
        assertFalse(assessment.criticalIssues().isEmpty());
        assertTrue(assessment.overallScore() < 0.5);
        assertEquals(ConfidenceLevel.LOW, assessment.confidence());
        assertTrue(assessment.recommendations().stream()
                .anyMatch(r -> r.contains("specific requirements for Security Engineer")));
    }

    @Test
    void testValidate_ConcreteAnalysisScoresHigherSpecificity() {
        WorkerResponse vague = response(
                "There may have been security vulnerabilities and performance issues. Code quality could be better "
                        + "and generally best practices are typically not followed, with potential problems overall.",
                List.of("Follow standard practices"));
        WorkerResponse concrete = response(
                "The login method in src/auth/LoginController.java line 42 builds a SQL query by concatenating the "
                        + "username parameter, which enables injection. The repository in src/auth/UserRepository.java "
                        + "and the middleware in src/web/AuthMiddleware.ts skip the JWT expiry check. "
                        + "`String sql = \"SELECT * FROM users WHERE name='\" + name + \"'\"`",
                List.of("Fix query by binding the parameter", "Add validation in the middleware"));
        ValidationContext context = new ValidationContext("Security Engineer", "", "", null);

        QualityAssessment vagueAssessment = validator.validate(vague, context);
        QualityAssessment concreteAssessment = validator.validate(concrete, context);

        assertTrue(concreteAssessment.categoryScores().get("specificity")
                > vagueAssessment.categoryScores().get("specificity"));
        assertTrue(concreteAssessment.overallScore() > vagueAssessment.overallScore());
    }

    @Test
    void testValidate_FailingRuleIsReportedNotThrown() {
        QualityRule broken = new QualityRule() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public String category() {
                return "format";
            }

            @Override
            public double weight() {
                return 0.5;
            }

            @Override
            public RuleResult evaluate(WorkerResponse response, ValidationContext context) {
                throw new IllegalStateException("boom");
            }
        };
        QualityValidator withBroken = new QualityValidator(List.of(new FormatComplianceRule(), broken), properties);

        QualityAssessment assessment = withBroken.validate(response("short", List.of()),
                new ValidationContext("Technical Writer", "", "", null));

        RuleResult failed = assessment.ruleResults().get(1);
        assertFalse(failed.passed());
        assertEquals(0.0, failed.score());
        assertEquals(Severity.MINOR, failed.severity());
        assertEquals("Rule evaluation failed: broken", failed.feedback());
    }

    private static WorkerResponse response(String analysis, List<String> recommendations) {
        return new WorkerResponse(
                new Deliverables(analysis, recommendations, List.of("docs/report.md"), null, Map.of()),
                List.of(new MemoryOperation("create_entities", Map.of())),
                new ResponseMetadata("worker", CompletionStatus.COMPLETE, ConfidenceLevel.HIGH, "1200ms"),
                null,
                null,
                List.of());
    }
}
