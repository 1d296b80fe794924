package com.bko.delegation.orchestration.quality.rules;

import com.bko.delegation.orchestration.model.MemoryOperation;
import com.bko.delegation.orchestration.model.RuleResult;
import com.bko.delegation.orchestration.model.Severity;
import com.bko.delegation.orchestration.model.WorkerResponse;
import com.bko.delegation.orchestration.quality.ValidationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

@Component
@Order(3)
public class MemoryOperationsRule extends AbstractQualityRule {

    static final Set<String> VALID_OPERATIONS = Set.of(
            "create_entities", "add_observations", "create_relations",
            "delete_entities", "delete_observations", "delete_relations");

    public MemoryOperationsRule() {
        super("memory_operations_validity", "memory", 0.15);
    }

    @Override
    public RuleResult evaluate(WorkerResponse response, ValidationContext context) {
        List<MemoryOperation> operations = response.memoryOperations();
        if (operations.isEmpty()) {
            return result(false, 20, Severity.MINOR, "No memory operations provided - knowledge may not be captured");
        }
        long valid = operations.stream().filter(op -> VALID_OPERATIONS.contains(op.operation())).count();
        int points = (int) Math.round(valid * 100.0 / operations.size());
        boolean passed = points >= 80;
        return result(passed, points, points < 50 ? Severity.IMPORTANT : Severity.MINOR,
                passed ? "Memory operations are valid" : "Some memory operations have invalid types");
    }
}
