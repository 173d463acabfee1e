package com.anthem.billtriage.rules;

import com.anthem.billtriage.model.AssignmentError;
import com.anthem.billtriage.model.AssignmentWarning;
import com.anthem.billtriage.model.CategoryMap;
import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.model.RateAssignmentRequest;

import java.util.List;

/**
 * Interface for ordered rate assignment checks.
 */
public interface AssignmentRule {

    /**
     * Check if this rule is applicable to the given request.
     */
    boolean isApplicable(RateAssignmentRequest request);

    /**
     * Execute the rule. The category map is empty for individual-mode requests.
     */
    RuleResult validate(RateAssignmentRequest request, FailedBill bill, CategoryMap categoryMap);

    String getName();

    /**
     * Get the rule priority (higher = runs first).
     */
    default int getPriority() {
        return 0;
    }

    /**
     * Result of a single rule: at most one error, any number of warnings.
     */
    class RuleResult {
        private final AssignmentError error;
        private final List<AssignmentWarning> warnings;

        public RuleResult(AssignmentError error, List<AssignmentWarning> warnings) {
            this.error = error;
            this.warnings = warnings;
        }

        public static RuleResult success() {
            return new RuleResult(null, List.of());
        }

        public static RuleResult error(AssignmentError error) {
            return new RuleResult(error, List.of());
        }

        public static RuleResult warnings(List<AssignmentWarning> warnings) {
            return new RuleResult(null, List.copyOf(warnings));
        }

        public boolean hasError() {
            return error != null;
        }

        public AssignmentError getError() {
            return error;
        }

        public List<AssignmentWarning> getWarnings() {
            return warnings;
        }
    }
}
