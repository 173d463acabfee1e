package com.anthem.billtriage.rules;

import com.anthem.billtriage.model.AssignmentError;
import com.anthem.billtriage.model.AssignmentErrorCode;
import com.anthem.billtriage.model.AssignmentMode;
import com.anthem.billtriage.model.CategoryMap;
import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.model.RateAssignmentRequest;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * The declared mode must be individual or category, and only the matching field may be populated.
 */
@Component
public class RequestModeRule implements AssignmentRule {

    @Override
    public boolean isApplicable(RateAssignmentRequest request) {
        return true;
    }

    @Override
    public RuleResult validate(RateAssignmentRequest request, FailedBill bill, CategoryMap categoryMap) {
        if (request == null) {
            return RuleResult.error(AssignmentError.of(
                    AssignmentErrorCode.MALFORMED_REQUEST, "Rate assignment request is missing", "root"));
        }

        boolean hasRates = request.getRates() != null;
        boolean hasCategoryRates = request.getCategoryRates() != null;

        if (hasRates && hasCategoryRates) {
            return RuleResult.error(AssignmentError.of(AssignmentErrorCode.MALFORMED_REQUEST,
                    "Request cannot contain both individual rates and category rates", "mode"));
        }
        if (!hasRates && !hasCategoryRates) {
            return RuleResult.error(AssignmentError.of(AssignmentErrorCode.MALFORMED_REQUEST,
                    "Request contains neither individual rates nor category rates", "mode"));
        }

        Optional<AssignmentMode> mode = AssignmentMode.fromValue(request.getMode());
        if (mode.isEmpty()) {
            return RuleResult.error(AssignmentError.of(AssignmentErrorCode.MALFORMED_REQUEST,
                    "Unknown or missing mode: " + request.getMode() + ". Expected 'individual' or 'category'", "mode"));
        }

        if (mode.get() == AssignmentMode.INDIVIDUAL && !hasRates) {
            return RuleResult.error(AssignmentError.of(AssignmentErrorCode.MALFORMED_REQUEST,
                    "Individual mode requires 'rates'", "rates"));
        }
        if (mode.get() == AssignmentMode.CATEGORY && !hasCategoryRates) {
            return RuleResult.error(AssignmentError.of(AssignmentErrorCode.MALFORMED_REQUEST,
                    "Category mode requires 'categoryRates'", "categoryRates"));
        }

        return RuleResult.success();
    }

    @Override
    public String getName() {
        return "REQUEST_MODE";
    }

    @Override
    public int getPriority() {
        return 100;
    }
}
