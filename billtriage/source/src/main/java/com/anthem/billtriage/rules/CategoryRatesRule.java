package com.anthem.billtriage.rules;

import com.anthem.billtriage.model.AssignmentError;
import com.anthem.billtriage.model.AssignmentErrorCode;
import com.anthem.billtriage.model.AssignmentMode;
import com.anthem.billtriage.model.CategoryMap;
import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.model.RateAssignmentRequest;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;

/**
 * At least one category must be enabled, and every enabled category needs a rate above zero that
 * stores unchanged. A category is enabled by being present in {@code categoryRates}.
 */
@Component
public class CategoryRatesRule implements AssignmentRule {

    @Override
    public boolean isApplicable(RateAssignmentRequest request) {
        return AssignmentMode.fromValue(request.getMode()).orElse(null) == AssignmentMode.CATEGORY;
    }

    @Override
    public RuleResult validate(RateAssignmentRequest request, FailedBill bill, CategoryMap categoryMap) {
        Map<String, BigDecimal> categoryRates = request.getCategoryRates();
        if (categoryRates.isEmpty()) {
            return RuleResult.error(AssignmentError.of(AssignmentErrorCode.EMPTY_SUBMISSION,
                    "Please enable at least one category and provide its rate", "categoryRates"));
        }

        for (Map.Entry<String, BigDecimal> entry : categoryRates.entrySet()) {
            String category = entry.getKey();
            if (category == null || category.isBlank()) {
                return RuleResult.error(AssignmentError.of(AssignmentErrorCode.INVALID_RATE,
                        "Category key is required", "categoryRates", category));
            }
            if (RateLimits.exceeds(category, RateLimits.MAX_CATEGORY_LENGTH)) {
                return RuleResult.error(AssignmentError.of(AssignmentErrorCode.INVALID_RATE,
                        "Category " + category + " is longer than " + RateLimits.MAX_CATEGORY_LENGTH + " characters",
                        "categoryRates", category));
            }
            if (!RateLimits.isStorableRate(entry.getValue())) {
                return RuleResult.error(AssignmentError.of(AssignmentErrorCode.INVALID_RATE,
                        "Invalid rate value for category " + category + ": " + entry.getValue()
                                + ". " + RateLimits.RATE_RULE,
                        "categoryRates." + category, category));
            }
        }
        return RuleResult.success();
    }

    @Override
    public String getName() {
        return "CATEGORY_RATES";
    }

    @Override
    public int getPriority() {
        return 70;
    }
}
