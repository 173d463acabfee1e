package com.anthem.billtriage.rules;

import com.anthem.billtriage.model.AssignmentError;
import com.anthem.billtriage.model.AssignmentErrorCode;
import com.anthem.billtriage.model.AssignmentMode;
import com.anthem.billtriage.model.CategoryMap;
import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.model.RateAssignmentRequest;
import com.anthem.billtriage.model.RateEntry;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Every individual entry needs a procedure code and a rate above zero. Codes, modifiers and rates
 * must also fit the columns they are stored in.
 */
@Component
public class IndividualRatesRule implements AssignmentRule {

    @Override
    public boolean isApplicable(RateAssignmentRequest request) {
        return AssignmentMode.fromValue(request.getMode()).orElse(null) == AssignmentMode.INDIVIDUAL;
    }

    @Override
    public RuleResult validate(RateAssignmentRequest request, FailedBill bill, CategoryMap categoryMap) {
        List<RateEntry> rates = request.getRates();
        if (rates.isEmpty()) {
            return RuleResult.error(AssignmentError.of(AssignmentErrorCode.EMPTY_SUBMISSION,
                    "No procedure code rates were submitted", "rates"));
        }

        for (int i = 0; i < rates.size(); i++) {
            RateEntry entry = rates.get(i);
            String field = "rates[" + i + "]";
            if (entry == null) {
                return RuleResult.error(AssignmentError.of(AssignmentErrorCode.INVALID_RATE,
                        "Rate entry is empty", field));
            }

            String code = entry.getProcedureCode();
            if (code == null || code.isBlank()) {
                return RuleResult.error(AssignmentError.of(AssignmentErrorCode.INVALID_RATE,
                        "Procedure code is required", field + ".procedureCode", code));
            }
            String trimmed = code.trim();
            if (RateLimits.exceeds(trimmed, RateLimits.MAX_CODE_LENGTH)) {
                return RuleResult.error(AssignmentError.of(AssignmentErrorCode.INVALID_RATE,
                        "Procedure code " + trimmed + " is longer than " + RateLimits.MAX_CODE_LENGTH + " characters",
                        field + ".procedureCode", trimmed));
            }
            if (RateLimits.exceeds(entry.getModifier(), RateLimits.MAX_MODIFIER_LENGTH)) {
                return RuleResult.error(AssignmentError.of(AssignmentErrorCode.INVALID_RATE,
                        "Modifier " + entry.getModifier().trim() + " for " + trimmed + " is longer than "
                                + RateLimits.MAX_MODIFIER_LENGTH + " characters",
                        field + ".modifier", trimmed));
            }
            if (!RateLimits.isStorableRate(entry.getRate())) {
                return RuleResult.error(AssignmentError.of(AssignmentErrorCode.INVALID_RATE,
                        "Invalid rate value for " + trimmed + ": " + entry.getRate() + ". " + RateLimits.RATE_RULE,
                        field + ".rate", trimmed));
            }
        }
        return RuleResult.success();
    }

    @Override
    public String getName() {
        return "INDIVIDUAL_RATES";
    }

    @Override
    public int getPriority() {
        return 80;
    }
}
