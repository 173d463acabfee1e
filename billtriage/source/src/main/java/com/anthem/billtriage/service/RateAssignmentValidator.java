package com.anthem.billtriage.service;

import com.anthem.billtriage.model.AssignmentMode;
import com.anthem.billtriage.model.AssignmentValidationResult;
import com.anthem.billtriage.model.AssignmentWarning;
import com.anthem.billtriage.model.CategoryMap;
import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.model.RateAssignmentRequest;
import com.anthem.billtriage.model.RateEntry;
import com.anthem.billtriage.model.ValidatedAssignment;
import com.anthem.billtriage.rules.AssignmentRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gates rate assignment requests.
 * Runs the assignment rules by priority and stops at the first error.
 */
@Service
public class RateAssignmentValidator {

    private static final Logger log = LoggerFactory.getLogger(RateAssignmentValidator.class);

    private final List<AssignmentRule> rules;

    public RateAssignmentValidator(List<AssignmentRule> rules) {
        this.rules = rules.stream()
                .sorted(Comparator.comparingInt(AssignmentRule::getPriority).reversed())
                .toList();
    }

    /**
     * Validate a request against the target bill.
     *
     * @param request the operator submission
     * @param bill the bill being resolved
     * @param categoryMap category definitions; may be empty in individual mode
     * @return the normalized request, or the first violated rule
     */
    public AssignmentValidationResult validate(RateAssignmentRequest request, FailedBill bill, CategoryMap categoryMap) {
        CategoryMap categories = categoryMap != null ? categoryMap : CategoryMap.empty();
        List<AssignmentWarning> warnings = new ArrayList<>();

        for (AssignmentRule rule : rules) {
            if (request != null && !rule.isApplicable(request)) {
                continue;
            }
            AssignmentRule.RuleResult result = rule.validate(request, bill, categories);
            if (result.hasError()) {
                log.debug("Rule {} rejected request: filename={}, code={}, field={}",
                        rule.getName(), bill.getFilename(), result.getError().getCode(), result.getError().getField());
                return AssignmentValidationResult.rejected(result.getError());
            }
            warnings.addAll(result.getWarnings());
        }

        return AssignmentValidationResult.accepted(normalize(request, warnings));
    }

    private ValidatedAssignment normalize(RateAssignmentRequest request, List<AssignmentWarning> warnings) {
        AssignmentMode mode = AssignmentMode.fromValue(request.getMode()).orElseThrow();
        if (mode == AssignmentMode.INDIVIDUAL) {
            List<RateEntry> rates = request.getRates().stream()
                    .map(e -> new RateEntry(e.getProcedureCode().trim(), e.getRate(), normalizeModifier(e.getModifier())))
                    .toList();
            return ValidatedAssignment.individual(rates, warnings);
        }

        Map<String, BigDecimal> categoryRates = new LinkedHashMap<>();
        request.getCategoryRates().forEach((category, rate) -> categoryRates.put(category.trim(), rate));
        return ValidatedAssignment.category(categoryRates, warnings);
    }

    private static String normalizeModifier(String modifier) {
        if (modifier == null || modifier.isBlank()) {
            return null;
        }
        return modifier.trim();
    }
}
