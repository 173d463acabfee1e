package com.anthem.billtriage.rules;

import com.anthem.billtriage.model.AssignmentMode;
import com.anthem.billtriage.model.AssignmentWarning;
import com.anthem.billtriage.model.CategoryMap;
import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.model.RateAssignmentRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks each enabled category against the bill's failing codes. A category matching no
 * failing code is accepted with a {@code CATEGORY_NO_MATCH} warning and a zero summary count.
 */
@Component
public class CategoryCoverageRule implements AssignmentRule {

    private static final Logger log = LoggerFactory.getLogger(CategoryCoverageRule.class);

    @Override
    public boolean isApplicable(RateAssignmentRequest request) {
        return AssignmentMode.fromValue(request.getMode()).orElse(null) == AssignmentMode.CATEGORY;
    }

    @Override
    public RuleResult validate(RateAssignmentRequest request, FailedBill bill, CategoryMap categoryMap) {
        List<String> failingCodes = bill.failingCodes();
        List<AssignmentWarning> warnings = new ArrayList<>();

        for (String category : request.getCategoryRates().keySet()) {
            Set<String> codes = categoryMap.codesFor(category);
            boolean matches = failingCodes.stream().anyMatch(codes::contains);
            if (!matches) {
                log.debug("Category matches no failing code: filename={}, category={}, known={}",
                        bill.getFilename(), category, categoryMap.contains(category));
                warnings.add(new AssignmentWarning(
                        AssignmentWarning.CATEGORY_NO_MATCH,
                        "Category " + category + " does not cover any failing procedure code on this bill",
                        "categoryRates." + category));
            }
        }
        return RuleResult.warnings(warnings);
    }

    @Override
    public String getName() {
        return "CATEGORY_COVERAGE";
    }

    @Override
    public int getPriority() {
        return 60;
    }
}
