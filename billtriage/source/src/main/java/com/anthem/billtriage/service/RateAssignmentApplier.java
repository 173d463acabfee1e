package com.anthem.billtriage.service;

import com.anthem.billtriage.model.AssignmentError;
import com.anthem.billtriage.model.AssignmentErrorCode;
import com.anthem.billtriage.model.AssignmentMode;
import com.anthem.billtriage.model.AssignmentResult;
import com.anthem.billtriage.model.CategoryMap;
import com.anthem.billtriage.model.CategorySummary;
import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.model.RateEntry;
import com.anthem.billtriage.model.RateUpdate;
import com.anthem.billtriage.model.ValidatedAssignment;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a validated assignment into rate updates for one bill.
 *
 * Updates are keyed by (procedureCode, modifier); a later entry for the same key replaces the
 * earlier one and keeps its position. The result is built in full before it is returned, so an
 * abort leaves nothing applied.
 */
@Component
public class RateAssignmentApplier {

    private final Clock clock;

    public RateAssignmentApplier(Clock clock) {
        this.clock = clock;
    }

    public AssignmentResult apply(ValidatedAssignment assignment, FailedBill bill, CategoryMap categoryMap) {
        Map<UpdateKey, RateUpdate> updates = new LinkedHashMap<>();
        CategorySummary summary = null;

        if (assignment.getMode() == AssignmentMode.INDIVIDUAL) {
            applyIndividual(assignment.getRates(), updates);
        } else {
            summary = applyCategories(assignment.getCategoryRates(), bill,
                    categoryMap != null ? categoryMap : CategoryMap.empty(), updates);
        }

        List<String> unresolved = new ArrayList<>();
        for (String code : bill.failingCodes()) {
            boolean rated = updates.keySet().stream().anyMatch(k -> k.procedureCode().equals(code));
            if (!rated) {
                unresolved.add(code);
            }
        }

        return AssignmentResult.builder()
                .filename(bill.getFilename())
                .mode(assignment.getMode())
                .updatedRates(List.copyOf(updates.values()))
                .categorySummary(summary)
                .unresolvedCodes(List.copyOf(unresolved))
                .appliedAt(Instant.now(clock))
                .build();
    }

    private void applyIndividual(List<RateEntry> rates, Map<UpdateKey, RateUpdate> updates) {
        for (RateEntry entry : rates) {
            if (entry.getRate() == null || entry.getProcedureCode() == null) {
                throw new RateAssignmentException(AssignmentError.of(AssignmentErrorCode.APPLY_FAILED,
                        "Rate entry is incomplete at apply time", "rates", entry.getProcedureCode()));
            }
            updates.put(new UpdateKey(entry.getProcedureCode(), entry.getModifier()),
                    new RateUpdate(entry.getProcedureCode(), entry.getRate(), entry.getModifier(), null));
        }
    }

    private CategorySummary applyCategories(Map<String, BigDecimal> categoryRates, FailedBill bill,
                                            CategoryMap categoryMap, Map<UpdateKey, RateUpdate> updates) {
        List<String> failingCodes = bill.failingCodes();
        Map<String, Integer> counts = new LinkedHashMap<>();

        for (Map.Entry<String, BigDecimal> entry : categoryRates.entrySet()) {
            String category = entry.getKey();
            if (!categoryMap.contains(category)) {
                throw new RateAssignmentException(AssignmentError.of(AssignmentErrorCode.APPLY_FAILED,
                        "Category " + category + " is not defined in the category map",
                        "categoryRates." + category, category));
            }

            Set<String> categoryCodes = categoryMap.codesFor(category);
            int matched = 0;
            for (String code : failingCodes) {
                if (categoryCodes.contains(code)) {
                    updates.put(new UpdateKey(code, null), new RateUpdate(code, entry.getValue(), null, category));
                    matched++;
                }
            }
            counts.put(category, matched);
        }
        return new CategorySummary(counts);
    }

    private record UpdateKey(String procedureCode, String modifier) {}
}
