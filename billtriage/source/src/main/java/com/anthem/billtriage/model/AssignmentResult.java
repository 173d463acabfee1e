package com.anthem.billtriage.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of applying one rate assignment. Persisted by the caller and returned for display.
 */
@Value
@Builder
public class AssignmentResult {

    String filename;

    AssignmentMode mode;

    /** Applied updates, one per (procedureCode, modifier). */
    List<RateUpdate> updatedRates;

    /** Category mode only; includes zero-count categories. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    CategorySummary categorySummary;

    /** Failing codes on the bill that received no rate. */
    List<String> unresolvedCodes;

    Instant appliedAt;

    @JsonIgnore
    public boolean isFullyResolved() {
        return unresolvedCodes == null || unresolvedCodes.isEmpty();
    }

    /**
     * Operator-facing message. Zero-count categories are left out.
     */
    public String summaryMessage() {
        StringBuilder message = new StringBuilder()
                .append("Rates assigned to ")
                .append(updatedRates.size())
                .append(" code(s)");

        if (categorySummary != null) {
            Map<String, Integer> visible = categorySummary.visibleCounts();
            if (!visible.isEmpty()) {
                message.append("\n\nCategory Update Summary:");
                visible.forEach((category, count) ->
                        message.append("\n- ").append(category).append(": ").append(count).append(" CPT codes updated"));
            }
        }
        return message.toString();
    }
}
