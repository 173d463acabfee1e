package com.anthem.billtriage.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Operator submission as received. Exactly one of {@link #rates} or {@link #categoryRates}
 * must be populated, matching {@link #mode}; the validator enforces this.
 *
 * <pre>
 * {"mode":"individual", "rates":[{"procedureCode":"70551", "rate":150, "modifier":"TC"}]}
 * {"mode":"category", "categoryRates":{"mri_wo":150}}
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RateAssignmentRequest {

    @JsonAlias("rate_type")
    private String mode;

    private List<RateEntry> rates;

    /** Category key to rate; insertion order is preserved. */
    @JsonAlias("category_rates")
    private Map<String, BigDecimal> categoryRates;
}
