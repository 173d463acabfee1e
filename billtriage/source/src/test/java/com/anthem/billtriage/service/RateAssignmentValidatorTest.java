package com.anthem.billtriage.service;

import com.anthem.billtriage.model.AssignmentErrorCode;
import com.anthem.billtriage.model.AssignmentMode;
import com.anthem.billtriage.model.AssignmentValidationResult;
import com.anthem.billtriage.model.AssignmentWarning;
import com.anthem.billtriage.model.CategoryMap;
import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.model.RateAssignmentRequest;
import com.anthem.billtriage.model.RateEntry;
import com.anthem.billtriage.rules.CategoryCoverageRule;
import com.anthem.billtriage.rules.CategoryRatesRule;
import com.anthem.billtriage.rules.IndividualRatesRule;
import com.anthem.billtriage.rules.RequestModeRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.anthem.billtriage.BillFixtures.failingCodes;
import static org.assertj.core.api.Assertions.assertThat;

class RateAssignmentValidatorTest {

    private RateAssignmentValidator validator;
    private FailedBill bill;
    private CategoryMap categoryMap;

    @BeforeEach
    void setUp() {
        // registration order differs from priority order
        validator = new RateAssignmentValidator(List.of(
                new CategoryCoverageRule(),
                new IndividualRatesRule(),
                new CategoryRatesRule(),
                new RequestModeRule()));
        bill = failingCodes("bill.json", "70551", "99213");
        categoryMap = new CategoryMap(Map.of("mri_wo", List.of("70551", "70552")));
    }

    @Test
    void individual_zeroRateIsInvalidAndNamesCode() {
        RateAssignmentRequest request = individual(new RateEntry("70551", BigDecimal.ZERO, null));

        AssignmentValidationResult result = validator.validate(request, bill, CategoryMap.empty());

        assertThat(result.isValid()).isFalse();
        assertThat(result.getError().getCode()).isEqualTo(AssignmentErrorCode.INVALID_RATE);
        assertThat(result.getError().getSubject()).isEqualTo("70551");
        assertThat(result.getError().getMessage()).contains("70551");
    }

    @Test
    void individual_negativeOrMissingRateIsInvalid() {
        assertThat(validator.validate(individual(new RateEntry("70551", new BigDecimal("-1"), null)),
                bill, CategoryMap.empty()).getError().getCode()).isEqualTo(AssignmentErrorCode.INVALID_RATE);
        assertThat(validator.validate(individual(new RateEntry("70551", null, null)),
                bill, CategoryMap.empty()).getError().getCode()).isEqualTo(AssignmentErrorCode.INVALID_RATE);
    }

    @Test
    void individual_valuesThatWouldNotStoreUnchangedAreInvalid() {
        AssignmentValidationResult subCent = validator.validate(
                individual(new RateEntry(" 70551 ", new BigDecimal("150.005"), null)), bill, CategoryMap.empty());
        AssignmentValidationResult longModifier = validator.validate(
                individual(new RateEntry("70551", BigDecimal.TEN, "ABCDEFGHIJK")), bill, CategoryMap.empty());

        assertThat(subCent.getError().getCode()).isEqualTo(AssignmentErrorCode.INVALID_RATE);
        assertThat(subCent.getError().getSubject()).isEqualTo("70551");
        assertThat(longModifier.getError().getCode()).isEqualTo(AssignmentErrorCode.INVALID_RATE);
        assertThat(longModifier.getError().getField()).isEqualTo("rates[0].modifier");
        assertThat(longModifier.getError().getSubject()).isEqualTo("70551");
    }

    @Test
    void individual_blankCodeIsInvalid() {
        AssignmentValidationResult result = validator.validate(
                individual(new RateEntry("  ", BigDecimal.TEN, null)), bill, CategoryMap.empty());

        assertThat(result.getError().getCode()).isEqualTo(AssignmentErrorCode.INVALID_RATE);
        assertThat(result.getError().getField()).isEqualTo("rates[0].procedureCode");
    }

    @Test
    void individual_firstViolationShortCircuits() {
        AssignmentValidationResult result = validator.validate(individual(
                new RateEntry("70551", BigDecimal.TEN, null),
                new RateEntry("99213", BigDecimal.ZERO, null),
                new RateEntry("", BigDecimal.ZERO, null)), bill, CategoryMap.empty());

        assertThat(result.getError().getSubject()).isEqualTo("99213");
        assertThat(result.getError().getField()).isEqualTo("rates[1].rate");
    }

    @Test
    void individual_emptyListIsEmptySubmission() {
        AssignmentValidationResult result = validator.validate(
                RateAssignmentRequest.builder().mode("individual").rates(List.of()).build(),
                bill, CategoryMap.empty());

        assertThat(result.getError().getCode()).isEqualTo(AssignmentErrorCode.EMPTY_SUBMISSION);
    }

    @Test
    void individual_acceptedRequestIsNormalized() {
        AssignmentValidationResult result = validator.validate(individual(
                new RateEntry(" 70551 ", new BigDecimal("150.00"), " "),
                new RateEntry("70551", new BigDecimal("90.00"), " TC ")), bill, CategoryMap.empty());

        assertThat(result.isValid()).isTrue();
        assertThat(result.getAssignment().getMode()).isEqualTo(AssignmentMode.INDIVIDUAL);
        assertThat(result.getAssignment().getRates()).extracting(RateEntry::getProcedureCode)
                .containsExactly("70551", "70551");
        assertThat(result.getAssignment().getRates()).extracting(RateEntry::getModifier)
                .containsExactly(null, "TC");
        assertThat(result.getAssignment().getWarnings()).isEmpty();
    }

    @Test
    void category_emptyMapIsEmptySubmission() {
        AssignmentValidationResult result = validator.validate(
                RateAssignmentRequest.builder().mode("category").categoryRates(Map.of()).build(),
                bill, categoryMap);

        assertThat(result.getError().getCode()).isEqualTo(AssignmentErrorCode.EMPTY_SUBMISSION);
    }

    @Test
    void category_nonPositiveRateNamesCategory() {
        Map<String, BigDecimal> rates = new LinkedHashMap<>();
        rates.put("mri_wo", new BigDecimal("150"));
        rates.put("ct_head", null);

        AssignmentValidationResult result = validator.validate(
                RateAssignmentRequest.builder().mode("category").categoryRates(rates).build(),
                bill, categoryMap);

        assertThat(result.getError().getCode()).isEqualTo(AssignmentErrorCode.INVALID_RATE);
        assertThat(result.getError().getSubject()).isEqualTo("ct_head");
        assertThat(result.getError().getField()).isEqualTo("categoryRates.ct_head");
    }

    @Test
    void category_zeroMatchIsAcceptedWithWarning() {
        FailedBill unmatched = failingCodes("other.json", "99213");

        AssignmentValidationResult result = validator.validate(
                RateAssignmentRequest.builder().mode("category")
                        .categoryRates(Map.of("mri_wo", new BigDecimal("150"))).build(),
                unmatched, categoryMap);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getAssignment().getCategoryRates()).containsEntry("mri_wo", new BigDecimal("150"));
        assertThat(result.getAssignment().getWarnings()).extracting(AssignmentWarning::getCode)
                .containsExactly(AssignmentWarning.CATEGORY_NO_MATCH);
    }

    @Test
    void malformed_checkedBeforeRates() {
        RateAssignmentRequest request = RateAssignmentRequest.builder()
                .mode("individual")
                .rates(List.of(new RateEntry("70551", BigDecimal.ZERO, null)))
                .categoryRates(Map.of())
                .build();

        assertThat(validator.validate(request, bill, categoryMap).getError().getCode())
                .isEqualTo(AssignmentErrorCode.MALFORMED_REQUEST);
        assertThat(validator.validate(null, bill, categoryMap).getError().getCode())
                .isEqualTo(AssignmentErrorCode.MALFORMED_REQUEST);
    }

    private static RateAssignmentRequest individual(RateEntry... entries) {
        return RateAssignmentRequest.builder()
                .mode("individual")
                .rates(new ArrayList<>(List.of(entries)))
                .build();
    }
}
