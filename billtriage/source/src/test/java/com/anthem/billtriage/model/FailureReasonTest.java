package com.anthem.billtriage.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FailureReasonTest {

    @Test
    void parse_knownKindWithCode() {
        FailureReason reason = FailureReason.parse("RATE_MISSING: 70551");

        assertThat(reason.getKind()).isEqualTo(FailureKind.RATE_MISSING);
        assertThat(reason.getKindToken()).isEqualTo("RATE_MISSING");
        assertThat(reason.getDetail()).isEqualTo("70551");
        assertThat(reason.getProcedureCode()).isEqualTo("70551");
        assertThat(reason.isKnownKind()).isTrue();
    }

    @Test
    void parse_codeIsFirstTokenOfDetail() {
        FailureReason reason = FailureReason.parse("TOO_MANY_UNITS: 97110 billed with 4 units");

        assertThat(reason.getKind()).isEqualTo(FailureKind.TOO_MANY_UNITS);
        assertThat(reason.getDetail()).isEqualTo("97110 billed with 4 units");
        assertThat(reason.getProcedureCode()).isEqualTo("97110");
    }

    @Test
    void parse_splitsOnFirstColonOnly() {
        FailureReason reason = FailureReason.parse("UNMATCHED_CPT:  G0283 : extra");

        assertThat(reason.getKindToken()).isEqualTo("UNMATCHED_CPT");
        assertThat(reason.getDetail()).isEqualTo("G0283 : extra");
        assertThat(reason.getProcedureCode()).isEqualTo("G0283");
    }

    @Test
    void parse_noCodeSegment() {
        FailureReason reason = FailureReason.parse("READ_ERROR");

        assertThat(reason.getKind()).isEqualTo(FailureKind.READ_ERROR);
        assertThat(reason.getDetail()).isNull();
        assertThat(reason.hasProcedureCode()).isFalse();
    }

    @Test
    void parse_blankCodeSegment() {
        FailureReason reason = FailureReason.parse("RATE_MISSING:   ");

        assertThat(reason.getKind()).isEqualTo(FailureKind.RATE_MISSING);
        assertThat(reason.hasProcedureCode()).isFalse();
    }

    @Test
    void parse_unknownTokenPassesThrough() {
        FailureReason reason = FailureReason.parse("NEW_RULE_X: 12345");

        assertThat(reason.getKind()).isNull();
        assertThat(reason.isKnownKind()).isFalse();
        assertThat(reason.getKindToken()).isEqualTo("NEW_RULE_X");
        assertThat(reason.getProcedureCode()).isEqualTo("12345");
    }

    @Test
    void parse_kindMatchIsCaseSensitive() {
        FailureReason reason = FailureReason.parse("rate_missing: 70551");

        assertThat(reason.getKind()).isNull();
        assertThat(reason.getKindToken()).isEqualTo("rate_missing");
    }

    @Test
    void parse_nullAndEmptyDoNotThrow() {
        assertThat(FailureReason.parse(null).getKindToken()).isEqualTo(FailureReason.UNKNOWN_TOKEN);
        assertThat(FailureReason.parse("").getKindToken()).isEqualTo(FailureReason.UNKNOWN_TOKEN);
        assertThat(FailureReason.parse(": 70551").getProcedureCode()).isEqualTo("70551");
    }

    @Test
    void display_knownKindUsesTaxonomy() {
        FailureKindDisplay display = FailureKindDisplay.of("RATE_MISSING");

        assertThat(display.getLabel()).isEqualTo("Missing Rate");
        assertThat(display.getColor()).isEqualTo("#dc3545");
    }

    @Test
    void display_unknownKindFallsBack() {
        FailureKindDisplay display = FailureKindDisplay.of("NEW_RULE_X");

        assertThat(display.getLabel()).isEqualTo("NEW_RULE_X");
        assertThat(display.getColor()).isEqualTo(FailureKindDisplay.FALLBACK_COLOR);
        assertThat(display.getIcon()).isEqualTo(FailureKindDisplay.FALLBACK_ICON);
    }
}
