package com.anthem.billtriage;

import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.model.FailureReason;
import com.anthem.billtriage.model.ServiceLine;

import java.time.LocalDate;
import java.util.Arrays;

/**
 * Builders for failed bills used across tests.
 */
public final class BillFixtures {

    private BillFixtures() {
    }

    /**
     * Bill with one service line dated {@code dateOfService} (null for none) and the given reasons.
     */
    public static FailedBill bill(String filename, String provider, LocalDate dateOfService, String... reasons) {
        FailedBill.FailedBillBuilder builder = FailedBill.builder()
                .filename(filename)
                .provider(provider);
        if (dateOfService != null) {
            builder.serviceLine(ServiceLine.builder()
                    .procedureCode("99213")
                    .rawDateOfService(dateOfService.toString())
                    .dateOfService(dateOfService)
                    .build());
        }
        Arrays.stream(reasons).map(FailureReason::parse).forEach(builder::failureReason);
        return builder.build();
    }

    public static FailedBill failingCodes(String filename, String... codes) {
        FailedBill.FailedBillBuilder builder = FailedBill.builder().filename(filename);
        for (String code : codes) {
            builder.failureReason(FailureReason.parse("RATE_MISSING: " + code));
        }
        return builder.build();
    }
}
