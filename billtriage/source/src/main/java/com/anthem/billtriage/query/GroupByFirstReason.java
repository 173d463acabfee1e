package com.anthem.billtriage.query;

import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.model.FailureReason;
import org.springframework.stereotype.Component;

/**
 * A bill belongs to the kind of its first-listed failure reason only. Bills failing for
 * several kinds are not counted under the later ones; filtering by kind still sees all of them.
 * Bills without reasons go to {@code Unknown}.
 */
@Component
public class GroupByFirstReason implements KindGroupingPolicy {

    @Override
    public String kindKey(FailedBill bill) {
        if (bill.getFailureReasons().isEmpty()) {
            return FailureReason.UNKNOWN_TOKEN;
        }
        return bill.getFailureReasons().get(0).getKindToken();
    }
}
