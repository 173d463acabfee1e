package com.anthem.billtriage.query;

import com.anthem.billtriage.model.AgeBucket;
import com.anthem.billtriage.model.BillFilter;
import com.anthem.billtriage.model.BillStats;
import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.model.FailureReason;
import com.anthem.billtriage.model.GroupDimension;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Read-only views over a collection of failed bills: filter choices, filtering, grouping and
 * counts. Never fails on malformed bills; missing fields fall into {@code Unknown} groups.
 */
@Service
public class FailedBillQueryService {

    private final KindGroupingPolicy kindGroupingPolicy;
    private final Clock clock;

    public FailedBillQueryService(KindGroupingPolicy kindGroupingPolicy, Clock clock) {
        this.kindGroupingPolicy = kindGroupingPolicy;
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Every kind token appearing in any reason, sorted. {@code Unknown} is included when some
     * bill has no reasons, matching the group those bills fall in.
     */
    public List<String> distinctFailureKinds(List<FailedBill> bills) {
        TreeSet<String> kinds = new TreeSet<>();
        for (FailedBill bill : bills) {
            if (bill.getFailureReasons().isEmpty()) {
                kinds.add(FailureReason.UNKNOWN_TOKEN);
            }
            bill.getFailureReasons().forEach(r -> kinds.add(r.getKindToken()));
        }
        return new ArrayList<>(kinds);
    }

    /**
     * Provider display names, sorted. Bills without a provider contribute "Unknown Provider".
     */
    public List<String> distinctProviders(List<FailedBill> bills) {
        TreeSet<String> providers = new TreeSet<>();
        bills.forEach(b -> providers.add(b.providerName()));
        return new ArrayList<>(providers);
    }

    public List<String> ageBucketLabels() {
        return Arrays.stream(AgeBucket.values()).map(AgeBucket::getLabel).toList();
    }

    /**
     * Bills matching every supplied criterion, in input order.
     */
    public List<FailedBill> filter(List<FailedBill> bills, BillFilter filter) {
        Predicate<FailedBill> predicate = toPredicate(filter == null ? BillFilter.none() : filter);
        return bills.stream().filter(predicate).toList();
    }

    /**
     * Partition bills by a dimension. Group values keep input order; keys are sorted, with
     * age buckets in range order followed by {@code Unknown}.
     */
    public Map<String, List<FailedBill>> groupBy(List<FailedBill> bills, GroupDimension dimension) {
        Function<FailedBill, String> keyFn = groupKeyFunction(dimension);
        Map<String, List<FailedBill>> groups = dimension == GroupDimension.AGE_BUCKET
                ? ageOrderedMap()
                : new TreeMap<>();
        for (FailedBill bill : bills) {
            groups.computeIfAbsent(keyFn.apply(bill), k -> new ArrayList<>()).add(bill);
        }
        groups.values().removeIf(List::isEmpty);
        return groups;
    }

    public BillStats aggregateStats(List<FailedBill> bills) {
        return new BillStats(
                count(bills, groupKeyFunction(GroupDimension.KIND), new TreeMap<>()),
                count(bills, groupKeyFunction(GroupDimension.PROVIDER), new TreeMap<>()),
                count(bills, groupKeyFunction(GroupDimension.AGE_BUCKET), zeroedAgeCounts()));
    }

    private Predicate<FailedBill> toPredicate(BillFilter filter) {
        Predicate<FailedBill> predicate = bill -> true;

        String kind = blankToNull(filter.getKind());
        if (kind != null) {
            predicate = predicate.and(bill -> matchesKind(bill, kind));
        }

        String provider = blankToNull(filter.getProvider());
        if (provider != null) {
            predicate = predicate.and(bill -> bill.providerName().equals(provider));
        }

        AgeBucket bucket = filter.getAgeBucket();
        if (bucket != null) {
            LocalDate today = today();
            predicate = predicate.and(bill -> bucket.matches(bill.ageDays(today)));
        }

        String search = blankToNull(filter.getSearchText());
        if (search != null) {
            String needle = search.toLowerCase(Locale.ROOT);
            predicate = predicate.and(bill -> bill.getFilename() != null
                    && bill.getFilename().toLowerCase(Locale.ROOT).contains(needle));
        }

        return predicate;
    }

    /**
     * A bill matches when any reason's kind token starts with {@code kind}. Bills without reasons
     * are grouped under {@code Unknown}, so that option selects them too.
     */
    private static boolean matchesKind(FailedBill bill, String kind) {
        if (bill.getFailureReasons().isEmpty()) {
            return FailureReason.UNKNOWN_TOKEN.equals(kind);
        }
        return bill.getFailureReasons().stream()
                .map(FailureReason::getKindToken)
                .anyMatch(token -> token.startsWith(kind));
    }

    private Function<FailedBill, String> groupKeyFunction(GroupDimension dimension) {
        Objects.requireNonNull(dimension, "dimension");
        switch (dimension) {
            case KIND:
                return kindGroupingPolicy::kindKey;
            case PROVIDER:
                return FailedBill::providerName;
            case AGE_BUCKET:
                LocalDate today = today();
                return bill -> ageBucketKey(bill.ageDays(today));
            default:
                throw new IllegalArgumentException("Unsupported group dimension: " + dimension);
        }
    }

    private static String ageBucketKey(Optional<Long> ageDays) {
        return AgeBucket.forAge(ageDays).map(AgeBucket::getLabel).orElse(AgeBucket.UNKNOWN_LABEL);
    }

    private static Map<String, List<FailedBill>> ageOrderedMap() {
        Map<String, List<FailedBill>> groups = new LinkedHashMap<>();
        for (AgeBucket bucket : AgeBucket.values()) {
            groups.put(bucket.getLabel(), new ArrayList<>());
        }
        groups.put(AgeBucket.UNKNOWN_LABEL, new ArrayList<>());
        return groups;
    }

    private static Map<String, Long> zeroedAgeCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (AgeBucket bucket : AgeBucket.values()) {
            counts.put(bucket.getLabel(), 0L);
        }
        counts.put(AgeBucket.UNKNOWN_LABEL, 0L);
        return counts;
    }

    private static Map<String, Long> count(List<FailedBill> bills, Function<FailedBill, String> keyFn,
                                           Map<String, Long> counts) {
        for (FailedBill bill : bills) {
            counts.merge(keyFn.apply(bill), 1L, Long::sum);
        }
        return counts;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
