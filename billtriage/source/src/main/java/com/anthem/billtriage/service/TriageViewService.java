package com.anthem.billtriage.service;

import com.anthem.billtriage.model.BillFilter;
import com.anthem.billtriage.model.BillStats;
import com.anthem.billtriage.model.BillSummary;
import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.model.GroupDimension;
import com.anthem.billtriage.query.FailedBillQueryService;
import com.anthem.billtriage.repository.FailedBillRepository;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator views over the current failed set. Each call reads a fresh snapshot.
 */
@Service
public class TriageViewService {

    private final FailedBillRepository failedBillRepository;
    private final FailedBillQueryService queryService;

    public TriageViewService(FailedBillRepository failedBillRepository, FailedBillQueryService queryService) {
        this.failedBillRepository = failedBillRepository;
        this.queryService = queryService;
    }

    public List<BillSummary> list(BillFilter filter) {
        List<FailedBill> bills = queryService.filter(failedBillRepository.findAll(), filter);
        return summarize(bills, queryService.today());
    }

    public BillSummary get(String filename) {
        FailedBill bill = failedBillRepository.findByFilename(filename)
                .orElseThrow(() -> new BillNotFoundException(filename));
        return BillSummary.from(bill, queryService.today());
    }

    public FilterOptions options() {
        List<FailedBill> bills = failedBillRepository.findAll();
        return new FilterOptions(
                queryService.distinctFailureKinds(bills),
                queryService.distinctProviders(bills),
                queryService.ageBucketLabels());
    }

    public Map<String, List<BillSummary>> groups(GroupDimension dimension, BillFilter filter) {
        List<FailedBill> bills = queryService.filter(failedBillRepository.findAll(), filter);
        LocalDate today = queryService.today();
        Map<String, List<BillSummary>> grouped = new LinkedHashMap<>();
        queryService.groupBy(bills, dimension).forEach((key, members) -> grouped.put(key, summarize(members, today)));
        return grouped;
    }

    public BillStats stats(BillFilter filter) {
        return queryService.aggregateStats(queryService.filter(failedBillRepository.findAll(), filter));
    }

    private static List<BillSummary> summarize(List<FailedBill> bills, LocalDate today) {
        return bills.stream().map(b -> BillSummary.from(b, today)).toList();
    }

    public record FilterOptions(List<String> failureKinds, List<String> providers, List<String> ageBuckets) {}
}
