package com.anthem.billtriage.controller;

import com.anthem.billtriage.model.AgeBucket;
import com.anthem.billtriage.model.AssignmentResult;
import com.anthem.billtriage.model.AssignmentWarning;
import com.anthem.billtriage.model.BillFilter;
import com.anthem.billtriage.model.BillStats;
import com.anthem.billtriage.model.BillSummary;
import com.anthem.billtriage.model.GroupDimension;
import com.anthem.billtriage.model.RateAssignmentRequest;
import com.anthem.billtriage.service.AssignmentOutcome;
import com.anthem.billtriage.service.RateAssignmentService;
import com.anthem.billtriage.service.TriageViewService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Failed bill triage API.
 * Lists, filters and groups bills in the fails location and accepts rate assignments for them.
 */
@RestController
@RequestMapping("/processing/fails")
@RequiredArgsConstructor
@Slf4j
public class FailedBillController {

    private final TriageViewService triageViewService;
    private final RateAssignmentService rateAssignmentService;

    /**
     * GET /processing/fails?kind=&provider=&ageBucket=&search=
     */
    @GetMapping
    public ResponseEntity<List<BillSummary>> listFailedBills(
            @RequestParam(required = false) String kind,
            @RequestParam(required = false) String provider,
            @RequestParam(required = false) String ageBucket,
            @RequestParam(required = false) String search) {

        BillFilter filter = toFilter(kind, provider, ageBucket, search);
        log.debug("Listing failed bills - filter: {}", filter);
        return ResponseEntity.ok(triageViewService.list(filter));
    }

    @GetMapping("/options")
    public ResponseEntity<TriageViewService.FilterOptions> filterOptions() {
        return ResponseEntity.ok(triageViewService.options());
    }

    /**
     * GET /processing/fails/groups?by=kind|provider|ageBucket
     */
    @GetMapping("/groups")
    public ResponseEntity<Map<String, List<BillSummary>>> groupFailedBills(
            @RequestParam(defaultValue = "kind") String by,
            @RequestParam(required = false) String kind,
            @RequestParam(required = false) String provider,
            @RequestParam(required = false) String ageBucket,
            @RequestParam(required = false) String search) {

        GroupDimension dimension = GroupDimension.fromParam(by)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported grouping: " + by));
        return ResponseEntity.ok(triageViewService.groups(dimension, toFilter(kind, provider, ageBucket, search)));
    }

    @GetMapping("/stats")
    public ResponseEntity<BillStats> stats(
            @RequestParam(required = false) String kind,
            @RequestParam(required = false) String provider,
            @RequestParam(required = false) String ageBucket,
            @RequestParam(required = false) String search) {
        return ResponseEntity.ok(triageViewService.stats(toFilter(kind, provider, ageBucket, search)));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "billtriage",
                "timestamp", Instant.now().toString()));
    }

    @GetMapping("/{filename}")
    public ResponseEntity<BillSummary> getFailedBill(@PathVariable String filename) {
        return ResponseEntity.ok(triageViewService.get(filename));
    }

    /**
     * POST /processing/fails/{filename}/assign-rates
     * Rejections surface through the exception handler; this method only builds the success body.
     */
    @PostMapping("/{filename}/assign-rates")
    public ResponseEntity<Map<String, Object>> assignRates(
            @PathVariable String filename,
            @RequestBody RateAssignmentRequest request) {

        log.info("Received rate assignment - filename: {}, mode: {}", filename, request.getMode());

        AssignmentOutcome outcome = rateAssignmentService.assignRates(filename, request);
        AssignmentResult result = outcome.result();
        List<AssignmentWarning> warnings = outcome.warnings();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", result.summaryMessage());
        body.put("result", result);
        body.put("warnings", warnings);
        return ResponseEntity.ok(body);
    }

    private static BillFilter toFilter(String kind, String provider, String ageBucket, String search) {
        AgeBucket bucket = null;
        if (ageBucket != null && !ageBucket.isBlank()) {
            bucket = AgeBucket.fromValue(ageBucket)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown age bucket: " + ageBucket));
        }
        return BillFilter.builder()
                .kind(blankToNull(kind))
                .provider(blankToNull(provider))
                .ageBucket(bucket)
                .searchText(blankToNull(search))
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
