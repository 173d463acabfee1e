package com.anthem.billtriage.service;

import com.anthem.billtriage.model.BillFilter;
import com.anthem.billtriage.model.BillSummary;
import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.model.GroupDimension;
import com.anthem.billtriage.query.FailedBillQueryService;
import com.anthem.billtriage.query.GroupByFirstReason;
import com.anthem.billtriage.repository.FailedBillRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.anthem.billtriage.BillFixtures.bill;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TriageViewServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);

    @Mock
    private FailedBillRepository failedBillRepository;

    private TriageViewService service;
    private FailedBill recent;
    private FailedBill old;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-30T12:00:00Z"), ZoneOffset.UTC);
        service = new TriageViewService(failedBillRepository, new FailedBillQueryService(new GroupByFirstReason(), clock));
        recent = bill("recent.json", "Acme Imaging", TODAY.minusDays(3), "RATE_MISSING: 70551", "NEW_RULE_X: 1");
        old = bill("old.json", null, TODAY.minusDays(75), "UNMATCHED_CPT: G0283");
    }

    @Test
    void list_mapsFilteredBillsToSummaries() {
        when(failedBillRepository.findAll()).thenReturn(List.of(recent, old));

        List<BillSummary> summaries = service.list(BillFilter.builder().kind("RATE_MISSING").build());

        assertThat(summaries).hasSize(1);
        BillSummary summary = summaries.get(0);
        assertThat(summary.getFilename()).isEqualTo("recent.json");
        assertThat(summary.getAgeDays()).isEqualTo(3L);
        assertThat(summary.getAgeBucket()).isEqualTo("0–30");
        assertThat(summary.getFailureKinds()).containsExactly("RATE_MISSING", "NEW_RULE_X");
        assertThat(summary.getFailureKindDisplays().get(1).getColor()).isEqualTo("#6c757d");
        assertThat(summary.getFailingCodes()).containsExactly("70551", "1");
    }

    @Test
    void get_unknownBill() {
        when(failedBillRepository.findByFilename("nope.json")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.get("nope.json")).isInstanceOf(BillNotFoundException.class);
    }

    @Test
    void options_collectsSortedChoices() {
        when(failedBillRepository.findAll()).thenReturn(List.of(recent, old));

        TriageViewService.FilterOptions options = service.options();

        assertThat(options.failureKinds()).containsExactly("NEW_RULE_X", "RATE_MISSING", "UNMATCHED_CPT");
        assertThat(options.providers()).containsExactly("Acme Imaging", FailedBill.UNKNOWN_PROVIDER);
        assertThat(options.ageBuckets()).containsExactly("0–30", "31–60", "61+");
    }

    @Test
    void groups_byProvider() {
        when(failedBillRepository.findAll()).thenReturn(List.of(recent, old));

        Map<String, List<BillSummary>> groups = service.groups(GroupDimension.PROVIDER, BillFilter.none());

        assertThat(groups).containsOnlyKeys("Acme Imaging", FailedBill.UNKNOWN_PROVIDER);
        assertThat(groups.get(FailedBill.UNKNOWN_PROVIDER)).extracting(BillSummary::getFilename)
                .containsExactly("old.json");
    }

    @Test
    void stats_overFilteredSet() {
        when(failedBillRepository.findAll()).thenReturn(List.of(recent, old));

        var stats = service.stats(BillFilter.builder().searchText("OLD").build());

        assertThat(stats.getByKind()).containsOnly(Map.entry("UNMATCHED_CPT", 1L));
        assertThat(stats.getByAgeBucket()).containsEntry("61+", 1L).containsEntry("0–30", 0L);
    }
}
