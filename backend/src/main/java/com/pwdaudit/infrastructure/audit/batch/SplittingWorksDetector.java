package com.pwdaudit.infrastructure.audit.batch;

import com.pwdaudit.domain.audit.model.AuditThresholds;
import com.pwdaudit.domain.audit.model.Flag;
import com.pwdaudit.domain.audit.model.FlagType;
import com.pwdaudit.domain.audit.model.RoadKey;
import com.pwdaudit.domain.audit.model.Severity;
import com.pwdaudit.domain.audit.model.WorkRecord;
import com.pwdaudit.infrastructure.audit.similarity.NameSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule 6: one work cut into several contracts that each stay below the e-tendering ceiling.
 * <p>
 * Candidates are works under the ceiling. Two candidates on the same road are linked when
 * their chainage overlaps or nearly meets, their names score above the similarity cutoff and
 * their dates fall within the time window. Linked candidates form a group, and a group whose
 * dates spread wider than the window is cut into window-sized slices and linked again, so no
 * group outlasts one budget cycle. A group of at least the minimum size whose combined cost
 * exceeds the ceiling flags every member.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SplittingWorksDetector {

    private static final Comparator<Candidate> BY_DATE = Comparator
            .comparing(Candidate::date)
            .thenComparingInt(c -> c.record().rowNumber());

    private static final Comparator<Candidate> BY_CHAINAGE = Comparator
            .comparingDouble((Candidate c) -> c.record().chainageFrom())
            .thenComparingInt(c -> c.record().rowNumber());

    private final NameSimilarity nameSimilarity;

    record Candidate(WorkRecord record, LocalDate date) {}

    public BatchFindings detect(List<WorkRecord> records, AuditThresholds thresholds) {
        Map<RoadKey, List<Candidate>> groups = new LinkedHashMap<>();
        for (WorkRecord record : records) {
            if (isCandidate(record, thresholds)) {
                groups.computeIfAbsent(RoadKey.of(record), k -> new ArrayList<>())
                        .add(new Candidate(record, record.referenceDate().orElseThrow()));
            }
        }

        Map<Integer, List<Flag>> flags = new HashMap<>();
        int flaggedGroups = 0;
        for (Map.Entry<RoadKey, List<Candidate>> group : groups.entrySet()) {
            for (List<Candidate> members : groups(group.getValue(), thresholds)) {
                if (triggers(members, thresholds)) {
                    flagGroup(group.getKey(), members, thresholds, flags);
                    flaggedGroups++;
                }
            }
        }

        if (flaggedGroups > 0) {
            log.info("Splitting of works: {} suspicious groups", flaggedGroups);
        }
        return new BatchFindings(flags, List.of());
    }

    private static boolean isCandidate(WorkRecord record, AuditThresholds thresholds) {
        return record.contractCost() != null
                && record.contractCost().signum() > 0
                && record.contractCost().compareTo(thresholds.splittingCostCeiling()) < 0
                && record.hasChainage()
                && record.referenceDate().isPresent();
    }

    private List<List<Candidate>> groups(List<Candidate> candidates, AuditThresholds thresholds) {
        List<List<Candidate>> result = new ArrayList<>();
        for (List<Candidate> component : link(candidates, thresholds)) {
            if (daySpan(component) <= thresholds.splittingWindowDays()) {
                result.add(component);
                continue;
            }
            for (List<Candidate> slice : sliceByWindow(component, thresholds.splittingWindowDays())) {
                result.addAll(groups(slice, thresholds));
            }
        }
        return result;
    }

    /**
     * Greedy cut in date order: each slice starts at its earliest work and takes every later
     * work dated within the window. A component wider than the window yields at least two slices.
     */
    private static List<List<Candidate>> sliceByWindow(List<Candidate> component, int windowDays) {
        List<Candidate> byDate = new ArrayList<>(component);
        byDate.sort(BY_DATE);
        List<List<Candidate>> slices = new ArrayList<>();
        List<Candidate> current = new ArrayList<>();
        LocalDate sliceEnd = null;
        for (Candidate candidate : byDate) {
            if (sliceEnd == null || candidate.date().isAfter(sliceEnd)) {
                if (!current.isEmpty()) slices.add(current);
                current = new ArrayList<>();
                sliceEnd = candidate.date().plusDays(windowDays);
            }
            current.add(candidate);
        }
        slices.add(current);
        return slices;
    }

    private static long daySpan(List<Candidate> members) {
        LocalDate first = members.stream().map(Candidate::date).min(Comparator.naturalOrder()).orElseThrow();
        LocalDate last = members.stream().map(Candidate::date).max(Comparator.naturalOrder()).orElseThrow();
        return ChronoUnit.DAYS.between(first, last);
    }

    /**
     * Chainage sweep within one road; returns connected groups, each in chainage order.
     */
    private List<List<Candidate>> link(List<Candidate> candidates, AuditThresholds thresholds) {
        candidates.sort(BY_CHAINAGE);
        DisjointSet sets = new DisjointSet(candidates.size());
        List<Integer> reach = new ArrayList<>();
        double gap = thresholds.splittingChainageGapKm();

        for (int i = 0; i < candidates.size(); i++) {
            WorkRecord current = candidates.get(i).record();
            reach.removeIf(j -> candidates.get(j).record().chainageTo() + gap < current.chainageFrom());
            for (int j : reach) {
                if (sameWork(candidates.get(j), candidates.get(i), thresholds)) {
                    sets.union(j, i);
                }
            }
            reach.add(i);
        }

        Map<Integer, List<Candidate>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            byRoot.computeIfAbsent(sets.find(i), k -> new ArrayList<>()).add(candidates.get(i));
        }
        return new ArrayList<>(byRoot.values());
    }

    private boolean sameWork(Candidate a, Candidate b, AuditThresholds thresholds) {
        long daysApart = Math.abs(ChronoUnit.DAYS.between(a.date(), b.date()));
        if (daysApart > thresholds.splittingWindowDays()) {
            return false;
        }
        return nameSimilarity.score(a.record(), b.record()) >= thresholds.nameSimilarityCutoff();
    }

    private static boolean triggers(List<Candidate> members, AuditThresholds thresholds) {
        return members.size() >= thresholds.splittingMinGroupSize()
                && combinedCost(members).compareTo(thresholds.splittingCostCeiling()) > 0;
    }

    private static BigDecimal combinedCost(List<Candidate> members) {
        return members.stream()
                .map(c -> c.record().contractCost())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static void flagGroup(RoadKey road, List<Candidate> members, AuditThresholds thresholds,
                                  Map<Integer, List<Flag>> flags) {
        BigDecimal combined = combinedCost(members);
        double spanFrom = members.stream().mapToDouble(c -> c.record().chainageFrom()).min().orElse(0);
        double spanTo = members.stream().mapToDouble(c -> c.record().chainageTo()).max().orElse(0);
        List<Integer> rows = members.stream().map(c -> c.record().rowNumber()).sorted().toList();

        for (Candidate member : members) {
            int row = member.record().rowNumber();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("road", road.toString());
            details.put("group_size", members.size());
            details.put("sibling_row_numbers", rows.stream().filter(r -> r != row).toList());
            details.put("contract_cost", member.record().contractCost());
            details.put("combined_contract_cost", combined);
            details.put("tender_threshold", thresholds.splittingCostCeiling());
            details.put("chainage_span", spanFrom + " to " + spanTo);

            flags.computeIfAbsent(row, k -> new ArrayList<>()).add(new Flag(
                    FlagType.SPLITTING_OF_WORKS,
                    Severity.HIGH,
                    String.format("Potential work splitting on %s: %d works below Rs. %s together cost Rs. %s",
                            road, members.size(),
                            thresholds.splittingCostCeiling().toPlainString(), combined.toPlainString()),
                    details));
        }
    }
}
