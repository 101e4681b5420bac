package com.pwdaudit.infrastructure.audit.batch;

import com.pwdaudit.domain.audit.model.AuditThresholds;
import com.pwdaudit.domain.audit.model.DataQualityNote;
import com.pwdaudit.domain.audit.model.Flag;
import com.pwdaudit.domain.audit.model.FlagType;
import com.pwdaudit.domain.audit.model.RoadKey;
import com.pwdaudit.domain.audit.model.Severity;
import com.pwdaudit.domain.audit.model.WorkRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rule 4: two works on the same road whose chainage intersects while the earlier one is
 * still active or under defect liability. Each group is swept in chainage order with a set
 * of still-open intervals, so only works that can actually touch are compared.
 * Every overlapping pair flags both records, each pointing at the other.
 */
@Slf4j
@Component
public class OverlappingWorksDetector {

    private static final Comparator<Span> BY_CHAINAGE = Comparator
            .comparingDouble(Span::from)
            .thenComparingInt(span -> span.record().rowNumber());

    record Span(WorkRecord record, double from, double to, LocalDate activeFrom, LocalDate activeTo) {}

    public BatchFindings detect(List<WorkRecord> records, AuditThresholds thresholds) {
        List<DataQualityNote> notes = new ArrayList<>();
        Map<RoadKey, List<Span>> groups = new LinkedHashMap<>();

        for (WorkRecord record : records) {
            if (!record.hasChainage()) {
                notes.add(DataQualityNote.ruleSkipped(record.rowNumber(), FlagType.OVERLAPPING_WORKS,
                        "Overlapping of Work check skipped: chainage not recorded"));
                continue;
            }
            Optional<LocalDate> start = record.referenceDate();
            if (start.isEmpty()) {
                notes.add(DataQualityNote.ruleSkipped(record.rowNumber(), FlagType.OVERLAPPING_WORKS,
                        "Overlapping of Work check skipped: work order date not recorded"));
                continue;
            }
            Span span = new Span(record, record.chainageFrom(), record.chainageTo(),
                    start.get(), activeUntil(record, start.get(), thresholds));
            groups.computeIfAbsent(RoadKey.of(record), k -> new ArrayList<>()).add(span);
        }

        Map<Integer, List<Flag>> flags = new HashMap<>();
        int pairs = 0;
        for (Map.Entry<RoadKey, List<Span>> group : groups.entrySet()) {
            pairs += sweep(group.getKey(), group.getValue(), flags);
        }

        // Peers in row order so a record's overlap flags do not depend on sweep order
        flags.values().forEach(list -> list.sort(Comparator.comparingInt(
                flag -> (Integer) flag.details().get("peer_row_number"))));

        if (pairs > 0) {
            log.info("Overlapping works: {} pairs across {} road groups", pairs, groups.size());
        }
        return new BatchFindings(flags, notes);
    }

    private int sweep(RoadKey road, List<Span> spans, Map<Integer, List<Flag>> flags) {
        spans.sort(BY_CHAINAGE);
        List<Span> open = new ArrayList<>();
        int pairs = 0;

        for (Span current : spans) {
            open.removeIf(span -> span.to() <= current.from());
            for (Span earlier : open) {
                double overlapKm = Math.min(earlier.to(), current.to()) - Math.max(earlier.from(), current.from());
                if (overlapKm > 0 && activeTogether(earlier, current)) {
                    addFlag(flags, road, earlier, current, overlapKm);
                    addFlag(flags, road, current, earlier, overlapKm);
                    pairs++;
                }
            }
            open.add(current);
        }
        return pairs;
    }

    private static boolean activeTogether(Span a, Span b) {
        return !a.activeFrom().isAfter(b.activeTo()) && !b.activeFrom().isAfter(a.activeTo());
    }

    /**
     * End of the defect liability period: the recorded DLP end, else completion
     * (actual or stipulated) plus the default DLP.
     */
    static LocalDate activeUntil(WorkRecord record, LocalDate start, AuditThresholds thresholds) {
        if (record.dlpEndDate() != null) {
            return record.dlpEndDate().isBefore(start) ? start : record.dlpEndDate();
        }
        LocalDate completion = record.physicalCompletionDate() != null
                ? record.physicalCompletionDate()
                : record.expectedCompletionDate().orElse(start);
        LocalDate end = completion.plusDays(thresholds.defaultDlpDays());
        return end.isBefore(start) ? start : end;
    }

    private static void addFlag(Map<Integer, List<Flag>> flags, RoadKey road,
                                Span self, Span peer, double overlapKm) {
        BigDecimal overlap = BigDecimal.valueOf(overlapKm).setScale(3, RoundingMode.HALF_UP);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("road", road.toString());
        details.put("chainage", chainage(self));
        details.put("peer_row_number", peer.record().rowNumber());
        details.put("peer_budget_item_no", peer.record().budgetItemNo());
        details.put("peer_chainage", chainage(peer));
        details.put("overlap_km", overlap);
        details.put("active_until", self.activeTo());
        details.put("peer_active_until", peer.activeTo());

        flags.computeIfAbsent(self.record().rowNumber(), k -> new ArrayList<>()).add(new Flag(
                FlagType.OVERLAPPING_WORKS,
                Severity.HIGH,
                String.format("Works overlap on %s: chainage %s overlaps row %d (%s) by %s km during defect liability",
                        road, chainage(self), peer.record().rowNumber(), chainage(peer), overlap.toPlainString()),
                details));
    }

    private static String chainage(Span span) {
        return span.from() + " to " + span.to();
    }
}
