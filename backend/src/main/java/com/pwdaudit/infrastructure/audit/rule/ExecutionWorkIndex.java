package com.pwdaudit.infrastructure.audit.rule;

import com.pwdaudit.domain.audit.model.RoadKey;
import com.pwdaudit.domain.audit.model.WorkRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Execution-phase works (anything but surveys) indexed by budget item and by road,
 * so a survey can look up its follow-up work without scanning the whole ledger.
 */
public final class ExecutionWorkIndex {

    private final Map<String, List<WorkRecord>> byBudgetItem;
    private final Map<RoadKey, List<WorkRecord>> byRoad;

    private ExecutionWorkIndex(Map<String, List<WorkRecord>> byBudgetItem,
                               Map<RoadKey, List<WorkRecord>> byRoad) {
        this.byBudgetItem = byBudgetItem;
        this.byRoad = byRoad;
    }

    public static ExecutionWorkIndex build(List<WorkRecord> records) {
        Map<String, List<WorkRecord>> byBudgetItem = new HashMap<>();
        Map<RoadKey, List<WorkRecord>> byRoad = new HashMap<>();
        for (WorkRecord record : records) {
            if (!record.workTypeOrOther().isExecutionPhase()) {
                continue;
            }
            if (record.budgetItemNo() != null) {
                byBudgetItem.computeIfAbsent(budgetItemKey(record.budgetItemNo()), k -> new ArrayList<>()).add(record);
            }
            if (record.hasChainage()) {
                byRoad.computeIfAbsent(RoadKey.of(record), k -> new ArrayList<>()).add(record);
            }
        }
        return new ExecutionWorkIndex(byBudgetItem, byRoad);
    }

    public static ExecutionWorkIndex empty() {
        return new ExecutionWorkIndex(Map.of(), Map.of());
    }

    /**
     * First execution work on the same budget item, or on the same road with touching
     * chainage, dated inside [from, to].
     */
    public Optional<WorkRecord> findFollowUp(WorkRecord survey, LocalDate from, LocalDate to) {
        List<WorkRecord> sameItem = survey.budgetItemNo() == null
                ? List.of()
                : byBudgetItem.getOrDefault(budgetItemKey(survey.budgetItemNo()), List.of());
        for (WorkRecord candidate : sameItem) {
            if (candidate.rowNumber() != survey.rowNumber() && datedWithin(candidate, from, to)) {
                return Optional.of(candidate);
            }
        }
        if (!survey.hasChainage()) {
            return Optional.empty();
        }
        for (WorkRecord candidate : byRoad.getOrDefault(RoadKey.of(survey), List.of())) {
            if (candidate.rowNumber() != survey.rowNumber()
                    && touches(survey, candidate)
                    && datedWithin(candidate, from, to)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static boolean datedWithin(WorkRecord record, LocalDate from, LocalDate to) {
        return record.referenceDate()
                .map(date -> !date.isBefore(from) && !date.isAfter(to))
                .orElse(false);
    }

    private static boolean touches(WorkRecord a, WorkRecord b) {
        return Math.max(a.chainageFrom(), b.chainageFrom()) <= Math.min(a.chainageTo(), b.chainageTo());
    }

    private static String budgetItemKey(String budgetItemNo) {
        return budgetItemNo.strip().toUpperCase(Locale.ROOT);
    }
}
