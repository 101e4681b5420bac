package com.pwdaudit.infrastructure.audit.ingest;

import com.pwdaudit.domain.audit.model.RawWorkRow;
import com.pwdaudit.domain.audit.model.WorkField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static mapping from the column headers seen in PWD works registers to canonical fields.
 * Headers are matched after dropping case, whitespace, '_' and '.', so
 * "Date of Work_Order" and "date of work order" resolve to the same field.
 * Columns reported in lakh are converted to rupees here.
 */
@Slf4j
@Component
public class ColumnAliasTable {

    public record ColumnMapping(WorkField field, BigDecimal multiplier) {}

    private static final BigDecimal RUPEES = BigDecimal.ONE;
    private static final BigDecimal LAKH = BigDecimal.valueOf(100_000);

    private static final Map<String, ColumnMapping> ALIASES;

    static {
        Map<String, ColumnMapping> aliases = new HashMap<>();
        alias(aliases, WorkField.SERIAL_NO, RUPEES, "Sr.", "Sr. No.", "Serial No", "Sl. No.");
        alias(aliases, WorkField.BUDGET_ITEM_NO, RUPEES, "Budget Item No.", "Budget Item Number", "Budget Item");
        alias(aliases, WorkField.WORK_NAME, RUPEES, "Name of the work", "Work Name", "Name of Work");
        alias(aliases, WorkField.WORK_NAME_LOCAL, RUPEES, "Name Of The Work (In Marathi)",
                "Name of the work (Marathi)", "Name of the work (Hindi)", "Work Name Local");
        alias(aliases, WorkField.DISTRICT, RUPEES, "District");
        alias(aliases, WorkField.HEAD_OF_ACCOUNT, RUPEES, "Head of Accounts", "Head of Account", "Budget Head");
        alias(aliases, WorkField.EXPENDITURE_HEAD, RUPEES, "Expenditure Head", "Expenditure Booked Under",
                "Head Debited", "Fund Source Head");
        alias(aliases, WorkField.AA_COST, LAKH, "Administrative Approval Cost (Lakh)",
                "Administrative Approval Cost (Lakhs)", "AA Cost (Lakh)");
        alias(aliases, WorkField.AA_COST, RUPEES, "Administrative Approval Cost", "AA Cost");
        alias(aliases, WorkField.AA_DATE, RUPEES, "Administrative Approval Date", "AA Date");
        alias(aliases, WorkField.CONTRACT_COST, LAKH, "Contract Agreement Cost (Lakh)",
                "Contract Agreement Cost (Lakhs)", "Contract Cost (Lakh)");
        alias(aliases, WorkField.CONTRACT_COST, RUPEES, "Contract Agreement Cost", "Contract Cost");
        alias(aliases, WorkField.TOTAL_EXPENDITURE, LAKH, "Total Expenditure (Lakhs)", "Total Expenditure (Lakh)");
        alias(aliases, WorkField.TOTAL_EXPENDITURE, RUPEES, "Total Expenditure");
        alias(aliases, WorkField.CENTAGE_RECOVERED, LAKH, "Centage Recovered (Lakh)", "Centage Recovered (Lakhs)");
        alias(aliases, WorkField.CENTAGE_RECOVERED, RUPEES, "Centage Recovered", "Centage Charges Recovered");
        alias(aliases, WorkField.UNSPENT_BALANCE, LAKH, "Unspent Balance (Lakh)", "Unspent Balance (Lakhs)");
        alias(aliases, WorkField.UNSPENT_BALANCE, RUPEES, "Unspent Balance");
        alias(aliases, WorkField.BALANCE_REFUNDED, RUPEES, "Balance Refunded", "Refund Made", "Unspent Balance Refunded");
        alias(aliases, WorkField.PHYSICAL_PROGRESS_PERCENT, RUPEES, "Physical Progress", "Physical Progress (%)");
        alias(aliases, WorkField.WORK_ORDER_DATE, RUPEES, "Date of Work_Order", "Work Order Date");
        alias(aliases, WorkField.ORIGINAL_TIME_LIMIT_DAYS, RUPEES, "Original Time Limit in Days", "Time Limit (Days)");
        alias(aliases, WorkField.PHYSICAL_COMPLETION_DATE, RUPEES, "Physical Completion Date", "Date of Completion");
        alias(aliases, WorkField.DLP_END_DATE, RUPEES, "DLP End Date", "Defect Liability Period End");
        alias(aliases, WorkField.WORK_TYPE, RUPEES, "Work Category", "Work Type");
        alias(aliases, WorkField.ROAD_CATEGORY, RUPEES, "Road Category");
        alias(aliases, WorkField.ROAD_NUMBER, RUPEES, "Road Number", "Road No.");
        alias(aliases, WorkField.CHAINAGE_FROM, RUPEES, "Chainage From");
        alias(aliases, WorkField.CHAINAGE_TO, RUPEES, "Chainage To");
        alias(aliases, WorkField.DEPOSIT_WORK, RUPEES, "Deposit Work", "Is Deposit Work");
        ALIASES = Collections.unmodifiableMap(aliases);
    }

    public Optional<ColumnMapping> resolve(String header) {
        if (header == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ALIASES.get(normalizeHeader(header)));
    }

    /**
     * Map one spreadsheet-shaped row to canonical fields. Lakh amounts that parse are
     * scaled to rupees; ones that don't are passed through untouched so validation can
     * report them. When two headers map to the same field the first non-empty one wins.
     */
    public RawWorkRow toRawRow(int rowNumber, Map<String, Object> cells) {
        Map<WorkField, Object> values = new EnumMap<>(WorkField.class);
        List<String> unknown = new ArrayList<>();

        for (Map.Entry<String, Object> cell : cells.entrySet()) {
            Optional<ColumnMapping> mapping = resolve(cell.getKey());
            if (mapping.isEmpty()) {
                unknown.add(cell.getKey());
                continue;
            }
            Object value = cell.getValue();
            if (ValueParser.text(value) == null || values.containsKey(mapping.get().field())) {
                continue;
            }
            values.put(mapping.get().field(), scale(value, mapping.get().multiplier()));
        }

        if (!unknown.isEmpty()) {
            log.debug("Row {}: ignored unmapped columns {}", rowNumber, unknown);
        }
        return new RawWorkRow(rowNumber, values);
    }

    /**
     * Headers that the table does not know, for a one-off warning per upload.
     */
    public List<String> unmappedHeaders(Iterable<String> headers) {
        List<String> unmapped = new ArrayList<>();
        for (String header : headers) {
            if (resolve(header).isEmpty()) unmapped.add(header);
        }
        return unmapped;
    }

    static String normalizeHeader(String header) {
        return header.toLowerCase(Locale.ROOT).replaceAll("[\\s_.]+", "");
    }

    private static Object scale(Object value, BigDecimal multiplier) {
        if (multiplier.compareTo(BigDecimal.ONE) == 0) {
            return value;
        }
        BigDecimal amount;
        try {
            amount = ValueParser.decimal(value);
        } catch (IllegalArgumentException e) {
            return value;
        }
        return amount == null ? null : amount.multiply(multiplier);
    }

    private static void alias(Map<String, ColumnMapping> aliases, WorkField field,
                              BigDecimal multiplier, String... headers) {
        for (String header : headers) {
            ColumnMapping previous = aliases.put(normalizeHeader(header), new ColumnMapping(field, multiplier));
            if (previous != null) {
                throw new IllegalStateException("Duplicate column alias: " + header);
            }
        }
    }
}
