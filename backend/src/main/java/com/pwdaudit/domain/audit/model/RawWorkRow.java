package com.pwdaudit.domain.audit.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One input row before validation: canonical field to raw cell value (String, Number,
 * Boolean or LocalDate). Produced by whatever reads the source sheet.
 *
 * @param rowNumber sheet row number, header being row 1
 * @param values    raw values keyed by canonical field; absent key means empty cell
 */
public record RawWorkRow(
        int rowNumber,
        Map<WorkField, Object> values
) {
    public RawWorkRow {
        EnumMap<WorkField, Object> copy = new EnumMap<>(WorkField.class);
        if (values != null) {
            values.forEach((field, value) -> {
                if (value != null) copy.put(field, value);
            });
        }
        values = Collections.unmodifiableMap(copy);
    }

    public Object get(WorkField field) {
        return values.get(field);
    }
}
