package com.pwdaudit.domain.audit.model;

/**
 * Which road a work sits on. Works on the same category but a different (known) road
 * number never share chainage.
 *
 * @param category   SH, MDR, NH or OTHER
 * @param roadNumber compact road number such as "SH123", null when the register does not say
 */
public record RoadKey(RoadCategory category, String roadNumber) {

    public static RoadKey of(WorkRecord record) {
        return new RoadKey(record.roadCategoryOrOther(), record.roadNumber());
    }

    @Override
    public String toString() {
        return roadNumber != null ? roadNumber : category.name();
    }
}
