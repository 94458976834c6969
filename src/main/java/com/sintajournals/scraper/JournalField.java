package com.sintajournals.scraper;

import java.util.function.Function;

/**
 * One exported column of {@link JournalRecord}: the artifact field name and how to read its
 * value from a record.
 */
public class JournalField {
    public final String fieldName;
    public final Function<JournalRecord, Object> accessor;

    public JournalField(String fieldName, Function<JournalRecord, Object> accessor) {
        this.fieldName = fieldName;
        this.accessor = accessor;
    }

    /**
     * @return the typed value of this field (String, Boolean or Integer)
     */
    public Object valueOf(JournalRecord record) {
        return accessor.apply(record);
    }

    /**
     * @return the canonical text form used in CSV cells
     */
    public String textOf(JournalRecord record) {
        Object value = valueOf(record);
        return value == null ? "" : value.toString();
    }
}
