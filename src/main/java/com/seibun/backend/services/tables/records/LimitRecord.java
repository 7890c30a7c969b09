package com.seibun.backend.services.tables.records;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.Builder;

/**
 * One usage limit of one substance, as appended to the spreadsheet.
 *
 * amount1 is the general (or aggregate-total) limit; amount2..amount4 are the rinse-off, leave-on and
 * mucosal limits of the categorized tables.
 */
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LimitRecord(
        String substanceName,
        String condition,
        String amount1,
        String amount2,
        String amount3,
        String amount4,
        LimitUnit unit,
        LimitNote note,
        String sourceUrl
) {

    public LimitRecord {
        substanceName = substanceName == null ? "" : substanceName;
        condition = condition == null ? "" : condition;
        amount1 = amount1 == null ? "" : amount1;
        amount2 = amount2 == null ? "" : amount2;
        amount3 = amount3 == null ? "" : amount3;
        amount4 = amount4 == null ? "" : amount4;
        unit = unit == null ? LimitUnit.NONE : unit;
        note = note == null ? LimitNote.NONE : note;
        sourceUrl = sourceUrl == null ? "" : sourceUrl;
    }

    public boolean hasAnyValue() {
        return !amount1.isBlank()
                || !amount2.isBlank()
                || !amount3.isBlank()
                || !amount4.isBlank()
                || unit.isPresent()
                || note.isPresent();
    }
}
