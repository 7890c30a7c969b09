package com.seibun.backend.services.tables.records;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class RecordFilterTest {

    private static LimitRecord.LimitRecordBuilder bare(String name) {
        return LimitRecord.builder()
                .substanceName(name)
                .amount1("")
                .amount2("")
                .amount3("")
                .amount4("")
                .unit(LimitUnit.NONE)
                .note(LimitNote.NONE);
    }

    @Test
    void dropsRecordWithoutAnyValue() {
        assertFalse(RecordFilter.isRetained(bare("Delta").build()));
    }

    @Test
    void keepsRecordWithOnlyUnit() {
        assertTrue(RecordFilter.isRetained(bare("Delta").unit(LimitUnit.WEIGHT).build()));
    }

    @Test
    void keepsRecordWithOnlyNoteOrOneAmount() {
        assertTrue(RecordFilter.isRetained(bare("Delta").note(LimitNote.AGGREGATE_TOTAL).build()));
        assertTrue(RecordFilter.isRetained(bare("Delta").amount3("0.1").build()));
    }

    @Test
    void dropsRecordWithoutName() {
        assertFalse(RecordFilter.isRetained(bare(" ").amount1("1").unit(LimitUnit.WEIGHT).build()));
        assertFalse(RecordFilter.isRetained(null));
    }

    @Test
    void conditionAloneIsNotAValue() {
        assertFalse(RecordFilter.isRetained(bare("Delta").condition("洗い流すもの").build()));
    }

    @Test
    void filterKeepsOrder() {
        LimitRecord a = bare("A").amount1("1").build();
        LimitRecord b = bare("B").build();
        LimitRecord c = bare("C").unit(LimitUnit.INTERNATIONAL_UNIT).build();

        assertEquals(List.of(a, c), RecordFilter.filter(List.of(a, b, c)));
    }
}
