package com.seibun.backend.services.tables.records;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.seibun.backend.services.tables.SourceTable;

class RecordSynthesizerTest {

    private static final String URL = "https://example.test/limits.pdf";

    private final RecordSynthesizer synthesizer = new RecordSynthesizer();

    private List<LimitRecord> synthesize(List<List<String>> rows) {
        return synthesizer.synthesize(SourceTable.of(URL, rows));
    }

    @Test
    void twoColumnRowFansOutOneRecordPerName() {
        List<LimitRecord> records = synthesize(List.of(List.of("Alpha Beta", "5g 合計量として10g")));

        assertEquals(2, records.size());

        LimitRecord alpha = records.get(0);
        assertEquals("Alpha", alpha.substanceName());
        assertEquals("", alpha.condition());
        assertEquals("5", alpha.amount1());
        assertEquals("", alpha.amount2());
        assertEquals(LimitUnit.WEIGHT, alpha.unit());
        assertEquals(LimitNote.NONE, alpha.note());
        assertEquals(URL, alpha.sourceUrl());

        LimitRecord beta = records.get(1);
        assertEquals("Beta", beta.substanceName());
        assertEquals("10", beta.amount1());
        assertEquals(LimitUnit.WEIGHT, beta.unit());
        assertEquals(LimitNote.AGGREGATE_TOTAL, beta.note());
    }

    @Test
    void fourColumnRowTakesAggregateTotalAsGeneralLimit() {
        List<LimitRecord> records = synthesize(List.of(List.of("Gamma", "5g", "合計量として10g", "15g")));

        assertEquals(1, records.size());
        LimitRecord gamma = records.get(0);
        assertEquals("Gamma", gamma.substanceName());
        assertEquals("10", gamma.amount1());
        assertEquals("5", gamma.amount2());
        assertEquals("10", gamma.amount3());
        assertEquals("15", gamma.amount4());
        assertEquals(LimitNote.AGGREGATE_TOTAL, gamma.note());
        assertEquals(LimitUnit.WEIGHT, gamma.unit());
    }

    @Test
    void fourColumnRowWithoutAggregateLeavesGeneralLimitEmpty() {
        LimitRecord record = synthesize(List.of(List.of("Eta", "1ｇ", "0.5ｇ", "配合不可"))).get(0);

        assertEquals("", record.amount1());
        assertEquals("1", record.amount2());
        assertEquals("0.5", record.amount3());
        assertEquals("配合不可", record.amount4());
        assertEquals(LimitNote.NONE, record.note());
        assertEquals(LimitUnit.WEIGHT, record.unit());
    }

    @Test
    void internationalUnitMarkerInAnyCategoryWins() {
        LimitRecord record = synthesize(List.of(List.of("VitA", "1g", "2g", "3国際単位"))).get(0);

        assertEquals("3", record.amount4());
        assertEquals(LimitUnit.INTERNATIONAL_UNIT, record.unit());

        LimitRecord single = synthesize(List.of(List.of("VitD", "5000国際単位"))).get(0);
        assertEquals("5000", single.amount1());
        assertEquals(LimitUnit.INTERNATIONAL_UNIT, single.unit());
    }

    @Test
    void notCompoundableLimitHasNoUnit() {
        LimitRecord record = synthesize(List.of(List.of("Omega", "配合不可"))).get(0);

        assertEquals("配合不可", record.amount1());
        assertEquals(LimitUnit.NONE, record.unit());

        LimitRecord typo = synthesize(List.of(List.of("Omega", "配合負荷"))).get(0);
        assertEquals(LimitUnit.NONE, typo.unit());
    }

    @Test
    void unequalTokenCountsPeelSharedCondition() {
        List<LimitRecord> records = synthesize(List.of(List.of("洗い流すもの A B", "1g 2g")));

        assertEquals(2, records.size());
        assertEquals("A", records.get(0).substanceName());
        assertEquals("洗い流すもの", records.get(0).condition());
        assertEquals("1", records.get(0).amount1());
        assertEquals("B", records.get(1).substanceName());
        assertEquals("洗い流すもの", records.get(1).condition());
        assertEquals("2", records.get(1).amount1());
    }

    @Test
    void rowWithoutNamesAfterConditionYieldsNothing() {
        assertTrue(synthesize(List.of(List.of("A", "1g 2g"))).isEmpty());
        assertTrue(synthesize(List.of(List.of("Delta", ""))).isEmpty());
        assertTrue(synthesize(List.of(List.of("", ""))).isEmpty());
    }

    @Test
    void rowWithMoreThanOneExtraNameTokenIsMalformed() {
        List<LimitRecord> records = synthesize(List.of(
                List.of("cond A B C", "1g"),
                List.of("Zeta", "3g")));

        assertEquals(1, records.size());
        assertEquals("Zeta", records.get(0).substanceName());
    }

    @Test
    void namesWithoutAnyAmountKeepEmptyValues() {
        List<LimitRecord> records = synthesize(List.of(List.of("A B", "")));

        assertEquals(1, records.size());
        LimitRecord record = records.get(0);
        assertEquals("B", record.substanceName());
        assertEquals("A", record.condition());
        assertEquals("", record.amount1());
        assertEquals(LimitUnit.NONE, record.unit());
        assertEquals(LimitNote.NONE, record.note());
    }

    @Test
    void shortRowsInCategorizedTableReadMissingCellsAsEmpty() {
        List<LimitRecord> records = synthesize(List.of(
                List.of("A", "1g", "2g", "3g"),
                List.of("B", "4g")));

        assertEquals(2, records.size());
        LimitRecord b = records.get(1);
        assertEquals("4", b.amount2());
        assertEquals("", b.amount3());
        assertEquals("", b.amount4());
        assertEquals(LimitUnit.WEIGHT, b.unit());
    }

    @Test
    void threeColumnTableIsSkipped() {
        assertTrue(synthesize(List.of(List.of("A", "1g", "2g"))).isEmpty());
    }

    @Test
    void singleColumnTableIsSkipped() {
        assertTrue(synthesize(List.of(List.of("A 1g"))).isEmpty());
    }

    @Test
    void tableShapeFollowsColumnCount() {
        assertEquals(RecordSynthesizer.TableShape.UNKNOWN, RecordSynthesizer.TableShape.of(1));
        assertEquals(RecordSynthesizer.TableShape.SINGLE_LIMIT, RecordSynthesizer.TableShape.of(2));
        assertEquals(RecordSynthesizer.TableShape.UNKNOWN, RecordSynthesizer.TableShape.of(3));
        assertEquals(RecordSynthesizer.TableShape.CATEGORIZED, RecordSynthesizer.TableShape.of(4));
        assertEquals(RecordSynthesizer.TableShape.CATEGORIZED, RecordSynthesizer.TableShape.of(6));
    }
}
