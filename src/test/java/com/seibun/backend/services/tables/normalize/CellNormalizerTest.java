package com.seibun.backend.services.tables.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.seibun.backend.services.tables.SourceTable;

class CellNormalizerTest {

    @Test
    void removesBlanksInsideFullWidthParentheses() {
        assertEquals("ポリオキシエチレン（８～10E.O.）", CellNormalizer.normalize("ポリオキシエチレン（８ ～ 10 E.O. ）"));
        assertEquals("A（1～2）B（x）", CellNormalizer.normalize("A（1\t～　2）B（ x ）"));
    }

    @Test
    void bindsAggregateTotalMarkerToFollowingValue() {
        assertEquals("合計量として10ｇ", CellNormalizer.normalize("合計量として  10ｇ"));
    }

    @Test
    void bindsInternationalUnitMarkerToPrecedingValue() {
        assertEquals("300国際単位", CellNormalizer.normalize("300 　国際単位"));
    }

    @Test
    void splitsMergedEthylEntryWithComma() {
        assertEquals("ヘキサン酸,2－エチルヘキシル", CellNormalizer.normalize("ヘキサン酸 2－エチルヘキシル"));
        assertEquals("A, 2－エチル", CellNormalizer.normalize("A, 2－エチル"));
        assertEquals("A,2－エチル,2－エチル", CellNormalizer.normalize("A 2－エチル 2－エチル"));
    }

    @Test
    void collapsesWhitespaceAndTrims() {
        assertEquals("a b c", CellNormalizer.normalize("  a　　b \t c "));
        assertEquals("x y", CellNormalizer.normalize("x y"));
    }

    @Test
    void nullAndEmptyBecomeEmpty() {
        assertEquals("", CellNormalizer.normalize(null));
        assertEquals("", CellNormalizer.normalize(""));
        assertEquals("", CellNormalizer.normalize(" 　 "));
    }

    @Test
    void isIdempotent() {
        List<String> samples = List.of(
                "ポリオキシエチレン（８ ～ 10 E.O. ）",
                "合計量として  10ｇ 5ｇ",
                "ビタミンＡ 5000 国際単位",
                " 2－エチルヘキシル A 2－エチル",
                "A 2－エチル 2－エチル",
                "a　b\t\tc\n d",
                "（ 合計量として 1 ）  国際単位",
                "成 分 名",
                "");

        for (String sample : samples) {
            String once = CellNormalizer.normalize(sample);
            assertEquals(once, CellNormalizer.normalize(once), () -> "not idempotent for '" + sample + "'");
        }
    }

    @Test
    void normalizeTableKeepsShapeAndProvenance() {
        SourceTable table = new SourceTable(List.of(List.of("a　b", " c "), List.of("d")), "https://example.test/a.pdf", 3, 7);

        SourceTable normalized = CellNormalizer.normalizeTable(table);

        assertEquals(List.of(List.of("a b", "c"), List.of("d")), normalized.rows());
        assertEquals("https://example.test/a.pdf", normalized.sourceUrl());
        assertEquals(3, normalized.page());
        assertEquals(7, normalized.order());
        assertEquals(List.of("a　b", " c "), table.rows().get(0));
    }
}
