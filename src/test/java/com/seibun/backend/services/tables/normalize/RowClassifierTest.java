package com.seibun.backend.services.tables.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.seibun.backend.services.tables.SourceTable;

class RowClassifierTest {

    private final RowClassifier classifier = new RowClassifier();

    @Test
    void dropsPaginationRows() {
        assertTrue(classifier.shouldDrop(List.of("12", "345", "")));
        assertTrue(classifier.shouldDrop(List.of("1", "2", "3", "4", "x")));
        assertTrue(classifier.shouldDrop(List.of("nan", "NaN", "5")));
        assertTrue(classifier.shouldDrop(List.of("１２")));
    }

    @Test
    void keepsRowsBelowDigitRatio() {
        assertFalse(classifier.shouldDrop(List.of("12", "abc")));
        assertFalse(classifier.shouldDrop(List.of("1", "2", "3", "x", "y")));
        assertFalse(classifier.shouldDrop(List.of("1.5", "2")));
    }

    @Test
    void keepsRowsWithoutContent() {
        assertFalse(classifier.shouldDrop(List.of("", " ")));
        assertFalse(classifier.shouldDrop(List.of()));
    }

    @Test
    void digitRatioIsConfigurable() {
        RowClassifier strict = new RowClassifier(0.5);
        assertTrue(strict.shouldDrop(List.of("12", "abc")));
    }

    @Test
    void dropsNameHeaderIgnoringWhitespace() {
        assertTrue(classifier.shouldDrop(List.of("成 分　名", "配合量")));
        assertTrue(classifier.shouldDrop(List.of("成分名")));
        assertFalse(classifier.shouldDrop(List.of("成分名称", "1g")));
        assertFalse(classifier.shouldDrop(List.of("配合量", "成分名")));
    }

    @Test
    void dropsCategoryHeaderTemplate() {
        assertTrue(classifier.shouldDrop(List.of(
                " 粘膜に使用されることがない化粧品のうち洗い流すもの",
                "粘膜に使用されることがない化粧品のうち洗い流さないもの　",
                "粘膜に使用されることがある化粧品")));
        assertFalse(classifier.shouldDrop(List.of(
                "粘膜に使用されることがない化粧品のうち洗い流すもの",
                "粘膜に使用されることがない化粧品のうち洗い流さないもの")));
        assertFalse(classifier.shouldDrop(List.of(
                "成分",
                "粘膜に使用されることがない化粧品のうち洗い流すもの",
                "粘膜に使用されることがない化粧品のうち洗い流さないもの",
                "粘膜に使用されることがある化粧品")));
    }

    @Test
    void filterKeepsOrderOfRemainingRows() {
        SourceTable table = SourceTable.of("u", List.of(
                List.of("成分名", "配合量"),
                List.of("A", "1g"),
                List.of("3", ""),
                List.of("B", "2g")));

        SourceTable filtered = classifier.filter(table);

        assertEquals(List.of(List.of("A", "1g"), List.of("B", "2g")), filtered.rows());
    }
}
