package com.seibun.backend.services.tables.records;

import java.util.ArrayList;
import java.util.List;

import com.seibun.backend.services.tables.LimitMarkers;
import com.seibun.backend.services.tables.SourceTable;
import com.seibun.backend.services.tables.normalize.Tokens;

import lombok.extern.slf4j.Slf4j;

/**
 * Fans each normalized row out into one record per substance token.
 *
 * Two table layouts exist:
 * <ul>
 *   <li>2 columns: substance | limit</li>
 *   <li>4+ columns: substance | rinse-off | leave-on | mucosal</li>
 * </ul>
 * Any other width is skipped as a whole.
 */
@Slf4j
public class RecordSynthesizer {

    public enum TableShape {
        SINGLE_LIMIT,
        CATEGORIZED,
        UNKNOWN;

        public static TableShape of(int columnCount) {
            if (columnCount == 2) return SINGLE_LIMIT;
            if (columnCount >= 4) return CATEGORIZED;
            return UNKNOWN;
        }
    }

    public List<LimitRecord> synthesize(SourceTable table) {
        List<LimitRecord> records = new ArrayList<>();
        if (table == null || table.isEmpty()) return records;

        TableShape shape = TableShape.of(table.columnCount());
        if (shape == TableShape.UNKNOWN) {
            log.warn("[RecordSynthesizer] Skipping table page={} order={}: unsupported column count {}",
                    table.page(), table.order(), table.columnCount());
            return records;
        }

        for (int r = 0; r < table.rowCount(); r++) {
            records.addAll(synthesizeRow(table, r, shape));
        }
        return records;
    }

    List<LimitRecord> synthesizeRow(SourceTable table, int rowIndex, TableShape shape) {
        List<String> names = Tokens.split(table.cell(rowIndex, 0));
        List<String> amounts = Tokens.split(table.cell(rowIndex, 1));
        List<String> leaveOn = shape == TableShape.CATEGORIZED ? Tokens.split(table.cell(rowIndex, 2)) : List.of();
        List<String> mucosal = shape == TableShape.CATEGORIZED ? Tokens.split(table.cell(rowIndex, 3)) : List.of();

        // Unequal counts: the leading name token is a condition shared by the whole row.
        boolean equalLength = names.size() == amounts.size();
        String condition = "";
        if (!equalLength && !names.isEmpty()) {
            condition = names.remove(0);
        }

        if (names.isEmpty()) {
            if (!condition.isEmpty()) {
                log.debug("[RecordSynthesizer] Malformed row {} (page={}): no substance left after condition '{}'",
                        rowIndex, table.page(), condition);
            }
            return List.of();
        }
        if (!equalLength && !amounts.isEmpty() && names.size() > amounts.size()) {
            log.warn("[RecordSynthesizer] Malformed row {} (page={}): {} names for {} amounts after condition '{}'",
                    rowIndex, table.page(), names.size(), amounts.size(), condition);
            return List.of();
        }

        List<LimitRecord> out = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            LimitRecord.LimitRecordBuilder builder = LimitRecord.builder()
                    .substanceName(names.get(i))
                    .condition(condition)
                    .sourceUrl(table.sourceUrl());

            if (shape == TableShape.SINGLE_LIMIT) {
                fillSingleLimit(builder, Tokens.tokenAt(amounts, i));
            } else {
                fillCategorized(builder,
                        Tokens.tokenAt(amounts, i),
                        Tokens.tokenAt(leaveOn, i),
                        Tokens.tokenAt(mucosal, i));
            }
            out.add(builder.build());
        }
        return out;
    }

    private static void fillSingleLimit(LimitRecord.LimitRecordBuilder builder, String raw) {
        String amount1 = LimitMarkers.stripUnits(LimitMarkers.stripAggregateTotal(raw));
        builder.amount1(amount1)
                .amount2("")
                .amount3("")
                .amount4("")
                .note(LimitMarkers.hasAggregateTotal(raw) ? LimitNote.AGGREGATE_TOTAL : LimitNote.NONE)
                .unit(resolveUnit(amount1, raw));
    }

    private static void fillCategorized(LimitRecord.LimitRecordBuilder builder, String rinseOff, String leaveOn, String mucosal) {
        String aggregateSource = null;
        for (String candidate : new String[] { rinseOff, leaveOn, mucosal }) {
            if (LimitMarkers.hasAggregateTotal(candidate)) {
                aggregateSource = candidate;
                break;
            }
        }

        String amount1 = aggregateSource == null ? "" : bareAmount(aggregateSource);
        builder.amount1(amount1)
                .amount2(bareAmount(rinseOff))
                .amount3(bareAmount(leaveOn))
                .amount4(bareAmount(mucosal))
                .note(aggregateSource == null ? LimitNote.NONE : LimitNote.AGGREGATE_TOTAL)
                .unit(resolveUnit(amount1, rinseOff, leaveOn, mucosal));
    }

    private static String bareAmount(String raw) {
        return LimitMarkers.stripUnits(LimitMarkers.stripAggregateTotal(raw));
    }

    /**
     * International units win over grams when any raw value mentions them. No unit when nothing was
     * found or when the general limit says the substance may not be compounded at all.
     */
    static LimitUnit resolveUnit(String amount1, String... rawValues) {
        boolean anyQuantity = false;
        boolean international = false;
        for (String raw : rawValues) {
            if (raw == null || raw.isBlank()) continue;
            anyQuantity = true;
            if (LimitMarkers.hasInternationalUnit(raw)) international = true;
        }
        if (!anyQuantity || LimitMarkers.isNotCompoundable(amount1)) return LimitUnit.NONE;
        return international ? LimitUnit.INTERNATIONAL_UNIT : LimitUnit.WEIGHT;
    }
}
