package com.seibun.backend.services.sheets;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import com.seibun.backend.services.tables.records.LimitRecord;

/**
 * Maps a record onto the fixed A..O layout of the destination sheet.
 *
 * A change flag, B date, C group id, D substance, E regulation class (blank), F general limit,
 * G condition, H rinse-off limit, I leave-on limit, J mucosal limit, K unit, L note, M/N spare, O source URL.
 */
public class SheetRowMapper {

    public static final int COLUMN_COUNT = 15;
    public static final String FIRST_COLUMN = "A";
    public static final String LAST_COLUMN = "O";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    private final Clock clock;

    public SheetRowMapper(Clock clock) {
        this.clock = clock;
    }

    public List<List<Object>> toRows(List<LimitRecord> records) {
        String today = LocalDate.now(clock).format(DATE);
        List<List<Object>> rows = new ArrayList<>(records.size());
        for (LimitRecord record : records) {
            rows.add(toRow(record, today));
        }
        return rows;
    }

    List<Object> toRow(LimitRecord record, String today) {
        List<Object> row = new ArrayList<>(COLUMN_COUNT);
        row.add(0);
        row.add(today);
        row.add(0);
        row.add(record.substanceName());
        row.add("");
        row.add(record.amount1());
        row.add(record.condition());
        row.add(record.amount2());
        row.add(record.amount3());
        row.add(record.amount4());
        row.add(record.unit().label());
        row.add(record.note().label());
        row.add("");
        row.add("");
        row.add(record.sourceUrl());
        return row;
    }

    /**
     * "'Sheet name'!A{start}:O{end}" for rowCount rows starting at startRow (1-based).
     */
    public static String range(String sheetTitle, int startRow, int rowCount) {
        int endRow = startRow + rowCount - 1;
        return quoteTitle(sheetTitle) + "!" + FIRST_COLUMN + startRow + ":" + LAST_COLUMN + endRow;
    }

    public static String quoteTitle(String sheetTitle) {
        return "'" + sheetTitle.replace("'", "''") + "'";
    }
}
