package com.seibun.backend.services.tables.normalize;

import java.util.ArrayList;
import java.util.List;

import com.seibun.backend.services.tables.SourceTable;

/**
 * A single amount next to three or more name fragments means one long name was wrapped and split on
 * whitespace; glue the fragments back together.
 */
public final class TokenSquasher {

    private TokenSquasher() {}

    public static SourceTable squash(SourceTable table) {
        if (table.columnCount() < 2) return table;

        List<List<String>> rows = new ArrayList<>(table.rowCount());
        for (List<String> row : table.rows()) {
            rows.add(squashRow(row));
        }
        return table.withRows(rows);
    }

    static List<String> squashRow(List<String> row) {
        if (row.size() < 2) return row;

        List<String> names = Tokens.split(row.get(0));
        List<String> amounts = Tokens.split(row.get(1));
        if (names.size() < 3 || amounts.size() != 1) return row;

        List<String> out = new ArrayList<>(row);
        out.set(0, String.join("", names));
        return out;
    }
}
