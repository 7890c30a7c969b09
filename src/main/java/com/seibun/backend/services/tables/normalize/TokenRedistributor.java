package com.seibun.backend.services.tables.normalize;

import java.util.ArrayList;
import java.util.List;

import com.seibun.backend.services.tables.LimitMarkers;
import com.seibun.backend.services.tables.SourceTable;

/**
 * Moves quantity tokens ("12g", "300国際単位") that the extractor left in the name column over to the
 * amount column.
 *
 * Rows list several sub-items aligned by token position, so a quantity found at name position i belongs
 * to amount position i - 1. A quantity at position 0 has no slot to go to and stays where it is.
 */
public final class TokenRedistributor {

    private TokenRedistributor() {}

    public static SourceTable redistribute(SourceTable table) {
        if (table.columnCount() < 2) return table;

        List<List<String>> rows = new ArrayList<>(table.rowCount());
        for (List<String> row : table.rows()) {
            rows.add(redistributeRow(row));
        }
        return table.withRows(rows);
    }

    static List<String> redistributeRow(List<String> row) {
        if (row.size() < 2) return row;

        List<String> names = Tokens.split(row.get(0));
        List<String> amounts = Tokens.split(row.get(1));

        List<Integer> hits = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            if (LimitMarkers.AMOUNT_TOKEN.matcher(names.get(i)).matches()) hits.add(i);
        }
        if (hits.isEmpty()) return row;

        // highest index first keeps the lower indices valid
        for (int h = hits.size() - 1; h >= 0; h--) {
            int hit = hits.get(h);
            int insertAt = hit - 1;
            if (insertAt < 0) continue;

            String moved = names.remove(hit);
            while (amounts.size() < insertAt) {
                amounts.add("");
            }
            amounts.add(insertAt, moved);
        }

        List<String> out = new ArrayList<>(row);
        out.set(0, Tokens.join(names));
        out.set(1, Tokens.join(amounts));
        return out;
    }
}
