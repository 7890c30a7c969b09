package com.seibun.backend.services.tables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One extracted table: rows of raw cell strings plus where they came from.
 *
 * Immutable. Every normalization stage builds a new instance through {@link #withRows(List)}.
 */
public record SourceTable(
        List<List<String>> rows,
        String sourceUrl,
        int page,
        int order
) {

    public SourceTable {
        List<List<String>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<String> row : rows) {
                List<String> cells = new ArrayList<>();
                if (row != null) {
                    for (String cell : row) {
                        cells.add(cell == null ? "" : cell);
                    }
                }
                copy.add(Collections.unmodifiableList(cells));
            }
        }
        rows = Collections.unmodifiableList(copy);
        sourceUrl = sourceUrl == null ? "" : sourceUrl;
    }

    public static SourceTable of(String sourceUrl, List<List<String>> rows) {
        return new SourceTable(rows, sourceUrl, 0, 0);
    }

    public SourceTable withRows(List<List<String>> newRows) {
        return new SourceTable(newRows, sourceUrl, page, order);
    }

    /**
     * Widest row; rows of HTML tables may be shorter when cells span rows.
     */
    public int columnCount() {
        int max = 0;
        for (List<String> row : rows) {
            max = Math.max(max, row.size());
        }
        return max;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public String cell(int row, int column) {
        if (row < 0 || row >= rows.size()) return "";
        List<String> cells = rows.get(row);
        return column >= 0 && column < cells.size() ? cells.get(column) : "";
    }
}
