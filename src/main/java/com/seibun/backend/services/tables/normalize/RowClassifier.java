package com.seibun.backend.services.tables.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.seibun.backend.services.tables.LimitMarkers;
import com.seibun.backend.services.tables.SourceTable;

import lombok.extern.slf4j.Slf4j;

/**
 * Drops rows that can never carry a record: page numbers / footers and repeated headers.
 */
@Slf4j
public class RowClassifier {

    public static final double DEFAULT_DIGIT_ROW_MIN_RATIO = 0.8;

    /**
     * Header row of the HTML tables (rinse-off / leave-on / mucosal categories).
     */
    public static final List<String> CATEGORY_HEADER = List.of(
            "粘膜に使用されることがない化粧品のうち洗い流すもの",
            "粘膜に使用されることがない化粧品のうち洗い流さないもの",
            "粘膜に使用されることがある化粧品"
    );

    private static final Pattern INTEGER = Pattern.compile("^\\p{Nd}+$");
    private static final Pattern ANY_WHITESPACE = Pattern.compile("\\s+");

    private final double digitRowMinRatio;

    public RowClassifier() {
        this(DEFAULT_DIGIT_ROW_MIN_RATIO);
    }

    public RowClassifier(double digitRowMinRatio) {
        this.digitRowMinRatio = digitRowMinRatio > 0 ? digitRowMinRatio : DEFAULT_DIGIT_ROW_MIN_RATIO;
    }

    public boolean shouldDrop(List<String> row) {
        if (row == null || row.isEmpty()) return false;
        return isDigitRow(row) || isNameHeader(row) || isCategoryHeader(row);
    }

    public SourceTable filter(SourceTable table) {
        List<List<String>> kept = new ArrayList<>();
        int dropped = 0;
        for (List<String> row : table.rows()) {
            if (shouldDrop(row)) {
                dropped++;
                log.debug("[RowClassifier] Dropping row {}", row);
                continue;
            }
            kept.add(row);
        }
        if (dropped > 0) {
            log.debug("[RowClassifier] page={} order={} dropped={} kept={}", table.page(), table.order(), dropped, kept.size());
        }
        return table.withRows(kept);
    }

    boolean isDigitRow(List<String> row) {
        int nonEmpty = 0;
        int digitsOnly = 0;
        for (String raw : row) {
            String cell = raw == null ? "" : raw.trim();
            if (cell.isEmpty() || cell.toLowerCase(Locale.ROOT).equals("nan")) continue;
            nonEmpty++;
            if (INTEGER.matcher(cell).matches()) digitsOnly++;
        }
        return nonEmpty > 0 && ((double) digitsOnly / nonEmpty) >= digitRowMinRatio;
    }

    static boolean isNameHeader(List<String> row) {
        String first = row.get(0) == null ? "" : row.get(0).replace('\u3000', ' ');
        return ANY_WHITESPACE.matcher(first).replaceAll("").equals(LimitMarkers.NAME_HEADER);
    }

    static boolean isCategoryHeader(List<String> row) {
        if (row.size() != CATEGORY_HEADER.size()) return false;
        for (int i = 0; i < row.size(); i++) {
            if (!collapse(row.get(i)).equals(collapse(CATEGORY_HEADER.get(i)))) return false;
        }
        return true;
    }

    private static String collapse(String value) {
        if (value == null) return "";
        return ANY_WHITESPACE.matcher(value.replace('\u3000', ' ')).replaceAll(" ").trim();
    }
}
