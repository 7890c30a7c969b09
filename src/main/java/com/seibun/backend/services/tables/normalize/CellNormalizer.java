package com.seibun.backend.services.tables.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.seibun.backend.services.tables.LimitMarkers;
import com.seibun.backend.services.tables.SourceTable;

/**
 * Text fix-ups applied to every extracted cell.
 *
 * The result is stable: normalizing an already normalized cell returns it unchanged.
 */
public final class CellNormalizer {

    private static final Pattern FULL_WIDTH_PARENS = Pattern.compile("（([^）]*)）");
    private static final Pattern INNER_BLANKS = Pattern.compile("[ \\t\\u3000]+");
    private static final Pattern AFTER_AGGREGATE = Pattern.compile("(" + LimitMarkers.AGGREGATE_TOTAL + ")\\s+");
    private static final Pattern BEFORE_INTERNATIONAL_UNIT = Pattern.compile("\\s+(?=" + LimitMarkers.INTERNATIONAL_UNIT + ")");
    // Extraction merges "...、 2－エチル..." into one entry; a comma splits it back.
    private static final Pattern MERGED_ETHYL = Pattern.compile("(?<!,)\\s(?=2－エチル)");
    private static final Pattern BLANK_RUNS = Pattern.compile("[ \\t]+");

    private CellNormalizer() {}

    public static String normalize(String cell) {
        if (cell == null || cell.isEmpty()) return "";

        // Full-width space and NBSP (PDF text layers) become ordinary spaces
        String result = cell.replace('\u3000', ' ').replace('\u00A0', ' ');

        // "（８ ～ 10 E.O. ）" => "（８～10E.O.）"
        Matcher parens = FULL_WIDTH_PARENS.matcher(result);
        StringBuilder sb = new StringBuilder();
        while (parens.find()) {
            String inner = INNER_BLANKS.matcher(parens.group(1)).replaceAll("");
            parens.appendReplacement(sb, Matcher.quoteReplacement("（" + inner + "）"));
        }
        parens.appendTail(sb);
        result = sb.toString();

        // "合計量として 10g" => "合計量として10g", "300 国際単位" => "300国際単位"
        result = AFTER_AGGREGATE.matcher(result).replaceAll("$1");
        result = BEFORE_INTERNATIONAL_UNIT.matcher(result).replaceAll("");

        // "酸 2－エチルヘキシル" => "酸,2－エチルヘキシル"
        result = MERGED_ETHYL.matcher(result).replaceAll(",");

        // Collapse blank runs
        return BLANK_RUNS.matcher(result).replaceAll(" ").trim();
    }

    public static List<String> normalizeRow(List<String> row) {
        List<String> out = new ArrayList<>(row.size());
        for (String cell : row) {
            out.add(normalize(cell));
        }
        return out;
    }

    public static SourceTable normalizeTable(SourceTable table) {
        List<List<String>> rows = new ArrayList<>(table.rowCount());
        for (List<String> row : table.rows()) {
            rows.add(normalizeRow(row));
        }
        return table.withRows(rows);
    }
}
