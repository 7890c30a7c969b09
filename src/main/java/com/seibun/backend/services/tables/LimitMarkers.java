package com.seibun.backend.services.tables;

import java.util.regex.Pattern;

/**
 * Literal annotations found in the usage-limit tables.
 *
 * Kept in one place so the normalizer, the redistributor and the synthesizer agree on them.
 */
public final class LimitMarkers {

    private LimitMarkers() {}

    /** "as a total amount": the value is summed over the listed sub-ingredients. */
    public static final String AGGREGATE_TOTAL = "合計量として";

    /** International units (biological activity) instead of grams. */
    public static final String INTERNATIONAL_UNIT = "国際単位";

    /** Grams; documents use both the ASCII and the full-width letter. */
    public static final String WEIGHT = "g";
    public static final String WEIGHT_FULL_WIDTH = "ｇ";

    /** "may not be compounded". The second spelling is a typo carried by the source documents. */
    public static final String NOT_COMPOUNDABLE = "配合不可";
    public static final String NOT_COMPOUNDABLE_TYPO = "配合負荷";

    /** Column-0 header label ("ingredient name"). */
    public static final String NAME_HEADER = "成分名";

    /**
     * A quantity glued to its unit, e.g. "12.5g", "0.1ｇ", "300国際単位". Digits may be full-width.
     */
    public static final Pattern AMOUNT_TOKEN = Pattern.compile("^\\p{Nd}+(?:\\.\\p{Nd}+)?(?:g|ｇ|国際単位)$");

    private static final Pattern UNIT_MARKERS = Pattern.compile("\\s*(?:[gｇ]|国際単位)\\s*");

    public static boolean hasAggregateTotal(String value) {
        return value != null && value.contains(AGGREGATE_TOTAL);
    }

    public static boolean hasInternationalUnit(String value) {
        return value != null && value.contains(INTERNATIONAL_UNIT);
    }

    public static boolean isNotCompoundable(String value) {
        return value != null && (value.contains(NOT_COMPOUNDABLE) || value.contains(NOT_COMPOUNDABLE_TYPO));
    }

    public static String stripAggregateTotal(String value) {
        if (value == null) return "";
        return value.replace(AGGREGATE_TOTAL, "").trim();
    }

    /**
     * Removes weight and international-unit markers, leaving the bare quantity (or the qualitative text).
     */
    public static String stripUnits(String value) {
        if (value == null) return "";
        return UNIT_MARKERS.matcher(value).replaceAll("").trim();
    }
}
