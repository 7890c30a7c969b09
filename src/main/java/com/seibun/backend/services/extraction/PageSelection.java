package com.seibun.backend.services.extraction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Parses page selections such as "all", "2-12", "2,4,9" or "1,3-5" into 1-based page numbers.
 */
public final class PageSelection {

    private PageSelection() {}

    public static List<Integer> parse(String selection, int pageCount) {
        TreeSet<Integer> pages = new TreeSet<>();
        if (pageCount <= 0) return new ArrayList<>(pages);

        String s = selection == null ? "" : selection.replace(" ", "").trim();
        if (s.isEmpty() || s.equalsIgnoreCase("all")) {
            return range(1, pageCount);
        }

        for (String part : s.split(",")) {
            if (part.isEmpty()) continue;
            int dash = part.indexOf('-');
            if (dash < 0) {
                pages.add(parsePage(part, selection));
                continue;
            }
            int from = parsePage(part.substring(0, dash), selection);
            String end = part.substring(dash + 1);
            // "3-end" is accepted like "3-" for the last page
            int to = end.isEmpty() || end.equalsIgnoreCase("end") ? pageCount : parsePage(end, selection);
            if (to < from) {
                throw new IllegalArgumentException("Invalid page range '" + part + "' in '" + selection + "'");
            }
            for (int p = from; p <= Math.min(to, pageCount); p++) {
                pages.add(p);
            }
        }

        pages.removeIf(p -> p < 1 || p > pageCount);
        return new ArrayList<>(pages);
    }

    /**
     * autoStartPage..last, clamped to the document.
     */
    public static List<Integer> autoRange(int autoStartPage, int pageCount) {
        if (pageCount <= 0) return new ArrayList<>();
        int start = Math.min(Math.max(1, autoStartPage), pageCount);
        return range(start, pageCount);
    }

    public static List<Integer> exclude(List<Integer> pages, Collection<Integer> excluded) {
        List<Integer> out = new ArrayList<>(pages);
        if (excluded != null) out.removeAll(excluded);
        return out;
    }

    private static List<Integer> range(int from, int to) {
        List<Integer> out = new ArrayList<>();
        for (int p = from; p <= to; p++) out.add(p);
        return out;
    }

    private static int parsePage(String value, String selection) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid page '" + value + "' in '" + selection + "'", e);
        }
    }
}
