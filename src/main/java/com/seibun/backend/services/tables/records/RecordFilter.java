package com.seibun.backend.services.tables.records;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

/**
 * Keeps records that name a substance and carry at least one regulatory datum.
 */
@Slf4j
public final class RecordFilter {

    private RecordFilter() {}

    public static boolean isRetained(LimitRecord record) {
        if (record == null) return false;
        return !record.substanceName().isBlank() && record.hasAnyValue();
    }

    public static List<LimitRecord> filter(List<LimitRecord> records) {
        List<LimitRecord> kept = new ArrayList<>(records.size());
        for (LimitRecord record : records) {
            if (isRetained(record)) {
                kept.add(record);
            } else {
                log.debug("[RecordFilter] Dropping record without name or values: {}", record);
            }
        }
        return kept;
    }
}
