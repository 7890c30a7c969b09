package com.seibun.backend.services.sheets;

import java.util.List;

import com.seibun.backend.services.tables.records.LimitRecord;

import lombok.extern.slf4j.Slf4j;

/**
 * Dry run: records are logged, nothing is written.
 */
@Slf4j
public class DisabledSheetStorage implements SheetStorage {

    @Override
    public AppendResult append(List<LimitRecord> records) {
        log.info("[Sheets] Disabled (seibun.sheets.enabled=false); {} record(s) not written", records.size());
        for (int i = 0; i < records.size(); i++) {
            log.info("[Sheets] {}: {}", String.format("%03d", i + 1), records.get(i));
        }
        return AppendResult.nothing("");
    }
}
