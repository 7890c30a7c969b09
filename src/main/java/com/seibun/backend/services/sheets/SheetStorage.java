package com.seibun.backend.services.sheets;

import java.util.List;

import com.seibun.backend.services.tables.records.LimitRecord;

public interface SheetStorage {

    /**
     * Appends the records, in order, below the last used row of the destination worksheet.
     */
    AppendResult append(List<LimitRecord> records);
}
