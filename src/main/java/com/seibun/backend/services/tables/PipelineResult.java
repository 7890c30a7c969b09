package com.seibun.backend.services.tables;

import java.util.List;

import com.seibun.backend.services.tables.records.LimitRecord;

public record PipelineResult(
        List<LimitRecord> records,
        int tablesProcessed,
        int tablesSkipped
) {
    public PipelineResult {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public String getDescription() {
        return String.format("PipelineResult{records=%d, tablesProcessed=%d, tablesSkipped=%d}",
                records.size(), tablesProcessed, tablesSkipped);
    }
}
