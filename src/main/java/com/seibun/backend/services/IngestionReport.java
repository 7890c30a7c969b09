package com.seibun.backend.services;

import java.nio.file.Path;

import com.seibun.backend.services.extraction.SourceKind;
import com.seibun.backend.services.sheets.AppendResult;
import com.seibun.backend.services.tables.PipelineResult;

/**
 * @param jsonPath null when the JSON dump is disabled
 */
public record IngestionReport(
        String url,
        SourceKind sourceKind,
        int tablesExtracted,
        PipelineResult pipelineResult,
        Path jsonPath,
        AppendResult appendResult
) {
}
