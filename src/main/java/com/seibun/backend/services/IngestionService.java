package com.seibun.backend.services;

import java.nio.file.Path;
import java.util.List;

import org.springframework.stereotype.Service;

import com.seibun.backend.config.IngestionProperties;
import com.seibun.backend.services.export.JsonRecordExporter;
import com.seibun.backend.services.extraction.SourceKind;
import com.seibun.backend.services.extraction.TableExtractor;
import com.seibun.backend.services.sheets.AppendResult;
import com.seibun.backend.services.sheets.SheetStorage;
import com.seibun.backend.services.tables.PipelineResult;
import com.seibun.backend.services.tables.SourceTable;
import com.seibun.backend.services.tables.TableNormalizationPipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * One run: extract tables from the document, turn them into records, optionally dump them as JSON and
 * append them to the sheet.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    private final List<TableExtractor> extractors;
    private final TableNormalizationPipeline pipeline;
    private final JsonRecordExporter jsonRecordExporter;
    private final SheetStorage sheetStorage;
    private final IngestionProperties ingestionProperties;

    public IngestionReport run(IngestionRequest request) {
        String url = request.url() == null || request.url().isBlank()
                ? ingestionProperties.getDocumentUrl()
                : request.url().trim();
        String pages = request.pages() == null || request.pages().isBlank()
                ? ingestionProperties.getPages()
                : request.pages().trim();
        String sourceOption = request.source() == null || request.source().isBlank()
                ? ingestionProperties.getSource()
                : request.source();

        SourceKind kind = SourceKind.resolve(sourceOption, url);
        TableExtractor extractor = extractorFor(kind);

        log.info("[Ingestion] Extracting {} tables from {} (pages='{}')", kind, url, pages);
        List<SourceTable> tables = extractor.extract(url, pages);

        PipelineResult result = pipeline.processOrThrow(tables);
        log.info("[Ingestion] Records generated: {}", result.records().size());

        Path jsonPath = null;
        if (jsonRecordExporter.isEnabled()) {
            jsonPath = jsonRecordExporter.export(result.records());
        }

        log.info("[Ingestion] Appending to sheet ...");
        AppendResult appendResult = sheetStorage.append(result.records());

        log.info("[Ingestion] Done. rows={} range={}", appendResult.rowsWritten(), appendResult.range());
        return new IngestionReport(url, kind, tables.size(), result, jsonPath, appendResult);
    }

    TableExtractor extractorFor(SourceKind kind) {
        for (TableExtractor extractor : extractors) {
            if (extractor.kind() == kind) return extractor;
        }
        throw new IllegalStateException("No table extractor is configured for " + kind);
    }
}
