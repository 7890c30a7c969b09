package com.seibun.backend.services.tables;

import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.seibun.backend.config.IngestionProperties;
import com.seibun.backend.services.tables.normalize.CellNormalizer;
import com.seibun.backend.services.tables.normalize.RowClassifier;
import com.seibun.backend.services.tables.normalize.TokenRedistributor;
import com.seibun.backend.services.tables.normalize.TokenSquasher;
import com.seibun.backend.services.tables.records.LimitRecord;
import com.seibun.backend.services.tables.records.RecordFilter;
import com.seibun.backend.services.tables.records.RecordSynthesizer;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns extracted tables into records: normalize cells, drop noise rows, move misplaced quantities,
 * glue split names, fan rows out into records and keep the meaningful ones.
 *
 * Tables are independent of each other and are processed in the order given; the output keeps
 * table order, then row order, then token order.
 */
@Service
@Slf4j
public class TableNormalizationPipeline {

    private final RowClassifier rowClassifier;
    private final RecordSynthesizer recordSynthesizer;

    @Autowired
    public TableNormalizationPipeline(IngestionProperties ingestionProperties) {
        this(new RowClassifier(ingestionProperties.getDigitRowMinRatio()), new RecordSynthesizer());
    }

    public TableNormalizationPipeline(RowClassifier rowClassifier, RecordSynthesizer recordSynthesizer) {
        this.rowClassifier = rowClassifier;
        this.recordSynthesizer = recordSynthesizer;
    }

    public List<LimitRecord> processTable(SourceTable table) {
        SourceTable normalized = CellNormalizer.normalizeTable(table);
        SourceTable kept = rowClassifier.filter(normalized);
        SourceTable redistributed = TokenRedistributor.redistribute(kept);
        SourceTable squashed = TokenSquasher.squash(redistributed);
        return RecordFilter.filter(recordSynthesizer.synthesize(squashed));
    }

    public PipelineResult process(List<SourceTable> tables) {
        List<LimitRecord> all = new ArrayList<>();
        int processed = 0;
        int skipped = 0;

        for (SourceTable table : tables == null ? List.<SourceTable>of() : tables) {
            try {
                List<LimitRecord> records = processTable(table);
                all.addAll(records);
                processed++;
                log.debug("[Pipeline] page={} order={} rows={} records={}",
                        table.page(), table.order(), table.rowCount(), records.size());
            } catch (RuntimeException e) {
                skipped++;
                log.warn("[Pipeline] Skipping table page={} order={}: {}", table.page(), table.order(), e.toString());
            }
        }

        PipelineResult result = new PipelineResult(all, processed, skipped);
        log.info("[Pipeline] {}", result.getDescription());
        return result;
    }

    /**
     * Same as {@link #process(List)} but a run without tables or without a single record is a failure.
     */
    public PipelineResult processOrThrow(List<SourceTable> tables) {
        if (tables == null || tables.isEmpty()) {
            throw new ExtractionEmptyException(
                    "No tables were detected. Check the page selection, excluded pages or the source URL.");
        }
        PipelineResult result = process(tables);
        if (result.isEmpty()) {
            throw new ExtractionEmptyException(
                    "No records were produced from " + tables.size() + " table(s).");
        }
        return result;
    }
}
