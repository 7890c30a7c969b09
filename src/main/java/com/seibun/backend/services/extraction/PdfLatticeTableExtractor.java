package com.seibun.backend.services.extraction;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;

import com.seibun.backend.config.IngestionProperties;
import com.seibun.backend.services.tables.SourceTable;
import com.seibun.backend.services.tables.normalize.CellNormalizer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import technology.tabula.ObjectExtractor;
import technology.tabula.Page;
import technology.tabula.PageIterator;
import technology.tabula.RectangularTextContainer;
import technology.tabula.Table;
import technology.tabula.extractors.SpreadsheetExtractionAlgorithm;

/**
 * Lattice (ruling-line) table detection over the selected PDF pages.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfLatticeTableExtractor implements TableExtractor {

    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n]+");

    private final DocumentFetcher documentFetcher;
    private final IngestionProperties ingestionProperties;

    @Override
    public SourceKind kind() {
        return SourceKind.PDF;
    }

    @Override
    public List<SourceTable> extract(String url, String pages) {
        byte[] pdfBytes = documentFetcher.fetchBytes(url);
        return extractFromBytes(pdfBytes, url, pages);
    }

    /**
     * A PDF that cannot be read yields no tables; the caller reports the empty run.
     */
    public List<SourceTable> extractFromBytes(byte[] pdfBytes, String sourceUrl, String pages) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new IllegalArgumentException("PDF is empty (0 bytes)");
        }

        log.info("[PdfLattice] Read pdfBytes={} bytes", pdfBytes.length);

        List<SourceTable> tables = new ArrayList<>();
        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(pdfBytes))) {
            List<Integer> pageNumbers = selectPages(pages, document.getNumberOfPages());
            log.info("[PdfLattice] Lattice only. pages='{}' -> {} exclude={}",
                    pages, pageNumbers, ingestionProperties.getExcludePages());
            if (pageNumbers.isEmpty()) return tables;

            ObjectExtractor extractor = new ObjectExtractor(document);
            SpreadsheetExtractionAlgorithm lattice = new SpreadsheetExtractionAlgorithm();
            PageIterator iterator = extractor.extract(pageNumbers);

            int order = 0;
            while (iterator.hasNext()) {
                Page page = iterator.next();
                for (Table table : lattice.extract(page)) {
                    SourceTable grid = toSourceTable(table, sourceUrl, page.getPageNumber(), order++);
                    if (grid.rowCount() < 2 || grid.columnCount() < 2) {
                        log.debug("[PdfLattice] Ignoring {}x{} table on page {}",
                                grid.rowCount(), grid.columnCount(), page.getPageNumber());
                        continue;
                    }
                    tables.add(grid);
                }
            }
        } catch (IOException e) {
            log.error("[PdfLattice] Failed to read PDF from {}: {}", sourceUrl, e.toString());
            return List.of();
        }

        log.info("[PdfLattice] Detected {} table(s)", tables.size());
        return tables;
    }

    List<Integer> selectPages(String pages, int pageCount) {
        String selection = pages == null || pages.isBlank() ? ingestionProperties.getPages() : pages;
        List<Integer> selected = ingestionProperties.isAutoPageRange()
                ? PageSelection.autoRange(ingestionProperties.getAutoStartPage(), pageCount)
                : PageSelection.parse(selection, pageCount);
        return PageSelection.exclude(selected, ingestionProperties.getExcludePages());
    }

    @SuppressWarnings("rawtypes")
    static SourceTable toSourceTable(Table table, String sourceUrl, int page, int order) {
        List<List<String>> rows = new ArrayList<>();
        for (List<RectangularTextContainer> cells : table.getRows()) {
            List<String> row = new ArrayList<>(cells.size());
            for (RectangularTextContainer cell : cells) {
                String text = cell == null ? "" : cell.getText();
                row.add(CellNormalizer.normalize(LINE_BREAKS.matcher(text == null ? "" : text).replaceAll("")));
            }
            rows.add(row);
        }
        return new SourceTable(rows, sourceUrl, page, order);
    }
}
