package com.seibun.backend.services.extraction;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Service;

import com.seibun.backend.config.IngestionProperties;
import com.seibun.backend.services.tables.SourceTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the bordered tables ("table.b-on") of an e-Gov style law page.
 *
 * Header rows are returned as they are; dropping them is the row classifier's job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HtmlTableExtractor implements TableExtractor {

    static final List<String> CONTENTS_SELECTORS = List.of(
            "html > body.body > div.wrapper > div.main > div#contents",
            "html > body.body > div.wrapper > div.main > div.contents",
            "#contents",
            ".contents"
    );

    private static final String WRAPPERS = "div.table_wrpper, div.table_wrapper, div.table-wrapper";

    private final DocumentFetcher documentFetcher;
    private final IngestionProperties ingestionProperties;

    @Override
    public SourceKind kind() {
        return SourceKind.HTML;
    }

    @Override
    public List<SourceTable> extract(String url, String pages) {
        Document document = load(url);

        if (ingestionProperties.isIframeFirst()) {
            Element iframe = document.selectFirst("iframe[src]");
            if (iframe != null) {
                String innerUrl = iframe.absUrl("src");
                if (!innerUrl.isBlank()) {
                    log.info("[HtmlTables] Following iframe {}", innerUrl);
                    document = load(innerUrl);
                }
            }
        }

        return extractFromDocument(document, url);
    }

    public List<SourceTable> extractFromDocument(Document document, String sourceUrl) {
        Element contents = pickContentsNode(document);
        if (contents == null) {
            throw new HtmlStructureException("Contents node (id=contents / class=contents) not found: " + sourceUrl);
        }

        List<SourceTable> tables = new ArrayList<>();
        int order = 0;
        for (Element table : collectTables(contents)) {
            List<List<String>> rows = new ArrayList<>();
            for (Element tr : classlessRows(table)) {
                rows.add(cellTexts(tr));
            }
            tables.add(new SourceTable(rows, sourceUrl, 0, order++));
        }

        log.info("[HtmlTables] Found {} table(s) in {}", tables.size(), sourceUrl);
        return tables;
    }

    private Document load(String url) {
        byte[] bytes = documentFetcher.fetchBytes(url);
        try {
            // null charset: jsoup sniffs BOM / meta charset (the pages are often Shift_JIS)
            return Jsoup.parse(new ByteArrayInputStream(bytes), null, url);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse HTML from " + url, e);
        }
    }

    static Element pickContentsNode(Document document) {
        for (String selector : CONTENTS_SELECTORS) {
            Element node = document.selectFirst(selector);
            if (node != null) return node;
        }
        return null;
    }

    static List<Element> collectTables(Element contents) {
        List<Element> tables = new ArrayList<>();
        Elements blocks = contents.select("> div[id]");
        if (blocks.isEmpty()) {
            blocks = contents.select("div[id]");
        }
        for (Element block : blocks) {
            for (Element frame : block.select("div.table_frame")) {
                Elements wrappers = frame.select(WRAPPERS);
                if (wrappers.isEmpty()) {
                    tables.addAll(frame.select("table.b-on"));
                    continue;
                }
                for (Element wrapper : wrappers) {
                    tables.addAll(wrapper.select("table.b-on"));
                }
            }
        }
        return tables;
    }

    static List<Element> classlessRows(Element table) {
        Element body = table.selectFirst("> tbody");
        if (body == null) body = table;

        List<Element> rows = new ArrayList<>();
        for (Element child : body.children()) {
            if (!child.normalName().equals("tr")) continue;
            if (!child.className().isEmpty()) continue;
            rows.add(child);
        }
        return rows;
    }

    static List<String> cellTexts(Element tr) {
        List<String> cells = new ArrayList<>();
        for (Element td : tr.children()) {
            if (!td.normalName().equals("td")) continue;
            List<String> texts = new ArrayList<>();
            for (Element p : td.select("p")) {
                String text = p.text().replace('\u3000', ' ').trim();
                if (!text.isEmpty()) texts.add(text);
            }
            cells.add(String.join(" ", texts));
        }
        return cells;
    }
}
