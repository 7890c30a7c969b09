package com.seibun.backend.config;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Ingestion defaults. Loaded from application.properties with prefix "seibun.ingestion";
 * the command line can override the document URL, page selection and source kind.
 *
 * Example:
 * seibun.ingestion.document-url=https://www.mhlw.go.jp/content/000491511.pdf
 * seibun.ingestion.pages=2-12
 * seibun.ingestion.exclude-pages=1
 */
@Data
@ConfigurationProperties(prefix = "seibun.ingestion")
public class IngestionProperties {

    /**
     * Document fetched when no URL is given on the command line.
     */
    private String documentUrl = "https://www.mhlw.go.jp/content/000491511.pdf";

    /**
     * "pdf", "html" or "auto" (decided from the URL path).
     */
    private String source = "auto";

    /**
     * Page selection for PDFs: "all", "2-12", "2,4,9" or a mix like "1,3-5".
     */
    private String pages = "all";

    /**
     * 1-based PDF pages never handed to the table extractor.
     */
    private Set<Integer> excludePages = new LinkedHashSet<>();

    /**
     * When true the page selection is replaced by autoStartPage..last page.
     */
    private boolean autoPageRange = false;

    private int autoStartPage = 2;

    /**
     * Some HTML sources render the body inside an iframe; follow the first iframe[src].
     */
    private boolean iframeFirst = true;

    /**
     * Connect and read timeout of document downloads.
     */
    private int httpTimeoutSeconds = 30;

    /**
     * Share of integer-only cells (among non-empty cells) from which a row counts as pagination noise.
     */
    private double digitRowMinRatio = 0.8;

    public Duration httpTimeout() {
        return Duration.ofSeconds(httpTimeoutSeconds);
    }

    public String getDescription() {
        return String.format(
                "IngestionProperties{source=%s, pages=%s, exclude=%s, autoPageRange=%s, autoStart=%d, iframeFirst=%s, digitRatio=%.2f}",
                source,
                pages,
                excludePages,
                autoPageRange,
                autoStartPage,
                iframeFirst,
                digitRowMinRatio);
    }
}
