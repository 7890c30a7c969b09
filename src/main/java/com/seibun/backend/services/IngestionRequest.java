package com.seibun.backend.services;

/**
 * @param source "pdf", "html" or "auto"
 */
public record IngestionRequest(
        String url,
        String pages,
        String source
) {
}
