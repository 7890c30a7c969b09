package com.seibun.backend.services.extraction;

import java.util.List;

import com.seibun.backend.services.tables.SourceTable;

/**
 * Locates the tables of one source document and returns their raw cell grids, ordered by
 * (page, position).
 */
public interface TableExtractor {

    SourceKind kind();

    /**
     * @param pages page selection, only meaningful for paginated sources
     */
    List<SourceTable> extract(String url, String pages);
}
