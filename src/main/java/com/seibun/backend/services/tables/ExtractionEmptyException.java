package com.seibun.backend.services.tables;

/**
 * Thrown when a run ends without a single table or without a single record to append.
 */
public class ExtractionEmptyException extends IllegalStateException {

    public ExtractionEmptyException(String message) {
        super(message);
    }
}
