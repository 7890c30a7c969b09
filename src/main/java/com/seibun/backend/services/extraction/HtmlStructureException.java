package com.seibun.backend.services.extraction;

/**
 * The HTML page does not have the expected contents node.
 */
public class HtmlStructureException extends IllegalStateException {

    public HtmlStructureException(String message) {
        super(message);
    }
}
