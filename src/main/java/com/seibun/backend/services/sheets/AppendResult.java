package com.seibun.backend.services.sheets;

/**
 * @param range A1 range written, empty when nothing was written
 */
public record AppendResult(
        String sheetTitle,
        int rowsWritten,
        String range
) {
    public static AppendResult nothing(String sheetTitle) {
        return new AppendResult(sheetTitle, 0, "");
    }
}
