package com.seibun.backend.services.sheets;

public class SheetStorageException extends RuntimeException {

    public SheetStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
