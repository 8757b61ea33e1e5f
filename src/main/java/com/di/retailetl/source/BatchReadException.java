package com.di.retailetl.source;

/**
 * The raw batch could not be read at all (missing file, unreadable header, I/O failure).
 * Bad individual rows are not errors; they are rejected during validation.
 */
public class BatchReadException extends RuntimeException {

    public BatchReadException(String message) {
        super(message);
    }

    public BatchReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
