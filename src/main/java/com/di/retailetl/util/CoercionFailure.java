package com.di.retailetl.util;

/**
 * A value could not be converted to its column's semantic type deterministically.
 * The cleaner turns this into a {@code repair_failed} rejection; it never leaves the core.
 */
public class CoercionFailure extends Exception {

    public CoercionFailure(String message) {
        super(message);
    }

    public CoercionFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
