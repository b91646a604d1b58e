package com.techstock.domain.exception;

/**
 * Store-level failure. The message carries backend detail for logs only;
 * it is never returned to API callers.
 */
public class DatabaseException extends CatalogException {

    public DatabaseException(String message, Throwable cause) {
        super("Database error: " + message, cause);
    }
}
