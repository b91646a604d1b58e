package com.techstock.domain.exception;

/**
 * Base type for every error raised by the catalog core.
 *
 * All subclasses are recoverable per request; the web layer maps each one
 * to an HTTP status in {@link com.techstock.api.ApiExceptionHandler}.
 */
public abstract class CatalogException extends RuntimeException {

    protected CatalogException(String message) {
        super(message);
    }

    protected CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
