package com.techstock.domain.exception;

public class InternalException extends CatalogException {

    public InternalException(String message) {
        super("Internal error: " + message);
    }

    public InternalException(String message, Throwable cause) {
        super("Internal error: " + message, cause);
    }
}
