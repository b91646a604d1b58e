package com.techstock.domain.exception;

public class InvalidInputException extends CatalogException {

    public InvalidInputException(String message) {
        super("Invalid input: " + message);
    }
}
