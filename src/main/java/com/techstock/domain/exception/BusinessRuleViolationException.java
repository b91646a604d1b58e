package com.techstock.domain.exception;

public class BusinessRuleViolationException extends CatalogException {

    public BusinessRuleViolationException(String message) {
        super("Business rule violation: " + message);
    }
}
