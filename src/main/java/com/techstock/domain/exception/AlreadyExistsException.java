package com.techstock.domain.exception;

import lombok.Getter;

@Getter
public class AlreadyExistsException extends CatalogException {

    private final String entity;
    private final String field;
    private final String value;

    public AlreadyExistsException(String entity, String field, Object value) {
        super("Entity already exists: " + entity + " with " + field + " = " + value);
        this.entity = entity;
        this.field = field;
        this.value = String.valueOf(value);
    }
}
