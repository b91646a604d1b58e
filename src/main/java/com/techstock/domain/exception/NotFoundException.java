package com.techstock.domain.exception;

import lombok.Getter;

@Getter
public class NotFoundException extends CatalogException {

    private final String entity;
    private final String id;

    public NotFoundException(String entity, Object id) {
        super("Entity not found: " + entity + " with id " + id);
        this.entity = entity;
        this.id = String.valueOf(id);
    }
}
