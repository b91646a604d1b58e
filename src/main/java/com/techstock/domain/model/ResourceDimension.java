package com.techstock.domain.model;

/**
 * Attributes the dashboard groups resources by.
 */
public enum ResourceDimension {
    TYPE(ResourceField.RESOURCE_TYPE),
    LOCATION(ResourceField.LOCATION),
    ENVIRONMENT(ResourceField.ENVIRONMENT);

    /** Label used for rows whose grouping attribute is null. */
    public static final String UNKNOWN_LABEL = "Unknown";

    private final ResourceField field;

    ResourceDimension(ResourceField field) {
        this.field = field;
    }

    public ResourceField getField() {
        return field;
    }
}
