package com.techstock.domain.model;

public enum SortDirection {
    ASC,
    DESC;

    /**
     * Anything other than {@code desc} (case-insensitive) sorts ascending.
     */
    public static SortDirection fromParameter(String value) {
        if (value != null && value.trim().equalsIgnoreCase("desc")) {
            return DESC;
        }
        return ASC;
    }
}
