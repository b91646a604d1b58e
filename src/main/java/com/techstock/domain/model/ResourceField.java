package com.techstock.domain.model;

import com.techstock.domain.exception.InvalidInputException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Resource attributes a query may filter or sort on.
 *
 * {@link #getAttribute()} is the persistent attribute name; the aliases are
 * the spellings accepted in the {@code sortField} request parameter.
 */
public enum ResourceField {
    ID("id", "id"),
    EXTERNAL_ID("externalId", "external_id", "externalid", "azure_id"),
    NAME("name", "name"),
    RESOURCE_TYPE("resourceType", "type", "resource_type", "resourcetype"),
    KIND("kind", "kind"),
    LOCATION("location", "location"),
    SUBSCRIPTION_ID("subscriptionId", "subscription_id", "subscriptionid"),
    RESOURCE_GROUP_ID("resourceGroupId", "resource_group_id", "resourcegroupid"),
    VENDOR("vendor", "vendor"),
    ENVIRONMENT("environment", "environment"),
    PROVISIONER("provisioner", "provisioner"),
    CREATED_AT("createdAt", "created_at", "createdat"),
    UPDATED_AT("updatedAt", "updated_at", "updatedat");

    public static final ResourceField DEFAULT_SORT = CREATED_AT;

    /** Columns covered by the free-text {@code search} filter. */
    public static final List<ResourceField> SEARCHABLE = List.of(
            NAME, RESOURCE_TYPE, EXTERNAL_ID, LOCATION, VENDOR, ENVIRONMENT);

    private final String attribute;
    private final List<String> aliases;

    ResourceField(String attribute, String... aliases) {
        this.attribute = attribute;
        this.aliases = Arrays.asList(aliases);
    }

    public String getAttribute() {
        return attribute;
    }

    /**
     * Resolves a caller-supplied sort field. Blank means the default
     * (creation time); unknown names are rejected.
     */
    public static ResourceField fromSortParameter(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_SORT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ResourceField field : values()) {
            if (field.attribute.toLowerCase(Locale.ROOT).equals(normalized)
                    || field.aliases.contains(normalized)) {
                return field;
            }
        }
        throw new InvalidInputException("Unsupported sort field: " + value);
    }
}
