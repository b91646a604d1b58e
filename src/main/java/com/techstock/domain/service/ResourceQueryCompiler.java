package com.techstock.domain.service;

import com.techstock.domain.model.DashboardFilters;
import com.techstock.domain.model.PaginationParams;
import com.techstock.domain.model.ResourceCriterion;
import com.techstock.domain.model.ResourceField;
import com.techstock.domain.model.ResourceFilters;
import com.techstock.domain.model.ResourceQuery;
import com.techstock.domain.model.SortParams;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns user filters, sort and pagination into a {@link ResourceQuery}.
 *
 * Compilation is pure and never fails on pagination input: page and size are
 * normalized by {@link PaginationParams}. Only an unknown sort field is
 * rejected.
 *
 * Filter semantics:
 * - resourceType: case-insensitive substring
 * - location, environment, vendor, subscriptionId, resourceGroupId: exact
 * - search: case-insensitive substring over name, type, external id,
 *   location, vendor, environment (OR); also enables relevance ordering
 * - tags: "k1:v1,k2:v2", OR-combined; a token without exactly one ':' is dropped
 */
@Component
public class ResourceQueryCompiler {

    public ResourceQuery compile(ResourceFilters filters, SortParams sort, PaginationParams pagination) {
        ResourceFilters safeFilters = filters != null ? filters : new ResourceFilters();
        SortParams safeSort = sort != null ? sort : new SortParams();
        PaginationParams safePagination = pagination != null ? pagination : new PaginationParams();

        String search = trimToNull(safeFilters.getSearch());

        return ResourceQuery.builder()
                .criteria(compileFilters(safeFilters))
                .relevanceTerm(search)
                .sortField(ResourceField.fromSortParameter(safeSort.getField()))
                .sortDirection(safeSort.getDirection())
                .page(safePagination.getPage())
                .size(safePagination.getSize())
                .build();
    }

    /**
     * Conjunction of criteria for the given filters, without ordering.
     */
    public List<ResourceCriterion> compileFilters(ResourceFilters filters) {
        List<ResourceCriterion> criteria = new ArrayList<>();

        String resourceType = trimToNull(filters.getResourceType());
        if (resourceType != null) {
            criteria.add(new ResourceCriterion.ContainsIgnoreCase(ResourceField.RESOURCE_TYPE, resourceType));
        }
        addEquals(criteria, ResourceField.LOCATION, trimToNull(filters.getLocation()));
        addEquals(criteria, ResourceField.ENVIRONMENT, trimToNull(filters.getEnvironment()));
        addEquals(criteria, ResourceField.VENDOR, trimToNull(filters.getVendor()));
        addEquals(criteria, ResourceField.SUBSCRIPTION_ID, filters.getSubscriptionId());
        addEquals(criteria, ResourceField.RESOURCE_GROUP_ID, filters.getResourceGroupId());

        String search = trimToNull(filters.getSearch());
        if (search != null) {
            criteria.add(new ResourceCriterion.AnyContainsIgnoreCase(ResourceField.SEARCHABLE, search));
        }

        List<ResourceCriterion.TagMatch> tags = parseTags(filters.getTags());
        if (!tags.isEmpty()) {
            criteria.add(new ResourceCriterion.AnyTag(tags));
        }
        return criteria;
    }

    /**
     * Dashboard scope as exact-match criteria, AND-combined.
     */
    public List<ResourceCriterion> compileScope(DashboardFilters scope) {
        List<ResourceCriterion> criteria = new ArrayList<>();
        if (scope == null) {
            return criteria;
        }
        addEquals(criteria, ResourceField.SUBSCRIPTION_ID, scope.getSubscriptionId());
        addEquals(criteria, ResourceField.RESOURCE_GROUP_ID, scope.getResourceGroupId());
        addEquals(criteria, ResourceField.LOCATION, scope.getLocation());
        addEquals(criteria, ResourceField.ENVIRONMENT, scope.getEnvironment());
        return criteria;
    }

    /**
     * Parses "key:value" tokens separated by commas. Key and value are
     * trimmed; tokens with zero or several ':' and tokens with an empty key
     * are skipped.
     */
    public List<ResourceCriterion.TagMatch> parseTags(String tags) {
        List<ResourceCriterion.TagMatch> matches = new ArrayList<>();
        if (tags == null || tags.isBlank()) {
            return matches;
        }
        for (String token : tags.split(",")) {
            String[] parts = token.split(":", -1);
            if (parts.length != 2) {
                continue;
            }
            String key = parts[0].trim();
            String value = parts[1].trim();
            if (key.isEmpty()) {
                continue;
            }
            matches.add(new ResourceCriterion.TagMatch(key, value));
        }
        return matches;
    }

    private static void addEquals(List<ResourceCriterion> criteria, ResourceField field, Object value) {
        if (value != null) {
            criteria.add(new ResourceCriterion.Equals(field, value));
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
