package com.techstock.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Storage-agnostic resource query: a conjunction of criteria, an ordering
 * and an offset/limit window.
 *
 * When {@code relevanceTerm} is set, rows are bucketed by how well their
 * name matches it (exact, prefix, substring, other) before the sort field
 * is applied.
 */
@Value
@Builder
public class ResourceQuery {

    @Singular("criterion")
    List<ResourceCriterion> criteria;

    String relevanceTerm;

    @Builder.Default
    ResourceField sortField = ResourceField.DEFAULT_SORT;

    @Builder.Default
    SortDirection sortDirection = SortDirection.ASC;

    int page;
    int size;

    public long getOffset() {
        return (long) (page - 1) * size;
    }
}
