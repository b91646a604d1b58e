package com.techstock.domain.model;

import lombok.Value;

import java.util.List;

/**
 * One conjunct of a compiled resource query.
 *
 * The criteria are plain values; translating them into SQL (with bound
 * parameters) is the store's job.
 */
public interface ResourceCriterion {

    /** Exact match on a single attribute. */
    @Value
    class Equals implements ResourceCriterion {
        ResourceField field;
        Object value;
    }

    /** Case-insensitive substring match on a single attribute. */
    @Value
    class ContainsIgnoreCase implements ResourceCriterion {
        ResourceField field;
        String value;
    }

    /** Case-insensitive substring match on any of the given attributes (OR). */
    @Value
    class AnyContainsIgnoreCase implements ResourceCriterion {
        List<ResourceField> fields;
        String value;
    }

    /**
     * Matches when the resource carries at least one of the tags: same key
     * and a value containing the given value, case-insensitive.
     */
    @Value
    class AnyTag implements ResourceCriterion {
        List<TagMatch> tags;
    }

    @Value
    class TagMatch {
        String key;
        String value;
    }
}
