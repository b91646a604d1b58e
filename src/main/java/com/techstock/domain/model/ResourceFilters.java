package com.techstock.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * User-supplied resource filters.
 *
 * Every field is optional. {@code tags} is a comma-separated list of
 * {@code key:value} pairs; pairs are OR-combined with each other and
 * AND-combined with the remaining filters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceFilters {

    private String resourceType;
    private String location;
    private String environment;
    private String vendor;
    private Long subscriptionId;
    private Long resourceGroupId;
    private String search;
    private String tags;
}
