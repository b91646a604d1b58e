package com.techstock.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Dashboard rollup.
 *
 * The per-dimension aggregates are read with separate statements, so under
 * concurrent writes the figures may not describe one point in time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardSummary {

    private long totalResources;
    private long totalSubscriptions;
    private long totalResourceGroups;
    private long totalLocations;
    private List<BucketSummary> resourceTypes;
    private List<BucketSummary> locations;
    private List<BucketSummary> environments;
    private HealthSummary healthSummary;
    private CostSummary costSummary;
}
