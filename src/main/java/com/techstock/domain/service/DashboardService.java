package com.techstock.domain.service;

import com.techstock.domain.model.BucketSummary;
import com.techstock.domain.model.CostSummary;
import com.techstock.domain.model.DashboardFilters;
import com.techstock.domain.model.DashboardSummary;
import com.techstock.domain.model.DimensionCount;
import com.techstock.domain.model.HealthSummary;
import com.techstock.domain.model.ResourceCriterion;
import com.techstock.domain.model.ResourceDimension;
import com.techstock.domain.model.ResourceStatistics;
import com.techstock.infrastructure.cache.QueryCacheService;
import com.techstock.infrastructure.persistence.ResourceStore;
import com.techstock.infrastructure.persistence.repository.ResourceGroupRepository;
import com.techstock.infrastructure.persistence.repository.ResourceRepository;
import com.techstock.infrastructure.persistence.repository.SubscriptionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Dashboard aggregation engine.
 *
 * Flow:
 * 1. No scope filter: per-dimension counts come from the global group-by
 *    queries, cached in Redis until the next resource mutation or TTL
 * 2. Any scope filter: each dimension is regrouped over the resources
 *    matching all active scope filters
 * 3. Totals and percentages are derived from the per-type counts
 *
 * The dimension queries and the totals are separate statements with no
 * shared snapshot, so the summary can be torn under concurrent writes.
 *
 * Health and cost figures are placeholders computed from the resource
 * total; there is no monitoring or billing source behind them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DashboardService {

    static final double HEALTHY_RATIO = 0.85;
    static final double WARNING_RATIO = 0.10;
    static final double CRITICAL_RATIO = 0.05;
    static final double COST_PER_RESOURCE = 12.50;
    static final String TOP_COST_DRIVER = "Virtual Machines";
    static final String NO_COST_DRIVER = "N/A";

    private static final String CACHE_NAMESPACE = "dashboard:counts";

    private final ResourceRepository resourceRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final ResourceGroupRepository resourceGroupRepository;
    private final ResourceStore resourceStore;
    private final ResourceQueryCompiler queryCompiler;
    private final QueryCacheService cacheService;
    private final MeterRegistry meterRegistry;

    @Value("${app.cache.ttl.global-counts:60}")
    private long globalCountsTtl = 60;

    public DashboardSummary getSummary(DashboardFilters filters) {
        Timer.Sample sample = Timer.start(meterRegistry);
        boolean scoped = filters != null && filters.hasScope();

        List<DimensionCount> typeCounts;
        List<DimensionCount> locationCounts;
        List<DimensionCount> environmentCounts;
        long totalSubscriptions;
        long totalResourceGroups;

        if (scoped) {
            List<ResourceCriterion> scope = queryCompiler.compileScope(filters);
            typeCounts = resourceStore.countBy(ResourceDimension.TYPE, scope);
            locationCounts = resourceStore.countBy(ResourceDimension.LOCATION, scope);
            environmentCounts = resourceStore.countBy(ResourceDimension.ENVIRONMENT, scope);

            totalSubscriptions = filters.getSubscriptionId() != null
                    ? 1
                    : subscriptionRepository.count();
            if (filters.getResourceGroupId() != null) {
                totalResourceGroups = 1;
            } else if (filters.getSubscriptionId() != null) {
                totalResourceGroups = resourceGroupRepository.countBySubscriptionId(filters.getSubscriptionId());
            } else {
                totalResourceGroups = resourceGroupRepository.count();
            }
        } else {
            typeCounts = globalCounts(ResourceDimension.TYPE);
            locationCounts = globalCounts(ResourceDimension.LOCATION);
            environmentCounts = globalCounts(ResourceDimension.ENVIRONMENT);
            totalSubscriptions = subscriptionRepository.count();
            totalResourceGroups = resourceGroupRepository.count();
        }

        long totalResources = typeCounts.stream().mapToLong(DimensionCount::getCount).sum();

        DashboardSummary summary = DashboardSummary.builder()
                .totalResources(totalResources)
                .totalSubscriptions(totalSubscriptions)
                .totalResourceGroups(totalResourceGroups)
                .totalLocations(locationCounts.size())
                .resourceTypes(toBuckets(typeCounts, totalResources))
                .locations(toBuckets(locationCounts, totalResources))
                .environments(toBuckets(environmentCounts, totalResources))
                .healthSummary(mockHealth(totalResources))
                .costSummary(mockCost(totalResources))
                .build();

        sample.stop(Timer.builder("catalog.query.latency")
                .tag("type", "dashboard")
                .tag("scoped", String.valueOf(scoped))
                .register(meterRegistry));

        log.info("Dashboard computed: {} resources, scoped={}", totalResources, scoped);
        return summary;
    }

    /**
     * Unscoped counts by type, location and environment.
     */
    public ResourceStatistics getStatistics() {
        return ResourceStatistics.builder()
                .byType(globalCounts(ResourceDimension.TYPE))
                .byLocation(globalCounts(ResourceDimension.LOCATION))
                .byEnvironment(globalCounts(ResourceDimension.ENVIRONMENT))
                .build();
    }

    /**
     * Drops the cached global counts. Called after every resource mutation.
     * Inside a transaction the eviction waits for commit, so a concurrent
     * dashboard read cannot re-cache counts the commit is about to change.
     */
    public void evictGlobalCounts() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    evictCachedCounts();
                }
            });
            return;
        }
        evictCachedCounts();
    }

    private void evictCachedCounts() {
        String[] keys = Arrays.stream(ResourceDimension.values())
                .map(dimension -> cacheService.key(CACHE_NAMESPACE, dimension))
                .toArray(String[]::new);
        cacheService.evict(keys);
    }

    List<DimensionCount> globalCounts(ResourceDimension dimension) {
        String cacheKey = cacheService.key(CACHE_NAMESPACE, dimension);

        Optional<DimensionCount[]> cached = cacheService.get(cacheKey, DimensionCount[].class);
        if (cached.isPresent()) {
            Counter.builder("catalog.cache")
                    .tag("result", "hit")
                    .register(meterRegistry)
                    .increment();
            return Arrays.asList(cached.get());
        }

        Counter.builder("catalog.cache")
                .tag("result", "miss")
                .register(meterRegistry)
                .increment();

        List<Object[]> rows = switch (dimension) {
            case TYPE -> resourceRepository.countByResourceType();
            case LOCATION -> resourceRepository.countByLocation();
            case ENVIRONMENT -> resourceRepository.countByEnvironment();
        };
        List<DimensionCount> counts = toCounts(rows);

        cacheService.put(cacheKey, counts, globalCountsTtl);
        return counts;
    }

    static List<DimensionCount> toCounts(List<Object[]> rows) {
        List<DimensionCount> counts = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            String label = row[0] != null ? row[0].toString() : ResourceDimension.UNKNOWN_LABEL;
            counts.add(new DimensionCount(label, ((Number) row[1]).longValue()));
        }
        return DimensionCount.mergeByLabel(counts);
    }

    /**
     * Percentage per bucket is count / total * 100 in single precision, or 0
     * when the total is 0.
     */
    static List<BucketSummary> toBuckets(List<DimensionCount> counts, long totalResources) {
        List<BucketSummary> buckets = new ArrayList<>(counts.size());
        for (DimensionCount count : counts) {
            float percentage = totalResources > 0
                    ? ((float) count.getCount() / (float) totalResources) * 100.0f
                    : 0.0f;
            buckets.add(new BucketSummary(count.getLabel(), count.getCount(), percentage));
        }
        return buckets;
    }

    static HealthSummary mockHealth(long totalResources) {
        return HealthSummary.builder()
                .healthy((long) (totalResources * HEALTHY_RATIO))
                .warning((long) (totalResources * WARNING_RATIO))
                .critical((long) (totalResources * CRITICAL_RATIO))
                .build();
    }

    static CostSummary mockCost(long totalResources) {
        return CostSummary.builder()
                .estimatedMonthlyCost(totalResources * COST_PER_RESOURCE)
                .topCostDriver(totalResources > 0 ? TOP_COST_DRIVER : NO_COST_DRIVER)
                .build();
    }
}
