package com.techstock.domain.service;

import com.techstock.domain.model.BucketSummary;
import com.techstock.domain.model.DashboardFilters;
import com.techstock.domain.model.DashboardSummary;
import com.techstock.domain.model.DimensionCount;
import com.techstock.domain.model.ResourceDimension;
import com.techstock.infrastructure.cache.QueryCacheService;
import com.techstock.infrastructure.persistence.ResourceStore;
import com.techstock.infrastructure.persistence.repository.ResourceGroupRepository;
import com.techstock.infrastructure.persistence.repository.ResourceRepository;
import com.techstock.infrastructure.persistence.repository.SubscriptionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DashboardService.
 *
 * Covers the scoped and unscoped paths, percentage math and the global
 * counts cache.
 */
@ExtendWith(MockitoExtension.class)
class DashboardServiceTest {

    @Mock
    private ResourceRepository resourceRepository;

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private ResourceGroupRepository resourceGroupRepository;

    @Mock
    private ResourceStore resourceStore;

    @Mock
    private QueryCacheService cacheService;

    private MeterRegistry meterRegistry;
    private DashboardService dashboardService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        dashboardService = new DashboardService(resourceRepository, subscriptionRepository,
                resourceGroupRepository, resourceStore, new ResourceQueryCompiler(), cacheService, meterRegistry);
    }

    @Test
    void testGetSummary_Unscoped() {
        // Given
        when(resourceRepository.countByResourceType()).thenReturn(rows(
                new Object[]{"vm", 6L}, new Object[]{"storage", 3L}, new Object[]{"disk", 1L}));
        when(resourceRepository.countByLocation()).thenReturn(rows(
                new Object[]{"eastus", 7L}, new Object[]{"westus", 3L}));
        when(resourceRepository.countByEnvironment()).thenReturn(rows(
                new Object[]{"prod", 8L}, new Object[]{null, 2L}));
        when(subscriptionRepository.count()).thenReturn(2L);
        when(resourceGroupRepository.count()).thenReturn(5L);

        // When
        DashboardSummary summary = dashboardService.getSummary(new DashboardFilters());

        // Then
        assertEquals(10, summary.getTotalResources());
        assertEquals(2, summary.getTotalSubscriptions());
        assertEquals(5, summary.getTotalResourceGroups());
        assertEquals(2, summary.getTotalLocations());
        assertEquals(60.0f, summary.getResourceTypes().get(0).getPercentage(), 0.001f);
        assertEquals("Unknown", summary.getEnvironments().get(1).getLabel());

        double percentageSum = summary.getResourceTypes().stream()
                .mapToDouble(BucketSummary::getPercentage)
                .sum();
        assertEquals(100.0, percentageSum, 0.01);

        assertEquals(8, summary.getHealthSummary().getHealthy());
        assertEquals(1, summary.getHealthSummary().getWarning());
        assertEquals(0, summary.getHealthSummary().getCritical());
        assertEquals(125.0, summary.getCostSummary().getEstimatedMonthlyCost(), 0.001);
        assertEquals("Virtual Machines", summary.getCostSummary().getTopCostDriver());

        verifyNoInteractions(resourceStore);
        verify(cacheService, times(3)).put(any(), anyList(), eq(60L));
    }

    @Test
    void testGetSummary_ScopedToSubscription() {
        // Given
        DashboardFilters filters = DashboardFilters.builder().subscriptionId(1L).build();
        when(resourceStore.countBy(eq(ResourceDimension.TYPE), anyList()))
                .thenReturn(List.of(new DimensionCount("vm", 4), new DimensionCount("disk", 1)));
        when(resourceStore.countBy(eq(ResourceDimension.LOCATION), anyList()))
                .thenReturn(List.of(new DimensionCount("eastus", 5)));
        when(resourceStore.countBy(eq(ResourceDimension.ENVIRONMENT), anyList()))
                .thenReturn(List.of());
        when(resourceGroupRepository.countBySubscriptionId(1L)).thenReturn(3L);

        // When
        DashboardSummary summary = dashboardService.getSummary(filters);

        // Then
        assertEquals(5, summary.getTotalResources());
        assertEquals(1, summary.getTotalSubscriptions());
        assertEquals(3, summary.getTotalResourceGroups());
        assertEquals(1, summary.getTotalLocations());
        assertEquals(80.0f, summary.getResourceTypes().get(0).getPercentage(), 0.001f);
        assertTrue(summary.getEnvironments().isEmpty());

        verify(subscriptionRepository, never()).count();
        verify(resourceGroupRepository, never()).count();
        verifyNoInteractions(cacheService);
    }

    @Test
    void testGetSummary_ScopedToResourceGroup() {
        // Given
        DashboardFilters filters = DashboardFilters.builder().subscriptionId(1L).resourceGroupId(9L).build();

        // When
        DashboardSummary summary = dashboardService.getSummary(filters);

        // Then
        assertEquals(1, summary.getTotalResourceGroups());
        verify(resourceGroupRepository, never()).countBySubscriptionId(any());
    }

    @Test
    void testGetSummary_EmptyCatalog() {
        // When
        DashboardSummary summary = dashboardService.getSummary(
                DashboardFilters.builder().location("nowhere").build());

        // Then
        assertEquals(0, summary.getTotalResources());
        assertTrue(summary.getResourceTypes().isEmpty());
        assertEquals(0.0, summary.getCostSummary().getEstimatedMonthlyCost(), 0.001);
        assertEquals("N/A", summary.getCostSummary().getTopCostDriver());
        assertEquals(0, summary.getHealthSummary().getHealthy());
    }

    @Test
    void testGlobalCounts_CacheHit() {
        // Given
        when(cacheService.get(any(), eq(DimensionCount[].class)))
                .thenReturn(Optional.of(new DimensionCount[]{new DimensionCount("vm", 3)}));

        // When
        List<DimensionCount> counts = dashboardService.globalCounts(ResourceDimension.TYPE);

        // Then
        assertEquals(1, counts.size());
        assertEquals(3, counts.get(0).getCount());
        verify(resourceRepository, never()).countByResourceType();
        verify(cacheService, never()).put(any(), any(), anyLong());
        assertEquals(1.0, meterRegistry.counter("catalog.cache", "result", "hit").count());
    }

    @Test
    void testToBuckets_ZeroTotal() {
        List<BucketSummary> buckets = DashboardService.toBuckets(
                List.of(new DimensionCount("vm", 0)), 0);

        assertEquals(0.0f, buckets.get(0).getPercentage());
    }

    @Test
    void testToCounts_MergesNullIntoStoredUnknown() {
        // When
        List<DimensionCount> counts = DashboardService.toCounts(rows(
                new Object[]{"prod", 3L}, new Object[]{"Unknown", 2L}, new Object[]{null, 2L}));

        // Then
        assertEquals(List.of(new DimensionCount("Unknown", 4), new DimensionCount("prod", 3)), counts);
    }

    @Test
    void testEvictGlobalCounts() {
        // Given
        when(cacheService.key(anyString(), any())).thenAnswer(invocation ->
                "techstock:" + invocation.getArgument(0) + ":" + invocation.getArgument(1));

        // When
        dashboardService.evictGlobalCounts();

        // Then
        verify(cacheService).evict(
                "techstock:dashboard:counts:TYPE",
                "techstock:dashboard:counts:LOCATION",
                "techstock:dashboard:counts:ENVIRONMENT");
    }

    @Test
    void testEvictGlobalCounts_WaitsForCommit() {
        // Given
        when(cacheService.key(anyString(), any())).thenAnswer(invocation ->
                "techstock:" + invocation.getArgument(0) + ":" + invocation.getArgument(1));
        TransactionSynchronizationManager.initSynchronization();
        try {
            // When
            dashboardService.evictGlobalCounts();

            // Then
            verifyNoInteractions(cacheService);

            TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);
            verify(cacheService).evict(
                    "techstock:dashboard:counts:TYPE",
                    "techstock:dashboard:counts:LOCATION",
                    "techstock:dashboard:counts:ENVIRONMENT");
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    private static List<Object[]> rows(Object[]... rows) {
        return new ArrayList<>(List.of(rows));
    }
}
