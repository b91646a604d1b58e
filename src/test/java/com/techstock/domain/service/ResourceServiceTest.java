package com.techstock.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.techstock.domain.exception.BusinessRuleViolationException;
import com.techstock.domain.exception.InvalidInputException;
import com.techstock.domain.exception.NotFoundException;
import com.techstock.domain.model.CreateResourceRequest;
import com.techstock.domain.model.LinkApplicationRequest;
import com.techstock.domain.model.PagedResult;
import com.techstock.domain.model.PaginationParams;
import com.techstock.domain.model.ResourceFilters;
import com.techstock.domain.model.ResourcePage;
import com.techstock.domain.model.ResourceQuery;
import com.techstock.domain.model.ResourceView;
import com.techstock.domain.model.SortParams;
import com.techstock.domain.model.UpdateResourceRequest;
import com.techstock.infrastructure.persistence.ResourceStore;
import com.techstock.infrastructure.persistence.entity.ResourceApplicationLinkEntity;
import com.techstock.infrastructure.persistence.entity.ResourceEntity;
import com.techstock.infrastructure.persistence.entity.ResourceGroupEntity;
import com.techstock.infrastructure.persistence.repository.ApplicationRepository;
import com.techstock.infrastructure.persistence.repository.ResourceApplicationLinkRepository;
import com.techstock.infrastructure.persistence.repository.ResourceGroupRepository;
import com.techstock.infrastructure.persistence.repository.ResourceRepository;
import com.techstock.infrastructure.persistence.repository.ResourceTagRepository;
import com.techstock.infrastructure.persistence.repository.SubscriptionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ResourceService.
 *
 * Checks run before writes; listing wires compiler, store and pagination.
 */
@ExtendWith(MockitoExtension.class)
class ResourceServiceTest {

    @Mock
    private ResourceRepository resourceRepository;

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private ResourceGroupRepository resourceGroupRepository;

    @Mock
    private ApplicationRepository applicationRepository;

    @Mock
    private ResourceTagRepository resourceTagRepository;

    @Mock
    private ResourceApplicationLinkRepository linkRepository;

    @Mock
    private ResourceStore resourceStore;

    @Mock
    private DashboardService dashboardService;

    private MeterRegistry meterRegistry;
    private ResourceService resourceService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        resourceService = new ResourceService(resourceRepository, subscriptionRepository, resourceGroupRepository,
                applicationRepository, resourceTagRepository, linkRepository, resourceStore,
                new ResourceQueryCompiler(), new TagCodec(new ObjectMapper()), dashboardService, meterRegistry);
    }

    @Test
    void testListResources_BuildsPagination() {
        // Given
        ResourceEntity vm = resource(1L, "vm1");
        vm.setTagsJson("{\"Env\":\"prod\"}");
        when(resourceStore.query(any(ResourceQuery.class))).thenReturn(new ResourcePage(List.of(vm), 45));

        // When
        PagedResult<ResourceView> result = resourceService.listResources(
                ResourceFilters.builder().search("vm").build(), new SortParams(), PaginationParams.of(2, 20));

        // Then
        assertEquals(1, result.getItems().size());
        assertEquals(Map.of("Env", "prod"), result.getItems().get(0).getTags());
        assertEquals(2, result.getPagination().getPage());
        assertEquals(45, result.getPagination().getTotal());
        assertEquals(3, result.getPagination().getTotalPages());

        ArgumentCaptor<ResourceQuery> captor = ArgumentCaptor.forClass(ResourceQuery.class);
        verify(resourceStore).query(captor.capture());
        assertEquals(20, captor.getValue().getOffset());
        assertEquals("vm", captor.getValue().getRelevanceTerm());
        assertEquals(1.0, meterRegistry.counter("catalog.query.executed", "type", "resources").count());
    }

    @Test
    void testListResources_UnknownSortField() {
        assertThrows(InvalidInputException.class, () -> resourceService.listResources(
                null, new SortParams("bogus", null), null));
        verifyNoInteractions(resourceStore);
    }

    @Test
    void testCreateResource_Success() {
        // Given
        CreateResourceRequest request = createRequest();
        when(subscriptionRepository.existsById(1L)).thenReturn(true);
        when(resourceGroupRepository.findById(2L)).thenReturn(Optional.of(group(2L, 1L)));
        when(resourceRepository.save(any(ResourceEntity.class))).thenAnswer(invocation -> {
            ResourceEntity saved = invocation.getArgument(0);
            saved.setId(10L);
            return saved;
        });

        // When
        ResourceView view = resourceService.createResource(request);

        // Then
        assertEquals(10L, view.getId());
        assertEquals(Map.of("Env", "prod"), view.getTags());
        verify(resourceTagRepository).deleteByResourceId(10L);
        verify(resourceTagRepository).saveAll(anyList());
        verify(dashboardService).evictGlobalCounts();
    }

    @Test
    void testCreateResource_BlankName() {
        // Given
        CreateResourceRequest request = createRequest();
        request.setName("   ");

        // When / Then
        assertThrows(InvalidInputException.class, () -> resourceService.createResource(request));
        verifyNoInteractions(resourceRepository, dashboardService);
    }

    @Test
    void testCreateResource_MissingSubscription() {
        // Given
        when(subscriptionRepository.existsById(1L)).thenReturn(false);

        // When / Then
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> resourceService.createResource(createRequest()));
        assertEquals("Subscription", e.getEntity());
        verify(resourceRepository, never()).save(any());
    }

    @Test
    void testCreateResource_GroupFromOtherSubscription() {
        // Given
        when(subscriptionRepository.existsById(1L)).thenReturn(true);
        when(resourceGroupRepository.findById(2L)).thenReturn(Optional.of(group(2L, 99L)));

        // When / Then
        assertThrows(BusinessRuleViolationException.class,
                () -> resourceService.createResource(createRequest()));
        verify(resourceRepository, never()).save(any());
    }

    @Test
    void testUpdateResource_NotFound() {
        // Given
        when(resourceRepository.findById(42L)).thenReturn(Optional.empty());

        // When / Then
        assertThrows(NotFoundException.class, () -> resourceService.updateResource(42L,
                UpdateResourceRequest.builder().name("renamed").build()));
        verify(resourceRepository, never()).saveAndFlush(any());
        verifyNoInteractions(dashboardService);
    }

    @Test
    void testUpdateResource_AppliesOnlyProvidedFields() {
        // Given
        ResourceEntity existing = resource(5L, "vm-old");
        existing.setLocation("eastus");
        when(resourceRepository.findById(5L)).thenReturn(Optional.of(existing));
        when(resourceRepository.saveAndFlush(existing)).thenReturn(existing);

        // When
        ResourceView view = resourceService.updateResource(5L,
                UpdateResourceRequest.builder().name("vm-new").build());

        // Then
        assertEquals("vm-new", view.getName());
        assertEquals("eastus", view.getLocation());
        verifyNoInteractions(resourceTagRepository);
        verify(dashboardService).evictGlobalCounts();
    }

    @Test
    void testDeleteResource_RemovesTagsAndLinks() {
        // Given
        ResourceEntity existing = resource(5L, "vm");
        when(resourceRepository.findById(5L)).thenReturn(Optional.of(existing));

        // When
        resourceService.deleteResource(5L);

        // Then
        verify(resourceTagRepository).deleteByResourceId(5L);
        verify(linkRepository).deleteByResourceId(5L);
        verify(resourceRepository).delete(existing);
        verify(dashboardService).evictGlobalCounts();
    }

    @Test
    void testLinkApplication_DefaultRelation() {
        // Given
        when(resourceRepository.findById(5L)).thenReturn(Optional.of(resource(5L, "vm")));
        when(applicationRepository.existsById(3L)).thenReturn(true);

        // When
        resourceService.linkApplication(5L, new LinkApplicationRequest(3L, null));

        // Then
        ArgumentCaptor<ResourceApplicationLinkEntity> captor =
                ArgumentCaptor.forClass(ResourceApplicationLinkEntity.class);
        verify(linkRepository).save(captor.capture());
        assertEquals("uses", captor.getValue().getRelationType());
        assertEquals(3L, captor.getValue().getApplicationId());
    }

    @Test
    void testGetResourcesByApplication_UnknownApplication() {
        // Given
        when(applicationRepository.existsById(8L)).thenReturn(false);

        // When / Then
        assertThrows(NotFoundException.class, () -> resourceService.getResourcesByApplication(8L));
        verify(resourceRepository, never()).findByApplicationId(any());
    }

    private static CreateResourceRequest createRequest() {
        return CreateResourceRequest.builder()
                .name("vm1")
                .resourceType("microsoft.compute/virtualmachines")
                .location("eastus")
                .subscriptionId(1L)
                .resourceGroupId(2L)
                .tags(Map.of("Env", "prod"))
                .build();
    }

    private static ResourceEntity resource(Long id, String name) {
        return ResourceEntity.builder()
                .id(id)
                .name(name)
                .resourceType("microsoft.compute/virtualmachines")
                .location("westus")
                .subscriptionId(1L)
                .resourceGroupId(2L)
                .build();
    }

    private static ResourceGroupEntity group(Long id, Long subscriptionId) {
        return ResourceGroupEntity.builder().id(id).name("rg").subscriptionId(subscriptionId).build();
    }
}
