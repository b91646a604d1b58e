package com.techstock.domain.service;

import com.techstock.domain.exception.AlreadyExistsException;
import com.techstock.domain.exception.BusinessRuleViolationException;
import com.techstock.domain.exception.NotFoundException;
import com.techstock.domain.model.CreateResourceGroupRequest;
import com.techstock.domain.model.UpdateResourceGroupRequest;
import com.techstock.infrastructure.persistence.entity.ResourceGroupEntity;
import com.techstock.infrastructure.persistence.repository.ResourceGroupRepository;
import com.techstock.infrastructure.persistence.repository.ResourceRepository;
import com.techstock.infrastructure.persistence.repository.SubscriptionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResourceGroupServiceTest {

    @Mock
    private ResourceGroupRepository resourceGroupRepository;

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private ResourceRepository resourceRepository;

    private ResourceGroupService resourceGroupService;

    @BeforeEach
    void setUp() {
        resourceGroupService = new ResourceGroupService(resourceGroupRepository, subscriptionRepository,
                resourceRepository);
    }

    @Test
    void testCreate_DuplicateNameInSameSubscription() {
        // Given
        when(subscriptionRepository.existsById(1L)).thenReturn(true);
        when(resourceGroupRepository.findByNameAndSubscriptionId("rg-web", 1L))
                .thenReturn(Optional.of(group(7L, "rg-web", 1L)));

        // When / Then
        assertThrows(AlreadyExistsException.class, () -> resourceGroupService.createResourceGroup(
                new CreateResourceGroupRequest("rg-web", 1L)));
        verify(resourceGroupRepository, never()).save(any());
    }

    @Test
    void testCreate_SameNameInOtherSubscription() {
        // Given
        when(subscriptionRepository.existsById(2L)).thenReturn(true);
        when(resourceGroupRepository.findByNameAndSubscriptionId("rg-web", 2L)).thenReturn(Optional.empty());
        when(resourceGroupRepository.save(any(ResourceGroupEntity.class))).thenAnswer(invocation -> {
            ResourceGroupEntity saved = invocation.getArgument(0);
            saved.setId(8L);
            return saved;
        });

        // When
        ResourceGroupEntity created = resourceGroupService.createResourceGroup(
                new CreateResourceGroupRequest("rg-web", 2L));

        // Then
        assertEquals(8L, created.getId());
        assertEquals(2L, created.getSubscriptionId());
    }

    @Test
    void testCreate_UnknownSubscription() {
        // Given
        when(subscriptionRepository.existsById(3L)).thenReturn(false);

        // When / Then
        assertThrows(NotFoundException.class, () -> resourceGroupService.createResourceGroup(
                new CreateResourceGroupRequest("rg", 3L)));
        verifyNoInteractions(resourceGroupRepository);
    }

    @Test
    void testUpdate_RenameKeepsOwnName() {
        // Given
        ResourceGroupEntity existing = group(7L, "rg-web", 1L);
        when(resourceGroupRepository.findById(7L)).thenReturn(Optional.of(existing));
        when(subscriptionRepository.existsById(1L)).thenReturn(true);
        when(resourceGroupRepository.findByNameAndSubscriptionId("rg-web", 1L)).thenReturn(Optional.of(existing));
        when(resourceGroupRepository.save(existing)).thenReturn(existing);

        // When
        ResourceGroupEntity updated = resourceGroupService.updateResourceGroup(7L,
                new UpdateResourceGroupRequest("rg-web", null));

        // Then
        assertEquals("rg-web", updated.getName());
    }

    @Test
    void testUpdate_MoveRefusedWhileResourcesRemain() {
        // Given
        ResourceGroupEntity existing = group(7L, "rg-web", 1L);
        when(resourceGroupRepository.findById(7L)).thenReturn(Optional.of(existing));
        when(subscriptionRepository.existsById(2L)).thenReturn(true);
        when(resourceRepository.existsByResourceGroupId(7L)).thenReturn(true);

        // When / Then
        assertThrows(BusinessRuleViolationException.class, () -> resourceGroupService.updateResourceGroup(7L,
                new UpdateResourceGroupRequest(null, 2L)));
        assertEquals(1L, existing.getSubscriptionId());
        verify(resourceGroupRepository, never()).save(any());
    }

    @Test
    void testUpdate_MoveEmptyGroup() {
        // Given
        ResourceGroupEntity existing = group(7L, "rg-web", 1L);
        when(resourceGroupRepository.findById(7L)).thenReturn(Optional.of(existing));
        when(subscriptionRepository.existsById(2L)).thenReturn(true);
        when(resourceRepository.existsByResourceGroupId(7L)).thenReturn(false);
        when(resourceGroupRepository.findByNameAndSubscriptionId("rg-web", 2L)).thenReturn(Optional.empty());
        when(resourceGroupRepository.save(existing)).thenReturn(existing);

        // When
        ResourceGroupEntity updated = resourceGroupService.updateResourceGroup(7L,
                new UpdateResourceGroupRequest(null, 2L));

        // Then
        assertEquals(2L, updated.getSubscriptionId());
    }

    @Test
    void testDelete_RefusedWhileResourcesRemain() {
        // Given
        when(resourceGroupRepository.findById(7L)).thenReturn(Optional.of(group(7L, "rg", 1L)));
        when(resourceRepository.existsByResourceGroupId(7L)).thenReturn(true);

        // When / Then
        assertThrows(BusinessRuleViolationException.class, () -> resourceGroupService.deleteResourceGroup(7L));
        verify(resourceGroupRepository, never()).delete(any());
    }

    @Test
    void testDelete_EmptyGroup() {
        // Given
        ResourceGroupEntity existing = group(7L, "rg", 1L);
        when(resourceGroupRepository.findById(7L)).thenReturn(Optional.of(existing));
        when(resourceRepository.existsByResourceGroupId(7L)).thenReturn(false);

        // When
        resourceGroupService.deleteResourceGroup(7L);

        // Then
        verify(resourceGroupRepository).delete(existing);
    }

    private static ResourceGroupEntity group(Long id, String name, Long subscriptionId) {
        return ResourceGroupEntity.builder().id(id).name(name).subscriptionId(subscriptionId).build();
    }
}
