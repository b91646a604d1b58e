package com.techstock.domain.service;

import com.techstock.domain.exception.AlreadyExistsException;
import com.techstock.domain.exception.BusinessRuleViolationException;
import com.techstock.domain.exception.InvalidInputException;
import com.techstock.domain.exception.NotFoundException;
import com.techstock.domain.model.CreateResourceGroupRequest;
import com.techstock.domain.model.PagedResult;
import com.techstock.domain.model.Pagination;
import com.techstock.domain.model.PaginationParams;
import com.techstock.domain.model.UpdateResourceGroupRequest;
import com.techstock.infrastructure.persistence.entity.ResourceGroupEntity;
import com.techstock.infrastructure.persistence.repository.ResourceGroupRepository;
import com.techstock.infrastructure.persistence.repository.ResourceRepository;
import com.techstock.infrastructure.persistence.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Resource group use cases. Names are unique per subscription, so the same
 * name may exist under different subscriptions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResourceGroupService {

    private final ResourceGroupRepository resourceGroupRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final ResourceRepository resourceRepository;

    @Transactional
    public ResourceGroupEntity createResourceGroup(CreateResourceGroupRequest request) {
        requireName(request.getName());
        requireSubscription(request.getSubscriptionId());
        requireUniqueName(request.getName(), request.getSubscriptionId(), null);

        ResourceGroupEntity group = resourceGroupRepository.save(ResourceGroupEntity.builder()
                .name(request.getName())
                .subscriptionId(request.getSubscriptionId())
                .build());

        log.info("Resource group created: {} ({} in subscription {})",
                group.getId(), group.getName(), group.getSubscriptionId());
        return group;
    }

    @Transactional(readOnly = true)
    public ResourceGroupEntity getResourceGroup(Long id) {
        return resourceGroupRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("ResourceGroup", id));
    }

    @Transactional(readOnly = true)
    public PagedResult<ResourceGroupEntity> listResourceGroups(PaginationParams pagination) {
        if (pagination.getOffset() > Integer.MAX_VALUE) {
            return new PagedResult<>(List.of(),
                    Pagination.of(pagination.getPage(), pagination.getSize(), resourceGroupRepository.count()));
        }
        Page<ResourceGroupEntity> page = resourceGroupRepository.findAll(
                PageRequest.of(pagination.getPage() - 1, pagination.getSize(), Sort.by("id")));
        return new PagedResult<>(page.getContent(),
                Pagination.of(pagination.getPage(), pagination.getSize(), page.getTotalElements()));
    }

    @Transactional(readOnly = true)
    public List<ResourceGroupEntity> getResourceGroupsBySubscription(Long subscriptionId) {
        requireSubscription(subscriptionId);
        return resourceGroupRepository.findBySubscriptionIdOrderByNameAsc(subscriptionId);
    }

    /**
     * Moving a group to another subscription is refused while resources still
     * belong to it, since each resource records the subscription of its group.
     */
    @Transactional
    public ResourceGroupEntity updateResourceGroup(Long id, UpdateResourceGroupRequest request) {
        ResourceGroupEntity group = getResourceGroup(id);

        if (request.getName() != null) {
            requireName(request.getName());
        }
        Long subscriptionId = request.getSubscriptionId() != null
                ? request.getSubscriptionId()
                : group.getSubscriptionId();
        requireSubscription(subscriptionId);
        if (!subscriptionId.equals(group.getSubscriptionId()) && resourceRepository.existsByResourceGroupId(id)) {
            throw new BusinessRuleViolationException(
                    "Resource group " + id + " still has resources and cannot change subscription");
        }

        String name = request.getName() != null ? request.getName() : group.getName();
        if (request.getName() != null || request.getSubscriptionId() != null) {
            requireUniqueName(name, subscriptionId, id);
        }

        group.setName(name);
        group.setSubscriptionId(subscriptionId);

        log.info("Resource group updated: {}", id);
        return resourceGroupRepository.save(group);
    }

    /**
     * Deletion is refused while resources still belong to the group.
     */
    @Transactional
    public void deleteResourceGroup(Long id) {
        ResourceGroupEntity group = getResourceGroup(id);
        if (resourceRepository.existsByResourceGroupId(id)) {
            throw new BusinessRuleViolationException("Resource group " + id + " still has resources");
        }
        resourceGroupRepository.delete(group);
        log.info("Resource group deleted: {}", id);
    }

    private void requireSubscription(Long subscriptionId) {
        if (subscriptionId == null || !subscriptionRepository.existsById(subscriptionId)) {
            throw new NotFoundException("Subscription", subscriptionId);
        }
    }

    private void requireUniqueName(String name, Long subscriptionId, Long currentId) {
        resourceGroupRepository.findByNameAndSubscriptionId(name, subscriptionId)
                .filter(existing -> !existing.getId().equals(currentId))
                .ifPresent(existing -> {
                    throw new AlreadyExistsException("ResourceGroup", "name in subscription",
                            name + " in subscription " + subscriptionId);
                });
    }

    private static void requireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidInputException("Resource group name cannot be empty");
        }
    }
}
