package com.techstock.domain.service;

import com.techstock.domain.exception.AlreadyExistsException;
import com.techstock.domain.exception.BusinessRuleViolationException;
import com.techstock.domain.exception.InvalidInputException;
import com.techstock.domain.exception.NotFoundException;
import com.techstock.domain.model.CreateSubscriptionRequest;
import com.techstock.domain.model.PagedResult;
import com.techstock.domain.model.Pagination;
import com.techstock.domain.model.PaginationParams;
import com.techstock.domain.model.UpdateSubscriptionRequest;
import com.techstock.infrastructure.persistence.entity.SubscriptionEntity;
import com.techstock.infrastructure.persistence.repository.ResourceGroupRepository;
import com.techstock.infrastructure.persistence.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final ResourceGroupRepository resourceGroupRepository;

    @Transactional
    public SubscriptionEntity createSubscription(CreateSubscriptionRequest request) {
        if (request.getName() == null || request.getName().trim().isEmpty()) {
            throw new InvalidInputException("Subscription name cannot be empty");
        }
        if (subscriptionRepository.findByName(request.getName()).isPresent()) {
            throw new AlreadyExistsException("Subscription", "name", request.getName());
        }

        SubscriptionEntity subscription = subscriptionRepository.save(SubscriptionEntity.builder()
                .name(request.getName())
                .tenantId(request.getTenantId())
                .build());

        log.info("Subscription created: {} ({})", subscription.getId(), subscription.getName());
        return subscription;
    }

    @Transactional(readOnly = true)
    public SubscriptionEntity getSubscription(Long id) {
        return subscriptionRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Subscription", id));
    }

    @Transactional(readOnly = true)
    public PagedResult<SubscriptionEntity> listSubscriptions(PaginationParams pagination) {
        if (pagination.getOffset() > Integer.MAX_VALUE) {
            return new PagedResult<>(List.of(),
                    Pagination.of(pagination.getPage(), pagination.getSize(), subscriptionRepository.count()));
        }
        Page<SubscriptionEntity> page = subscriptionRepository.findAll(
                PageRequest.of(pagination.getPage() - 1, pagination.getSize(), Sort.by("id")));
        return new PagedResult<>(page.getContent(),
                Pagination.of(pagination.getPage(), pagination.getSize(), page.getTotalElements()));
    }

    @Transactional
    public SubscriptionEntity updateSubscription(Long id, UpdateSubscriptionRequest request) {
        SubscriptionEntity subscription = getSubscription(id);

        if (request.getName() != null) {
            if (request.getName().trim().isEmpty()) {
                throw new InvalidInputException("Subscription name cannot be empty");
            }
            subscriptionRepository.findByName(request.getName())
                    .filter(existing -> !existing.getId().equals(id))
                    .ifPresent(existing -> {
                        throw new AlreadyExistsException("Subscription", "name", request.getName());
                    });
            subscription.setName(request.getName());
        }
        if (request.getTenantId() != null) {
            subscription.setTenantId(request.getTenantId());
        }

        log.info("Subscription updated: {}", id);
        return subscriptionRepository.save(subscription);
    }

    /**
     * Deletion is refused while resource groups still reference the
     * subscription.
     */
    @Transactional
    public void deleteSubscription(Long id) {
        SubscriptionEntity subscription = getSubscription(id);
        if (resourceGroupRepository.existsBySubscriptionId(id)) {
            throw new BusinessRuleViolationException(
                    "Subscription " + id + " still has resource groups");
        }
        subscriptionRepository.delete(subscription);
        log.info("Subscription deleted: {}", id);
    }
}
