package com.techstock.domain.service;

import com.techstock.domain.exception.BusinessRuleViolationException;
import com.techstock.domain.exception.InvalidInputException;
import com.techstock.domain.exception.NotFoundException;
import com.techstock.domain.model.CreateResourceRequest;
import com.techstock.domain.model.LinkApplicationRequest;
import com.techstock.domain.model.PagedResult;
import com.techstock.domain.model.Pagination;
import com.techstock.domain.model.PaginationParams;
import com.techstock.domain.model.ResourceFilters;
import com.techstock.domain.model.ResourcePage;
import com.techstock.domain.model.ResourceQuery;
import com.techstock.domain.model.ResourceView;
import com.techstock.domain.model.SortParams;
import com.techstock.domain.model.UpdateResourceRequest;
import com.techstock.infrastructure.persistence.ResourceStore;
import com.techstock.infrastructure.persistence.entity.ApplicationEntity;
import com.techstock.infrastructure.persistence.entity.ResourceApplicationLinkEntity;
import com.techstock.infrastructure.persistence.entity.ResourceApplicationLinkId;
import com.techstock.infrastructure.persistence.entity.ResourceEntity;
import com.techstock.infrastructure.persistence.entity.ResourceGroupEntity;
import com.techstock.infrastructure.persistence.entity.ResourceTagEntity;
import com.techstock.infrastructure.persistence.repository.ApplicationRepository;
import com.techstock.infrastructure.persistence.repository.ResourceApplicationLinkRepository;
import com.techstock.infrastructure.persistence.repository.ResourceGroupRepository;
import com.techstock.infrastructure.persistence.repository.ResourceRepository;
import com.techstock.infrastructure.persistence.repository.ResourceTagRepository;
import com.techstock.infrastructure.persistence.repository.SubscriptionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Resource use cases: query, CRUD, ownership lookups and application links.
 *
 * Existence and consistency checks run before anything is written, so a
 * failed check leaves the store untouched. Every mutation evicts the cached
 * dashboard counts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResourceService {

    private final ResourceRepository resourceRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final ResourceGroupRepository resourceGroupRepository;
    private final ApplicationRepository applicationRepository;
    private final ResourceTagRepository resourceTagRepository;
    private final ResourceApplicationLinkRepository linkRepository;
    private final ResourceStore resourceStore;
    private final ResourceQueryCompiler queryCompiler;
    private final TagCodec tagCodec;
    private final DashboardService dashboardService;
    private final MeterRegistry meterRegistry;

    @Value("${app.query.slow-threshold-ms:1000}")
    private long slowQueryThresholdMs = 1000;

    /**
     * Filtered, sorted, paginated resource listing. The total counts every
     * row matching the filters, independent of the page window.
     */
    @Transactional(readOnly = true)
    public PagedResult<ResourceView> listResources(ResourceFilters filters, SortParams sort,
                                                   PaginationParams pagination) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        ResourceQuery query = queryCompiler.compile(filters, sort, pagination);
        ResourcePage page = resourceStore.query(query);

        long queryTime = System.currentTimeMillis() - startTime;
        sample.stop(Timer.builder("catalog.query.latency")
                .tag("type", "resources")
                .register(meterRegistry));
        Counter.builder("catalog.query.executed")
                .tag("type", "resources")
                .register(meterRegistry)
                .increment();

        if (queryTime > slowQueryThresholdMs) {
            log.warn("Slow resource query: {} ms, {} criteria, page {}",
                    queryTime, query.getCriteria().size(), query.getPage());
        } else {
            log.info("Resource query executed: {} of {} rows, {} ms",
                    page.getRecords().size(), page.getTotal(), queryTime);
        }

        return new PagedResult<>(
                toViews(page.getRecords()),
                Pagination.of(query.getPage(), query.getSize(), page.getTotal()));
    }

    @Transactional(readOnly = true)
    public ResourceView getResource(Long id) {
        return toView(findResource(id));
    }

    @Transactional
    public ResourceView createResource(CreateResourceRequest request) {
        requireText(request.getName(), "Resource name cannot be empty");
        requireText(request.getResourceType(), "Resource type cannot be empty");
        requireText(request.getLocation(), "Location cannot be empty");
        requireOwnership(request.getSubscriptionId(), request.getResourceGroupId());

        ResourceEntity resource = ResourceEntity.builder()
                .externalId(request.getExternalId())
                .name(request.getName())
                .resourceType(request.getResourceType())
                .kind(request.getKind())
                .location(request.getLocation())
                .subscriptionId(request.getSubscriptionId())
                .resourceGroupId(request.getResourceGroupId())
                .tagsJson(tagCodec.encode(request.getTags()))
                .extendedLocation(request.getExtendedLocation())
                .vendor(request.getVendor())
                .environment(request.getEnvironment())
                .provisioner(request.getProvisioner())
                .build();

        resource = resourceRepository.save(resource);
        replaceTagRows(resource.getId(), request.getTags());
        dashboardService.evictGlobalCounts();

        log.info("Resource created: {} ({})", resource.getId(), resource.getName());
        return toView(resource);
    }

    /**
     * Applies the non-null fields of the request. {@code updatedAt} is
     * refreshed by the entity on flush.
     */
    @Transactional
    public ResourceView updateResource(Long id, UpdateResourceRequest request) {
        ResourceEntity resource = findResource(id);

        if (request.getName() != null) {
            requireText(request.getName(), "Resource name cannot be empty");
        }
        if (request.getResourceType() != null) {
            requireText(request.getResourceType(), "Resource type cannot be empty");
        }
        if (request.getLocation() != null) {
            requireText(request.getLocation(), "Location cannot be empty");
        }
        if (request.getSubscriptionId() != null || request.getResourceGroupId() != null) {
            requireOwnership(
                    request.getSubscriptionId() != null ? request.getSubscriptionId() : resource.getSubscriptionId(),
                    request.getResourceGroupId() != null ? request.getResourceGroupId() : resource.getResourceGroupId());
        }

        if (request.getExternalId() != null) resource.setExternalId(request.getExternalId());
        if (request.getName() != null) resource.setName(request.getName());
        if (request.getResourceType() != null) resource.setResourceType(request.getResourceType());
        if (request.getKind() != null) resource.setKind(request.getKind());
        if (request.getLocation() != null) resource.setLocation(request.getLocation());
        if (request.getSubscriptionId() != null) resource.setSubscriptionId(request.getSubscriptionId());
        if (request.getResourceGroupId() != null) resource.setResourceGroupId(request.getResourceGroupId());
        if (request.getExtendedLocation() != null) resource.setExtendedLocation(request.getExtendedLocation());
        if (request.getVendor() != null) resource.setVendor(request.getVendor());
        if (request.getEnvironment() != null) resource.setEnvironment(request.getEnvironment());
        if (request.getProvisioner() != null) resource.setProvisioner(request.getProvisioner());
        if (request.getTags() != null) {
            resource.setTagsJson(tagCodec.encode(request.getTags()));
            replaceTagRows(resource.getId(), request.getTags());
        }

        resource = resourceRepository.saveAndFlush(resource);
        dashboardService.evictGlobalCounts();

        log.info("Resource updated: {}", id);
        return toView(resource);
    }

    @Transactional
    public void deleteResource(Long id) {
        ResourceEntity resource = findResource(id);

        resourceTagRepository.deleteByResourceId(id);
        linkRepository.deleteByResourceId(id);
        resourceRepository.delete(resource);
        dashboardService.evictGlobalCounts();

        log.info("Resource deleted: {}", id);
    }

    @Transactional(readOnly = true)
    public List<ResourceView> getResourcesBySubscription(Long subscriptionId) {
        if (!subscriptionRepository.existsById(subscriptionId)) {
            throw new NotFoundException("Subscription", subscriptionId);
        }
        return toViews(resourceRepository.findBySubscriptionIdOrderByIdAsc(subscriptionId));
    }

    @Transactional(readOnly = true)
    public List<ResourceView> getResourcesByResourceGroup(Long resourceGroupId) {
        if (!resourceGroupRepository.existsById(resourceGroupId)) {
            throw new NotFoundException("ResourceGroup", resourceGroupId);
        }
        return toViews(resourceRepository.findByResourceGroupIdOrderByIdAsc(resourceGroupId));
    }

    @Transactional(readOnly = true)
    public List<ResourceView> getResourcesByApplication(Long applicationId) {
        if (!applicationRepository.existsById(applicationId)) {
            throw new NotFoundException("Application", applicationId);
        }
        return toViews(resourceRepository.findByApplicationId(applicationId));
    }

    @Transactional(readOnly = true)
    public List<String> getResourceTypes() {
        return resourceRepository.findDistinctResourceTypes();
    }

    @Transactional(readOnly = true)
    public List<ApplicationEntity> getApplications(Long resourceId) {
        findResource(resourceId);
        return applicationRepository.findByResourceId(resourceId);
    }

    @Transactional
    public void linkApplication(Long resourceId, LinkApplicationRequest request) {
        findResource(resourceId);
        if (!applicationRepository.existsById(request.getApplicationId())) {
            throw new NotFoundException("Application", request.getApplicationId());
        }
        linkRepository.save(ResourceApplicationLinkEntity.builder()
                .resourceId(resourceId)
                .applicationId(request.getApplicationId())
                .relationType(request.getRelationType())
                .build());
        log.info("Resource {} linked to application {} ({})",
                resourceId, request.getApplicationId(), request.getRelationType());
    }

    @Transactional
    public void unlinkApplication(Long resourceId, Long applicationId, String relationType) {
        String relation = relationType == null || relationType.isBlank()
                ? LinkApplicationRequest.DEFAULT_RELATION
                : relationType;
        ResourceApplicationLinkId linkId = new ResourceApplicationLinkId(resourceId, applicationId, relation);
        if (!linkRepository.existsById(linkId)) {
            throw new NotFoundException("ResourceApplicationLink", resourceId + "/" + applicationId + "/" + relation);
        }
        linkRepository.deleteById(linkId);
        log.info("Resource {} unlinked from application {} ({})", resourceId, applicationId, relation);
    }

    List<ResourceView> toViews(List<ResourceEntity> resources) {
        List<ResourceView> views = new ArrayList<>(resources.size());
        for (ResourceEntity resource : resources) {
            views.add(toView(resource));
        }
        return views;
    }

    private ResourceView toView(ResourceEntity resource) {
        return ResourceView.of(resource, tagCodec.decodeOrEmpty(resource.getTagsJson()));
    }

    private ResourceEntity findResource(Long id) {
        return resourceRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Resource", id));
    }

    /**
     * Subscription and resource group must exist and the group must belong
     * to the subscription.
     */
    private void requireOwnership(Long subscriptionId, Long resourceGroupId) {
        if (subscriptionId == null || !subscriptionRepository.existsById(subscriptionId)) {
            throw new NotFoundException("Subscription", subscriptionId);
        }
        ResourceGroupEntity group = resourceGroupId == null ? null
                : resourceGroupRepository.findById(resourceGroupId).orElse(null);
        if (group == null) {
            throw new NotFoundException("ResourceGroup", resourceGroupId);
        }
        if (!group.getSubscriptionId().equals(subscriptionId)) {
            throw new BusinessRuleViolationException("Resource group " + resourceGroupId
                    + " does not belong to subscription " + subscriptionId);
        }
    }

    private void replaceTagRows(Long resourceId, Map<String, String> tags) {
        resourceTagRepository.deleteByResourceId(resourceId);
        if (tags == null || tags.isEmpty()) {
            return;
        }
        resourceTagRepository.saveAll(tags.entrySet().stream()
                .map(tag -> ResourceTagEntity.builder()
                        .resourceId(resourceId)
                        .tagKey(tag.getKey())
                        .tagValue(tag.getValue())
                        .build())
                .collect(Collectors.toList()));
    }

    private static void requireText(String value, String message) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidInputException(message);
        }
    }
}
