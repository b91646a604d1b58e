package com.techstock.domain.model;

import com.techstock.infrastructure.persistence.entity.ResourceEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * API representation of a resource, with the tag blob decoded into a map.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceView {

    private Long id;
    private String externalId;
    private String name;
    private String resourceType;
    private String kind;
    private String location;
    private Long subscriptionId;
    private Long resourceGroupId;
    private Map<String, String> tags;
    private String extendedLocation;
    private String vendor;
    private String environment;
    private String provisioner;
    private Instant createdAt;
    private Instant updatedAt;

    public static ResourceView of(ResourceEntity entity, Map<String, String> tags) {
        return ResourceView.builder()
                .id(entity.getId())
                .externalId(entity.getExternalId())
                .name(entity.getName())
                .resourceType(entity.getResourceType())
                .kind(entity.getKind())
                .location(entity.getLocation())
                .subscriptionId(entity.getSubscriptionId())
                .resourceGroupId(entity.getResourceGroupId())
                .tags(tags)
                .extendedLocation(entity.getExtendedLocation())
                .vendor(entity.getVendor())
                .environment(entity.getEnvironment())
                .provisioner(entity.getProvisioner())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
