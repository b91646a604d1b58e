package com.techstock.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cataloged cloud resource.
 *
 * Tags are kept twice: the whole map as a JSON blob in {@code tags_json}
 * (read by the tag index and returned to clients) and one
 * {@link ResourceTagEntity} row per key for tag filtering.
 *
 * Indexing Strategy:
 * - type, location, environment: dashboard group-by and equality filters
 * - vendor: equality filter
 * - subscription_id, resource_group_id: scope filters and ownership lookups
 */
@Entity
@Table(name = "resource", indexes = {
    @Index(name = "idx_resource_type", columnList = "type"),
    @Index(name = "idx_resource_location", columnList = "location"),
    @Index(name = "idx_resource_vendor", columnList = "vendor"),
    @Index(name = "idx_resource_environment", columnList = "environment"),
    @Index(name = "idx_resource_subscription", columnList = "subscription_id"),
    @Index(name = "idx_resource_group", columnList = "resource_group_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // ARM resource id when known
    @Column(name = "azure_id", unique = true)
    private String externalId;

    @Column(nullable = false)
    private String name;

    @Column(name = "type", nullable = false)
    private String resourceType;

    private String kind;

    @Column(nullable = false)
    private String location;

    @Column(name = "subscription_id", nullable = false)
    private Long subscriptionId;

    @Column(name = "resource_group_id", nullable = false)
    private Long resourceGroupId;

    @Column(name = "tags_json", columnDefinition = "TEXT")
    private String tagsJson;

    @Column(name = "extended_location")
    private String extendedLocation;

    private String vendor;

    private String environment;

    private String provisioner;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
