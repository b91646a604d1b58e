package com.techstock.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resource group. Names are unique within a subscription only.
 */
@Entity
@Table(name = "resource_group",
        uniqueConstraints = @UniqueConstraint(name = "uk_resource_group_name",
                columnNames = {"subscription_id", "name"}),
        indexes = @Index(name = "idx_resource_group_subscription", columnList = "subscription_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceGroupEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "subscription_id", nullable = false)
    private Long subscriptionId;
}
