package com.techstock.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Many-to-many "uses" relation between resources and applications, keyed by
 * (resource, application, relation type).
 */
@Entity
@Table(name = "resource_application_map", indexes = {
    @Index(name = "idx_resource_app_application", columnList = "application_id")
})
@IdClass(ResourceApplicationLinkId.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceApplicationLinkEntity {

    @Id
    @Column(name = "resource_id")
    private Long resourceId;

    @Id
    @Column(name = "application_id")
    private Long applicationId;

    @Id
    @Column(name = "relation_type", length = 50)
    private String relationType;
}
