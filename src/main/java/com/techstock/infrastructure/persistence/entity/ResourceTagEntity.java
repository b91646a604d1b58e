package com.techstock.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One tag of a resource, mirrored from the resource's JSON blob so tag
 * filters can run as indexed lookups.
 */
@Entity
@Table(name = "resource_tag", indexes = {
    @Index(name = "idx_resource_tag_key", columnList = "tag_key"),
    @Index(name = "idx_resource_tag_key_val", columnList = "tag_key,tag_value")
})
@IdClass(ResourceTagId.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceTagEntity {

    @Id
    @Column(name = "resource_id")
    private Long resourceId;

    @Id
    @Column(name = "tag_key")
    private String tagKey;

    @Column(name = "tag_value")
    private String tagValue;
}
