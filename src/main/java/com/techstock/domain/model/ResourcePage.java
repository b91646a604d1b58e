package com.techstock.domain.model;

import com.techstock.infrastructure.persistence.entity.ResourceEntity;
import lombok.Value;

import java.util.List;

/**
 * One page of resources plus the total number of rows matching the same
 * predicate.
 */
@Value
public class ResourcePage {

    List<ResourceEntity> records;
    long total;
}
