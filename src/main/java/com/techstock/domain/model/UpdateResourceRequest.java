package com.techstock.domain.model;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Partial update: every non-null field overwrites, null fields are left
 * untouched. A non-null {@code tags} map replaces the whole tag set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateResourceRequest {

    private String externalId;

    @Size(min = 1, message = "Name cannot be empty")
    private String name;

    @Size(min = 1, message = "Resource type cannot be empty")
    private String resourceType;

    private String kind;

    @Size(min = 1, message = "Location cannot be empty")
    private String location;

    private Long subscriptionId;
    private Long resourceGroupId;
    private Map<String, String> tags;
    private String extendedLocation;
    private String vendor;
    private String environment;
    private String provisioner;
}
