package com.techstock.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateResourceRequest {

    private String externalId;

    @NotBlank(message = "Name is required")
    private String name;

    @NotBlank(message = "Resource type is required")
    private String resourceType;

    private String kind;

    @NotBlank(message = "Location is required")
    private String location;

    @NotNull(message = "Subscription id is required")
    private Long subscriptionId;

    @NotNull(message = "Resource group id is required")
    private Long resourceGroupId;

    private Map<String, String> tags;
    private String extendedLocation;
    private String vendor;
    private String environment;
    private String provisioner;
}
