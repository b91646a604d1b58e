package com.techstock.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateResourceGroupRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotNull(message = "Subscription id is required")
    private Long subscriptionId;
}
