package com.techstock.domain.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkApplicationRequest {

    public static final String DEFAULT_RELATION = "uses";

    @NotNull(message = "Application id is required")
    private Long applicationId;

    private String relationType;

    public String getRelationType() {
        return relationType == null || relationType.isBlank() ? DEFAULT_RELATION : relationType;
    }
}
