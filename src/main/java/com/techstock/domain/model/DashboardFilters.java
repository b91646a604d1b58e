package com.techstock.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dashboard scope. Blank strings count as absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardFilters {

    private Long subscriptionId;
    private Long resourceGroupId;
    private String location;
    private String environment;

    public String getLocation() {
        return blankToNull(location);
    }

    public String getEnvironment() {
        return blankToNull(environment);
    }

    public boolean hasScope() {
        return subscriptionId != null
                || resourceGroupId != null
                || getLocation() != null
                || getEnvironment() != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
