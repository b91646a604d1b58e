package com.techstock.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Placeholder health split. Values are synthetic (fixed ratios of the
 * resource total), not monitoring data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthSummary {

    private long healthy;
    private long warning;
    private long critical;
}
