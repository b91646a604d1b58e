package com.techstock.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Placeholder cost estimate. Values are synthetic, not billing data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostSummary {

    private double estimatedMonthlyCost;
    private String topCostDriver;
}
