package com.techstock.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceStatistics {

    private List<DimensionCount> byType;
    private List<DimensionCount> byLocation;
    private List<DimensionCount> byEnvironment;
}
