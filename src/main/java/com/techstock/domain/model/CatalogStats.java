package com.techstock.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogStats {

    private long totalResources;
    private long totalSubscriptions;
    private long totalResourceGroups;
    private long totalApplications;
}
