package com.techstock.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one CSV import run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportReport {

    private int rowsRead;
    private int imported;
    private int skipped;
    private int subscriptionsCreated;
    private int resourceGroupsCreated;
    private int applicationsCreated;
    private long durationMs;
}
