package com.techstock.api;

import com.techstock.domain.model.DashboardFilters;
import com.techstock.domain.model.DashboardSummary;
import com.techstock.domain.service.DashboardService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboardService;

    /**
     * GET /api/v1/dashboard/summary?subscriptionId=1&resourceGroupId=2&location=eastus&environment=prod
     *
     * Without any scope parameter the counts come from the cached global
     * aggregates.
     */
    @GetMapping("/summary")
    public ResponseEntity<ApiResponse<DashboardSummary>> getSummary(
            @RequestParam(required = false) Long subscriptionId,
            @RequestParam(required = false) Long resourceGroupId,
            @RequestParam(required = false) String location,
            @RequestParam(required = false) String environment) {

        log.info("Dashboard summary: subscriptionId={}, resourceGroupId={}, location={}, environment={}",
                subscriptionId, resourceGroupId, location, environment);

        DashboardFilters filters = new DashboardFilters(subscriptionId, resourceGroupId, location, environment);
        return ResponseEntity.ok(ApiResponse.success(dashboardService.getSummary(filters)));
    }
}
