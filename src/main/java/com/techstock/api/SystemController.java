package com.techstock.api;

import com.techstock.domain.model.CatalogStats;
import com.techstock.domain.model.SystemHealth;
import com.techstock.domain.service.CatalogStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class SystemController {

    private final CatalogStatsService catalogStatsService;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<SystemHealth>> health() {
        return ResponseEntity.ok(ApiResponse.success(catalogStatsService.checkHealth()));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<CatalogStats>> stats() {
        return ResponseEntity.ok(ApiResponse.success(catalogStatsService.getStats()));
    }
}
