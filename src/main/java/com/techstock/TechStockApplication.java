package com.techstock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Cloud resource catalog service.
 *
 * Features:
 * - Filtered, sorted, paginated resource queries with relevance ranking
 * - Dashboard rollups by type, location and environment
 * - Tag index and tag suggestions
 * - Redis-cached global aggregates behind a circuit breaker
 * - CSV import of Azure Resource Graph exports
 */
@SpringBootApplication
public class TechStockApplication {

    public static void main(String[] args) {
        SpringApplication.run(TechStockApplication.class, args);
    }
}
