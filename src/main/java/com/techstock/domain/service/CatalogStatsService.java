package com.techstock.domain.service;

import com.techstock.domain.exception.DatabaseException;
import com.techstock.domain.model.CatalogStats;
import com.techstock.domain.model.SystemHealth;
import com.techstock.infrastructure.persistence.repository.ApplicationRepository;
import com.techstock.infrastructure.persistence.repository.ResourceGroupRepository;
import com.techstock.infrastructure.persistence.repository.ResourceRepository;
import com.techstock.infrastructure.persistence.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Catalog-wide row counts and the database liveness probe.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogStatsService {

    static final String STATUS_HEALTHY = "healthy";

    private final ResourceRepository resourceRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final ResourceGroupRepository resourceGroupRepository;
    private final ApplicationRepository applicationRepository;
    private final JdbcTemplate jdbcTemplate;

    @Value("${app.version:0.0.1}")
    private String version = "0.0.1";

    @Transactional(readOnly = true)
    public CatalogStats getStats() {
        return CatalogStats.builder()
                .totalResources(resourceRepository.count())
                .totalSubscriptions(subscriptionRepository.count())
                .totalResourceGroups(resourceGroupRepository.count())
                .totalApplications(applicationRepository.count())
                .build();
    }

    /**
     * Fails with {@link DatabaseException} when the database does not answer.
     */
    public SystemHealth checkHealth() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException e) {
            log.error("Database health check failed", e);
            throw new DatabaseException("Database health check failed", e);
        }
        return SystemHealth.builder()
                .status(STATUS_HEALTHY)
                .timestamp(Instant.now())
                .version(version)
                .build();
    }
}
