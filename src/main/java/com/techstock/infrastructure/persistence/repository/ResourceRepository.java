package com.techstock.infrastructure.persistence.repository;

import com.techstock.infrastructure.persistence.entity.ResourceEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for resource lookups and the unscoped dashboard aggregates.
 *
 * Filtered, sorted and paginated queries go through
 * {@link com.techstock.infrastructure.persistence.ResourceStore}.
 */
@Repository
public interface ResourceRepository extends JpaRepository<ResourceEntity, Long> {

    List<ResourceEntity> findBySubscriptionIdOrderByIdAsc(Long subscriptionId);

    List<ResourceEntity> findByResourceGroupIdOrderByIdAsc(Long resourceGroupId);

    boolean existsByResourceGroupId(Long resourceGroupId);

    @Query("SELECT r FROM ResourceEntity r WHERE r.id IN (" +
           "SELECT l.resourceId FROM ResourceApplicationLinkEntity l " +
           "WHERE l.applicationId = :applicationId) " +
           "ORDER BY r.id ASC")
    List<ResourceEntity> findByApplicationId(@Param("applicationId") Long applicationId);

    /**
     * Tag blobs for the tag index, bounded by the pageable.
     */
    @Query("SELECT r.tagsJson FROM ResourceEntity r WHERE r.tagsJson IS NOT NULL ORDER BY r.id ASC")
    List<String> findTagBlobs(Pageable pageable);

    @Query("SELECT DISTINCT r.resourceType FROM ResourceEntity r ORDER BY r.resourceType ASC")
    List<String> findDistinctResourceTypes();

    /**
     * Global aggregation by resource type.
     *
     * These three group-by queries back the unscoped dashboard and are
     * cached by the dashboard service.
     */
    @Query("SELECT r.resourceType, COUNT(r) FROM ResourceEntity r " +
           "GROUP BY r.resourceType " +
           "ORDER BY COUNT(r) DESC, r.resourceType ASC")
    List<Object[]> countByResourceType();

    @Query("SELECT r.location, COUNT(r) FROM ResourceEntity r " +
           "GROUP BY r.location " +
           "ORDER BY COUNT(r) DESC, r.location ASC")
    List<Object[]> countByLocation();

    @Query("SELECT r.environment, COUNT(r) FROM ResourceEntity r " +
           "GROUP BY r.environment " +
           "ORDER BY COUNT(r) DESC, r.environment ASC")
    List<Object[]> countByEnvironment();
}
