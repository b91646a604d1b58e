package com.techstock.infrastructure.persistence.repository;

import com.techstock.infrastructure.persistence.entity.ResourceGroupEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ResourceGroupRepository extends JpaRepository<ResourceGroupEntity, Long> {

    Optional<ResourceGroupEntity> findByNameAndSubscriptionId(String name, Long subscriptionId);

    List<ResourceGroupEntity> findBySubscriptionIdOrderByNameAsc(Long subscriptionId);

    long countBySubscriptionId(Long subscriptionId);

    boolean existsBySubscriptionId(Long subscriptionId);
}
