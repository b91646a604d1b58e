package com.techstock.infrastructure.persistence.repository;

import com.techstock.infrastructure.persistence.entity.ApplicationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ApplicationRepository extends JpaRepository<ApplicationEntity, Long> {

    Optional<ApplicationEntity> findByCode(String code);

    List<ApplicationEntity> findByOwnerEmailOrderByIdAsc(String ownerEmail);

    @Query("SELECT a FROM ApplicationEntity a WHERE a.id IN (" +
           "SELECT l.applicationId FROM ResourceApplicationLinkEntity l " +
           "WHERE l.resourceId = :resourceId) " +
           "ORDER BY a.id ASC")
    List<ApplicationEntity> findByResourceId(@Param("resourceId") Long resourceId);
}
