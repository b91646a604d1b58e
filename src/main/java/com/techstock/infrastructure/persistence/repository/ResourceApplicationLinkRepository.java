package com.techstock.infrastructure.persistence.repository;

import com.techstock.infrastructure.persistence.entity.ResourceApplicationLinkEntity;
import com.techstock.infrastructure.persistence.entity.ResourceApplicationLinkId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ResourceApplicationLinkRepository
        extends JpaRepository<ResourceApplicationLinkEntity, ResourceApplicationLinkId> {

    @Modifying
    @Query("DELETE FROM ResourceApplicationLinkEntity l WHERE l.resourceId = :resourceId")
    int deleteByResourceId(@Param("resourceId") Long resourceId);

    @Modifying
    @Query("DELETE FROM ResourceApplicationLinkEntity l WHERE l.applicationId = :applicationId")
    int deleteByApplicationId(@Param("applicationId") Long applicationId);
}
