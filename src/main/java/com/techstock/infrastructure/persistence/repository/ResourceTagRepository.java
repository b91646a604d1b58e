package com.techstock.infrastructure.persistence.repository;

import com.techstock.infrastructure.persistence.entity.ResourceTagEntity;
import com.techstock.infrastructure.persistence.entity.ResourceTagId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ResourceTagRepository extends JpaRepository<ResourceTagEntity, ResourceTagId> {

    @Modifying
    @Query("DELETE FROM ResourceTagEntity t WHERE t.resourceId = :resourceId")
    int deleteByResourceId(@Param("resourceId") Long resourceId);
}
