package com.funnelanalytics.infrastructure.persistence.repository;

import com.funnelanalytics.infrastructure.persistence.entity.FunnelDefinitionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface FunnelDefinitionRepository extends JpaRepository<FunnelDefinitionEntity, UUID> {

    Optional<FunnelDefinitionEntity> findByIdAndOwnerId(UUID id, UUID ownerId);
}
