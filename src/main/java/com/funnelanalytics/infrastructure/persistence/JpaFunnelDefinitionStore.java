package com.funnelanalytics.infrastructure.persistence;

import com.funnelanalytics.domain.exception.StorageFailureException;
import com.funnelanalytics.domain.model.FunnelDefinition;
import com.funnelanalytics.domain.store.FunnelDefinitionStore;
import com.funnelanalytics.infrastructure.persistence.entity.FunnelDefinitionEntity;
import com.funnelanalytics.infrastructure.persistence.repository.FunnelDefinitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaFunnelDefinitionStore implements FunnelDefinitionStore {

    private final FunnelDefinitionRepository definitionRepository;
    private final JsonColumnMapper jsonColumnMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<FunnelDefinition> getDefinition(UUID funnelId, UUID ownerId) {
        try {
            return definitionRepository.findByIdAndOwnerId(funnelId, ownerId)
                    .map(this::toDomain);
        } catch (DataAccessException e) {
            log.error("Error loading funnel definition {}: {}", funnelId, e.getMessage(), e);
            throw new StorageFailureException("Funnel definition store unavailable", e);
        }
    }

    private FunnelDefinition toDomain(FunnelDefinitionEntity entity) {
        return FunnelDefinition.builder()
                .id(entity.getId())
                .ownerId(entity.getOwnerId())
                .name(entity.getName())
                .description(entity.getDescription())
                .steps(jsonColumnMapper.readSteps(entity.getSteps(), entity.getId()))
                .trackingEnabled(entity.isTrackingEnabled())
                .metadata(jsonColumnMapper.readMap(entity.getMetadata(), entity.getId()))
                .build();
    }
}
