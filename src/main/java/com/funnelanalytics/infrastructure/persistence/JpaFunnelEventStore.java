package com.funnelanalytics.infrastructure.persistence;

import com.funnelanalytics.domain.exception.StorageFailureException;
import com.funnelanalytics.domain.model.FunnelEvent;
import com.funnelanalytics.domain.model.TimeWindow;
import com.funnelanalytics.domain.store.FunnelEventStore;
import com.funnelanalytics.infrastructure.persistence.entity.FunnelEventEntity;
import com.funnelanalytics.infrastructure.persistence.repository.FunnelEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaFunnelEventStore implements FunnelEventStore {

    private final FunnelEventRepository eventRepository;
    private final JsonColumnMapper jsonColumnMapper;

    @Override
    @Transactional(readOnly = true)
    public List<FunnelEvent> queryEvents(UUID funnelId, String sessionId, TimeWindow window) {
        try {
            long startTime = System.currentTimeMillis();

            List<FunnelEvent> events = eventRepository.findEventsInWindow(
                            funnelId, sessionId, window.getStart(), window.getEnd())
                    .stream()
                    .map(this::toDomain)
                    .toList();

            log.debug("Fetched {} events for funnel {} in {} ms",
                    events.size(), funnelId, System.currentTimeMillis() - startTime);
            return events;

        } catch (DataAccessException e) {
            log.error("Error querying events for funnel {}: {}", funnelId, e.getMessage(), e);
            throw new StorageFailureException("Event store unavailable", e);
        }
    }

    @Override
    @Transactional
    public FunnelEvent appendEvent(FunnelEvent event) {
        try {
            FunnelEventEntity saved = eventRepository.save(FunnelEventEntity.builder()
                    .ownerId(event.getOwnerId())
                    .funnelId(event.getFunnelId())
                    .sessionId(event.getSessionId())
                    .step(event.getStep())
                    .stepNumber(event.getStepNumber())
                    .timestamp(event.getTimestamp())
                    .metadata(jsonColumnMapper.writeMap(event.getMetadata()))
                    .build());
            return toDomain(saved);

        } catch (DataAccessException e) {
            log.error("Error appending event to funnel {}: {}", event.getFunnelId(), e.getMessage(), e);
            throw new StorageFailureException("Event store unavailable", e);
        }
    }

    private FunnelEvent toDomain(FunnelEventEntity entity) {
        return FunnelEvent.builder()
                .id(entity.getId())
                .ownerId(entity.getOwnerId())
                .funnelId(entity.getFunnelId())
                .sessionId(entity.getSessionId())
                .step(entity.getStep())
                .stepNumber(entity.getStepNumber())
                .timestamp(entity.getTimestamp())
                .metadata(jsonColumnMapper.readMap(entity.getMetadata(), entity.getId()))
                .build();
    }
}
