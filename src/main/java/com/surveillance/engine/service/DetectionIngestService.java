package com.surveillance.engine.service;

import com.surveillance.engine.dto.DetectionRecord;
import com.surveillance.engine.dto.DetectionRequest;
import com.surveillance.engine.entity.DetectionPattern;
import com.surveillance.engine.event.DetectionCreatedEvent;
import com.surveillance.engine.exception.StorageException;
import com.surveillance.engine.repository.DetectionPatternRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Persists incoming detections and announces each one with a {@link DetectionCreatedEvent}.
 *
 * The event is delivered after commit, which is what makes this the change trigger
 * for the {@link DetectionEventHandler}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DetectionIngestService {

    private final DetectionPatternRepository detectionRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public DetectionPattern ingest(DetectionRequest request) {
        DetectionPattern saved;
        try {
            saved = detectionRepository.save(request.toEntity(clock.instant()));
        } catch (DataAccessException e) {
            throw StorageException.translate("store detection", e);
        }

        eventPublisher.publishEvent(new DetectionCreatedEvent(saved.getId(), DetectionRecord.fromEntity(saved)));
        log.debug("Stored detection {} ({})", saved.getId(), saved.getSpecies());
        return saved;
    }
}
