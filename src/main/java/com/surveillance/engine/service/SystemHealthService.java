package com.surveillance.engine.service;

import com.surveillance.engine.config.SurveillanceProperties;
import com.surveillance.engine.entity.SystemStatus;
import com.surveillance.engine.exception.StorageException;
import com.surveillance.engine.repository.SystemStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Liveness heartbeat. A successful write to {@code system_status/health} is the proof
 * that the store is reachable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SystemHealthService {

    static final String HEALTH_DOCUMENT = "health";
    static final String OPERATIONAL = "operational";

    private final SystemStatusRepository statusRepository;
    private final SurveillanceProperties properties;
    private final Clock clock;

    public SystemStatus recordHeartbeat() {
        SystemStatus heartbeat = SystemStatus.builder()
            .name(HEALTH_DOCUMENT)
            .status(OPERATIONAL)
            .lastCheck(clock.instant())
            .functionsActive(true)
            .projectId(properties.getProjectId())
            .build();

        try {
            SystemStatus saved = statusRepository.save(heartbeat);
            log.debug("Health heartbeat recorded at {}", saved.getLastCheck());
            return saved;
        } catch (DataAccessException e) {
            throw StorageException.translate("write health heartbeat", e);
        }
    }
}
